package com.phillippitts.sitedetect.domain;

import java.util.Collection;

/**
 * Lifecycle status of a detection request.
 *
 * <p>Responses returned by the dispatcher are always terminal: {@link #COMPLETED},
 * {@link #PARTIAL} or {@link #FAILED}. {@link #QUEUED} and {@link #PROCESSING} exist for callers
 * that track submissions of their own before a response is available.
 */
public enum DetectionStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    PARTIAL;

    /**
     * Derives the terminal status from per-capability results.
     *
     * @param results one result per requested capability
     * @return COMPLETED when none failed, FAILED when all failed, PARTIAL otherwise
     */
    public static DetectionStatus fromResults(Collection<EngineResult> results) {
        if (results.isEmpty()) {
            return FAILED;
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        if (failed == 0) {
            return COMPLETED;
        }
        return failed == results.size() ? FAILED : PARTIAL;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == PARTIAL;
    }
}
