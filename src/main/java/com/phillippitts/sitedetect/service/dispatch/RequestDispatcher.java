package com.phillippitts.sitedetect.service.dispatch;

import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;

/**
 * Fans a detection request out to one engine per requested capability and aggregates the
 * results into a single response.
 *
 * <p>Implementations never throw for per-capability failures: every requested capability gets
 * an {@link com.phillippitts.sitedetect.domain.EngineResult}, and the response status degrades
 * to PARTIAL or FAILED instead.
 */
public interface RequestDispatcher {

    /**
     * Processes a request end to end and stores the response in request history.
     *
     * @param request validated detection request
     * @param correlationId caller correlation id; generated when null or blank
     * @return the aggregated response
     */
    DetectionResponse process(DetectionRequest request, String correlationId);
}
