package com.phillippitts.sitedetect.service.metrics;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.DetectionStatus;
import com.phillippitts.sitedetect.domain.OrchestratorMetrics;
import com.phillippitts.sitedetect.domain.OrchestratorMetrics.EngineMetrics;
import com.phillippitts.sitedetect.domain.Priority;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Rolling call and request statistics.
 *
 * <p>Keeps one bounded {@link SampleWindow} per capability (engine calls) and one for whole
 * requests; {@link #snapshot()} derives {@link OrchestratorMetrics} from their current contents,
 * so figures cover only the most recent {@code windowSize} samples. Each window serializes on
 * itself, so capabilities never contend with each other.
 *
 * <p>Every sample is also exported through Micrometer under {@code sitedetect.*} for
 * /actuator/prometheus.
 */
public class MetricsCollector {

    private static final String METRIC_PREFIX = "sitedetect";

    record CallSample(double latencyMs, CallOutcome outcome, double confidence) {}

    record RequestSample(double latencyMs, DetectionStatus status) {}

    private final MeterRegistry registry;
    private final Map<Capability, SampleWindow<CallSample>> callWindows = new EnumMap<>(Capability.class);
    private final SampleWindow<RequestSample> requestWindow;

    public MetricsCollector(MeterRegistry registry, int windowSize) {
        this.registry = Objects.requireNonNull(registry, "registry");
        for (Capability c : Capability.values()) {
            callWindows.put(c, new SampleWindow<>(windowSize));
        }
        this.requestWindow = new SampleWindow<>(windowSize);
    }

    /**
     * Records an engine call without endpoint context.
     */
    public void record(Capability capability, CallOutcome outcome, long latencyMs) {
        recordCall(capability, null, null, outcome, latencyMs, Double.NaN);
    }

    /**
     * Records one engine call.
     *
     * @param endpoint engine endpoint, or null when unknown
     * @param modelVersion version that answered, or null when unknown
     * @param confidence engine confidence, or NaN for failed calls
     */
    public void recordCall(Capability capability, String endpoint, String modelVersion,
                           CallOutcome outcome, long latencyMs, double confidence) {
        callWindows.get(capability).add(new CallSample(latencyMs, outcome, confidence));

        Timer.builder(METRIC_PREFIX + ".engine.latency")
                .description("Engine call latency")
                .tag("capability", capability.wireName())
                .tag("outcome", outcome.tag())
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);

        Counter.builder(METRIC_PREFIX + ".engine.requests")
                .description("Engine calls by endpoint, model version and outcome")
                .tag("capability", capability.wireName())
                .tag("endpoint", endpoint == null ? "unknown" : endpoint)
                .tag("model_version", modelVersion == null ? "unknown" : modelVersion)
                .tag("outcome", outcome.tag())
                .register(registry)
                .increment();

        if (outcome == CallOutcome.SUCCESS && !Double.isNaN(confidence)) {
            DistributionSummary.builder(METRIC_PREFIX + ".engine.confidence")
                    .description("Confidence reported by engines")
                    .tag("capability", capability.wireName())
                    .register(registry)
                    .record(confidence);
        }
    }

    /**
     * Counts a call that failed fast because no breaker admitted it. Not part of the latency
     * window: no remote call was made.
     *
     * @param endpoint rejected endpoint, or null when every candidate was filtered out
     */
    public void recordRejection(Capability capability, String endpoint) {
        Counter.builder(METRIC_PREFIX + ".circuit.rejections")
                .description("Capability calls rejected without a remote call")
                .tag("capability", capability.wireName())
                .tag("endpoint", endpoint == null ? "none" : endpoint)
                .register(registry)
                .increment();
    }

    /** Records a completed request. */
    public void recordRequest(DetectionResponse response, Priority priority) {
        requestWindow.add(new RequestSample(response.totalProcessingTimeMs(), response.status()));
        Counter.builder(METRIC_PREFIX + ".requests")
                .description("Detection requests by final status")
                .tag("status", response.status().name().toLowerCase(Locale.ROOT))
                .tag("priority", (priority == null ? Priority.NORMAL : priority).name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /** Derives statistics from the current window contents. */
    public OrchestratorMetrics snapshot() {
        List<RequestSample> requests = requestWindow.toList();
        long completed = 0;
        long failed = 0;
        long partial = 0;
        double[] latencies = new double[requests.size()];
        double sum = 0.0;
        for (int i = 0; i < latencies.length; i++) {
            RequestSample s = requests.get(i);
            latencies[i] = s.latencyMs();
            sum += s.latencyMs();
            switch (s.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case PARTIAL -> partial++;
                default -> { }
            }
        }
        int total = requests.size();
        double[] p = Percentiles.p50p90p95(latencies);

        Map<Capability, EngineMetrics> engines = new EnumMap<>(Capability.class);
        callWindows.forEach((capability, window) -> {
            List<CallSample> samples = window.toList();
            if (!samples.isEmpty()) {
                engines.put(capability, engineMetrics(samples));
            }
        });

        return new OrchestratorMetrics(total, completed, failed, partial,
                total == 0 ? 0.0 : sum / total, p[0], p[1], p[2],
                total == 0 ? 0.0 : (double) failed / total,
                Collections.unmodifiableMap(engines));
    }

    private static EngineMetrics engineMetrics(List<CallSample> samples) {
        double[] latencies = new double[samples.size()];
        double latencySum = 0.0;
        double confidenceSum = 0.0;
        long confidenceCount = 0;
        long errors = 0;
        for (int i = 0; i < latencies.length; i++) {
            CallSample s = samples.get(i);
            latencies[i] = s.latencyMs();
            latencySum += s.latencyMs();
            if (s.outcome().failed()) {
                errors++;
            } else if (!Double.isNaN(s.confidence())) {
                confidenceSum += s.confidence();
                confidenceCount++;
            }
        }
        int n = samples.size();
        double[] p = Percentiles.p50p90p95(latencies);
        return new EngineMetrics(n, errors, (double) errors / n,
                confidenceCount == 0 ? 0.0 : confidenceSum / confidenceCount,
                latencySum / n, p[0], p[1], p[2]);
    }
}
