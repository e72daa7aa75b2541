package com.phillippitts.sitedetect.service.dispatch;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.DetectionStatus;
import com.phillippitts.sitedetect.domain.EngineResult;
import com.phillippitts.sitedetect.exception.EngineCallException;
import com.phillippitts.sitedetect.exception.ErrorKind;
import com.phillippitts.sitedetect.exception.NoHealthyEngineException;
import com.phillippitts.sitedetect.exception.UnknownCapabilityException;
import com.phillippitts.sitedetect.service.balancer.EngineSelection;
import com.phillippitts.sitedetect.service.balancer.LoadBalancer;
import com.phillippitts.sitedetect.service.breaker.CircuitBreaker;
import com.phillippitts.sitedetect.service.breaker.CircuitBreakerRegistry;
import com.phillippitts.sitedetect.service.engine.CapabilityParameterTable;
import com.phillippitts.sitedetect.service.engine.EngineCall;
import com.phillippitts.sitedetect.service.engine.EngineReply;
import com.phillippitts.sitedetect.service.engine.InferenceEngineClient;
import com.phillippitts.sitedetect.service.history.RequestHistory;
import com.phillippitts.sitedetect.service.metrics.CallOutcome;
import com.phillippitts.sitedetect.service.metrics.MetricsCollector;
import com.phillippitts.sitedetect.util.LogSanitizer;
import com.phillippitts.sitedetect.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Default fan-out/aggregate implementation.
 *
 * <p><b>Thread model:</b> engine selection runs on the calling thread; each selected engine is
 * called on the detection executor under its own capability deadline. The calling thread then
 * waits for all capability futures, bounded by {@code request-timeout-ms}. Capabilities still
 * running at that point are reported as timeouts; their eventual results are discarded.
 *
 * <p><b>Feedback:</b> every remote call's outcome is reported exactly once to the endpoint's
 * circuit breaker and to {@link MetricsCollector}, from the completion stage of its future.
 * Rejected selections (no healthy engine) and calls the executor refuses only count as
 * rejections. Metrics are tagged with the selected model version, never the engine's echo.
 */
public class DefaultRequestDispatcher implements RequestDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultRequestDispatcher.class);

    static final String ALL_FAILED = "All detection engines failed";
    static final String CORRELATION_PREFIX = "orch-";
    static final String EXECUTOR_SATURATED = "detection executor saturated, call not sent";
    private static final int URL_PREVIEW_CHARS = 80;

    private final LoadBalancer balancer;
    private final CircuitBreakerRegistry breakers;
    private final InferenceEngineClient client;
    private final CapabilityParameterTable parameters;
    private final MetricsCollector metrics;
    private final RequestHistory history;
    private final Executor executor;
    private final OrchestratorProperties props;
    private final Clock clock;

    public DefaultRequestDispatcher(LoadBalancer balancer,
                                    CircuitBreakerRegistry breakers,
                                    InferenceEngineClient client,
                                    CapabilityParameterTable parameters,
                                    MetricsCollector metrics,
                                    RequestHistory history,
                                    Executor detectionExecutor,
                                    OrchestratorProperties props,
                                    Clock clock) {
        this.balancer = Objects.requireNonNull(balancer, "balancer");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.client = Objects.requireNonNull(client, "client");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.history = Objects.requireNonNull(history, "history");
        this.executor = Objects.requireNonNull(detectionExecutor, "detectionExecutor");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DetectionResponse process(DetectionRequest request, String correlationId) {
        Objects.requireNonNull(request, "request");
        long t0 = System.nanoTime();
        UUID requestId = UUID.randomUUID();
        String cid = correlationId == null || correlationId.isBlank()
                ? CORRELATION_PREFIX + requestId
                : correlationId;

        try (CloseableThreadContext.Instance ctx = CloseableThreadContext
                .put("correlationId", cid)
                .put("detectionRequestId", requestId.toString())) {
            LOG.info("Detection request {} for photo {} ({}) capabilities={} priority={}",
                    requestId, request.photoId(),
                    LogSanitizer.truncate(LogSanitizer.stripQuery(request.photoUrl()), URL_PREVIEW_CHARS),
                    request.capabilities(), request.priority());

            Map<Capability, CompletableFuture<EngineResult>> futures = new EnumMap<>(Capability.class);
            for (Capability capability : request.capabilities()) {
                futures.put(capability, start(capability, request, requestId, cid));
            }
            awaitAll(futures);

            Map<Capability, EngineResult> results = new EnumMap<>(Capability.class);
            Map<Capability, String> versions = new EnumMap<>(Capability.class);
            futures.forEach((capability, future) -> {
                EngineResult r = collect(capability, future);
                results.put(capability, r);
                if (!EngineResult.UNAVAILABLE.equals(r.modelVersion())) {
                    versions.put(capability, r.modelVersion());
                }
                if (!r.isSuccess()) {
                    LOG.warn("Capability {} failed for request {}: {}", capability, requestId, r.error());
                }
            });

            DetectionStatus status = DetectionStatus.fromResults(results.values());
            DetectionResponse response = new DetectionResponse(
                    requestId,
                    UUID.randomUUID(),
                    request.photoId(),
                    status,
                    results,
                    TimeUtils.elapsedMillis(t0),
                    versions,
                    cid,
                    clock.instant(),
                    status == DetectionStatus.FAILED ? ALL_FAILED : null);

            history.put(response);
            metrics.recordRequest(response, request.priority());
            LOG.info("Detection request {} finished {} in {} ms", requestId, status,
                    response.totalProcessingTimeMs());
            return response;
        }
    }

    /**
     * Selects an engine and starts its call. Selection failures resolve immediately without
     * a remote call.
     */
    private CompletableFuture<EngineResult> start(Capability capability, DetectionRequest request,
                                                  UUID requestId, String cid) {
        EngineSelection selection;
        try {
            selection = balancer.select(capability, request);
        } catch (NoHealthyEngineException e) {
            metrics.recordRejection(capability, null);
            return CompletableFuture.completedFuture(EngineResult.failure(capability, null, 0,
                    ErrorKind.NO_HEALTHY_ENGINE.describe(e.getMessage())));
        } catch (UnknownCapabilityException e) {
            return CompletableFuture.completedFuture(EngineResult.failure(capability, null, 0,
                    ErrorKind.UNKNOWN_CAPABILITY.describe(e.getMessage())));
        }

        EngineCall call = new EngineCall(capability, selection.model(), requestId, cid, request,
                parameters.parametersFor(capability, request));
        long timeoutMs = props.timeoutFor(capability);
        long c0 = System.nanoTime();
        CompletableFuture<EngineReply> remote;
        try {
            remote = CompletableFuture.supplyAsync(() -> client.predict(call), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return rejected(selection, e);
        }
        CompletableFuture<EngineResult> reported =
                remote.handle((reply, err) -> complete(selection, reply, err, c0, timeoutMs));
        // awaitAll may complete the returned stage at the request deadline; the reporting
        // stage must stay untouched so the late outcome still reaches breaker and metrics.
        return reported.thenApply(Function.identity());
    }

    /**
     * The executor refused the call: nothing reached the engine, so the breaker only gives back
     * its admission and the engine's failure count is left alone.
     */
    private CompletableFuture<EngineResult> rejected(EngineSelection selection, RejectedExecutionException e) {
        Capability capability = selection.model().capability();
        breakers.forEndpoint(selection.endpoint()).releasePermission();
        metrics.recordRejection(capability, selection.endpoint());
        LOG.warn("Detection executor rejected {} call to {}: {}", capability, selection.endpoint(), e.toString());
        return CompletableFuture.completedFuture(EngineResult.failure(capability, selection.model().version(), 0,
                ErrorKind.ENGINE_CALL_ERROR.describe(EXECUTOR_SATURATED)));
    }

    /** Reports the call outcome to breaker and metrics and converts it into a result. */
    private EngineResult complete(EngineSelection selection, EngineReply reply, Throwable err,
                                  long c0, long timeoutMs) {
        Capability capability = selection.model().capability();
        CircuitBreaker breaker = breakers.forEndpoint(selection.endpoint());
        long ms = TimeUtils.elapsedMillis(c0);
        String selectedVersion = selection.model().version();

        if (err == null) {
            breaker.recordSuccess();
            metrics.recordCall(capability, selection.endpoint(), selectedVersion,
                    CallOutcome.SUCCESS, ms, reply.confidence());
            boolean below = reply.confidence() < selection.model().confidenceThreshold();
            return EngineResult.success(capability, reply.modelVersion(), reply.confidence(),
                    reply.payload(), ms, below);
        }

        breaker.recordFailure();
        Throwable cause = unwrap(err);
        CallOutcome outcome;
        String error;
        if (cause instanceof TimeoutException) {
            outcome = CallOutcome.TIMEOUT;
            error = ErrorKind.ENGINE_TIMEOUT.describe("Deadline of " + timeoutMs + " ms exceeded");
        } else if (cause instanceof EngineCallException ece) {
            outcome = ece.kind() == ErrorKind.ENGINE_TIMEOUT ? CallOutcome.TIMEOUT : CallOutcome.ERROR;
            error = ece.kind().describe(ece.getMessage());
        } else {
            outcome = CallOutcome.ERROR;
            error = ErrorKind.ENGINE_CALL_ERROR.describe(cause.toString());
        }
        metrics.recordCall(capability, selection.endpoint(), selectedVersion, outcome, ms, Double.NaN);
        return EngineResult.failure(capability, selectedVersion, ms, error);
    }

    /**
     * Waits for every capability future, bounded by the request deadline. Futures still pending
     * afterwards are completed with a timeout result so their late outcome is discarded.
     */
    private void awaitAll(Map<Capability, CompletableFuture<EngineResult>> futures) {
        long deadlineMs = props.getRequestTimeoutMs();
        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Request deadline of {} ms exceeded; abandoning unfinished capabilities", deadlineMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capability calls");
        } catch (ExecutionException ee) {
            LOG.error("Capability future failed unexpectedly", ee.getCause());
        }
        futures.forEach((capability, future) -> future.complete(EngineResult.failure(capability, null,
                deadlineMs, ErrorKind.ENGINE_TIMEOUT.describe(
                        "request deadline of " + deadlineMs + " ms exceeded"))));
    }

    private static EngineResult collect(Capability capability, CompletableFuture<EngineResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            return EngineResult.failure(capability, null, 0, ErrorKind.ENGINE_CALL_ERROR.describe(cause.toString()));
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }
}
