package com.phillippitts.sitedetect.service.orchestration;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.HealthSummary;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.domain.OrchestratorMetrics;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point used by the API layer.
 */
public interface DetectionOrchestrator {

    /**
     * Runs the full fan-out/aggregate cycle. Per-capability failures are reported in the
     * response, never thrown.
     *
     * @throws com.phillippitts.sitedetect.exception.InvalidDetectionRequestException for
     *         malformed caller input
     */
    DetectionResponse submit(DetectionRequest request, String correlationId);

    /**
     * @throws com.phillippitts.sitedetect.exception.RequestNotFoundException when the id is
     *         unknown or evicted
     */
    DetectionResponse getStatus(UUID requestId);

    HealthSummary getHealth();

    OrchestratorMetrics getMetrics();

    /** Every registered version per capability, disabled ones included. */
    Map<Capability, List<ModelVersion>> listModels();

    /**
     * Registers (or replaces) an A/B experiment.
     *
     * @throws com.phillippitts.sitedetect.exception.InvalidDetectionRequestException when the
     *         arms are unknown or the experiment is malformed
     */
    ABTestConfig createAbTest(String experimentId, String modelAKey, String modelBKey,
                              double trafficSplit, boolean enabled);

    List<ABTestConfig> listAbTests();

    /**
     * Enables or disables a registered model version.
     *
     * @return true when the version exists
     */
    boolean setModelEnabled(Capability capability, String name, String version, boolean enabled);
}
