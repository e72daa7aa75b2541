package com.phillippitts.sitedetect.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.DetectionResponse;
import com.phillippitts.sitedetect.domain.HealthSummary;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.domain.OrchestratorMetrics;
import com.phillippitts.sitedetect.exception.InvalidDetectionRequestException;
import com.phillippitts.sitedetect.service.orchestration.DetectionOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST surface of the detection orchestrator.
 *
 * <p>{@code POST /detect} always answers 200 with a response whose {@code status} tells full,
 * partial and total failure apart; only malformed input is rejected with 400.
 */
@RestController
@RequestMapping("/api/v1/orchestrator")
class OrchestratorController {

    private static final Logger LOG = LogManager.getLogger(OrchestratorController.class);

    static final String CORRELATION_HEADER = "X-Correlation-ID";

    private final DetectionOrchestrator orchestrator;

    OrchestratorController(DetectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/detect")
    ResponseEntity<DetectionResponse> detect(
            @Valid @RequestBody DetectionRequest request,
            @RequestHeader(value = CORRELATION_HEADER, required = false) String correlationId) {
        return ResponseEntity.ok(orchestrator.submit(request, correlationId));
    }

    @GetMapping("/status/{requestId}")
    ResponseEntity<DetectionResponse> status(@PathVariable UUID requestId) {
        return ResponseEntity.ok(orchestrator.getStatus(requestId));
    }

    @GetMapping("/health")
    ResponseEntity<HealthSummary> health() {
        return ResponseEntity.ok(orchestrator.getHealth());
    }

    @GetMapping("/metrics")
    ResponseEntity<OrchestratorMetrics> metrics() {
        return ResponseEntity.ok(orchestrator.getMetrics());
    }

    @GetMapping("/models")
    ResponseEntity<Map<Capability, List<ModelVersion>>> models() {
        return ResponseEntity.ok(orchestrator.listModels());
    }

    @PutMapping("/models/{capability}/{name}/{version}")
    ResponseEntity<Map<Capability, List<ModelVersion>>> setModelEnabled(
            @PathVariable String capability,
            @PathVariable String name,
            @PathVariable String version,
            @RequestParam boolean enabled) {
        Capability cap = Capability.fromWire(capability)
                .orElseThrow(() -> new InvalidDetectionRequestException("Unknown capability " + capability));
        if (!orchestrator.setModelEnabled(cap, name, version, enabled)) {
            return ResponseEntity.notFound().build();
        }
        LOG.info("Model {}:{} for {} set enabled={}", name, version, cap, enabled);
        return ResponseEntity.ok(orchestrator.listModels());
    }

    @GetMapping("/ab-tests")
    ResponseEntity<List<ABTestConfig>> abTests() {
        return ResponseEntity.ok(orchestrator.listAbTests());
    }

    @PostMapping("/ab-tests")
    ResponseEntity<ABTestConfig> createAbTest(@Valid @RequestBody AbTestRequest body) {
        ABTestConfig created = orchestrator.createAbTest(body.experimentId(), body.modelA(), body.modelB(),
                body.trafficSplit(), body.enabled() == null || body.enabled());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * Experiment registration body; arms are referenced as {@code name:version}.
     */
    record AbTestRequest(
            @JsonProperty("experiment_id") @NotBlank String experimentId,
            @JsonProperty("model_a") @NotBlank String modelA,
            @JsonProperty("model_b") @NotBlank String modelB,
            @JsonProperty("traffic_split") @DecimalMin("0.0") @DecimalMax("1.0") double trafficSplit,
            @JsonProperty("enabled") Boolean enabled
    ) {}
}
