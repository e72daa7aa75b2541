package com.phillippitts.sitedetect.service.engine;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;
import com.phillippitts.sitedetect.domain.ModelVersion;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything an engine client needs to perform one capability call.
 *
 * @param capability capability being requested
 * @param model selected model version; its endpoint is the call target
 * @param requestId orchestrator request id, forwarded as a header
 * @param correlationId correlation id, forwarded as a header
 * @param request original caller request (photo reference, priority, metadata)
 * @param parameters capability-specific parameters
 */
public record EngineCall(
        Capability capability,
        ModelVersion model,
        UUID requestId,
        String correlationId,
        DetectionRequest request,
        Map<String, Object> parameters
) {
    public EngineCall {
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(request, "request must not be null");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public String endpoint() {
        return model.endpoint();
    }
}
