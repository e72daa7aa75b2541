package com.phillippitts.sitedetect.service.engine;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.DetectionRequest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps each capability to the handler that derives its engine parameters from a request.
 *
 * <ul>
 *   <li>damage: {@code include_severity}, {@code include_segmentation} (metadata override)</li>
 *   <li>material: {@code enable_counting}, {@code enable_brand_detection}, optional
 *       {@code expected_quantity} from metadata</li>
 *   <li>volume: {@code save_depth_map} (metadata override, default false)</li>
 * </ul>
 */
public final class CapabilityParameterTable {

    private final Map<Capability, Function<DetectionRequest, Map<String, Object>>> handlers =
            new EnumMap<>(Capability.class);

    public CapabilityParameterTable() {
        handlers.put(Capability.DAMAGE, r -> {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("include_severity", true);
            p.put("include_segmentation", flag(r, "include_segmentation", true));
            return p;
        });
        handlers.put(Capability.MATERIAL, r -> {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("enable_counting", true);
            p.put("enable_brand_detection", true);
            Object expected = r.metadata().get("expected_quantity");
            if (expected instanceof Number n) {
                p.put("expected_quantity", n);
            }
            return p;
        });
        handlers.put(Capability.VOLUME, r -> {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("save_depth_map", flag(r, "save_depth_map", false));
            return p;
        });
    }

    /**
     * Parameters for a capability call; never null.
     */
    public Map<String, Object> parametersFor(Capability capability, DetectionRequest request) {
        Function<DetectionRequest, Map<String, Object>> handler = handlers.get(capability);
        return handler == null ? Map.of() : Collections.unmodifiableMap(handler.apply(request));
    }

    private static boolean flag(DetectionRequest request, String key, boolean defaultValue) {
        Object v = request.metadata().get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }
}
