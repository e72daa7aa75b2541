package com.phillippitts.sitedetect.service.engine;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.exception.EngineCallException;
import com.phillippitts.sitedetect.exception.EngineCallExceptionBuilder;
import com.phillippitts.sitedetect.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Map;

/**
 * Parses engine prediction bodies of the form
 * {@code {"model_version": "...", "confidence": 0.87, "results": {...}}}.
 *
 * <p>Missing {@code model_version} falls back to the selected version; missing {@code results}
 * yields an empty payload and a missing {@code confidence} reads as 0. A non-JSON body, a
 * non-object {@code results}, or a confidence that is not a number in [0, 1] is rejected as
 * malformed.
 */
final class EngineReplyParser {

    private static final int BODY_PREVIEW_CHARS = 120;

    private EngineReplyParser() {}

    static EngineReply parse(String body, String fallbackVersion, Capability capability, String endpoint) {
        if (body == null || body.isBlank()) {
            throw malformed("Empty engine response body", capability, endpoint, null, body);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(body);
        } catch (JSONException e) {
            throw malformed("Malformed engine payload", capability, endpoint, e, body);
        }

        double confidence = obj.has("confidence") ? obj.optDouble("confidence", Double.NaN) : 0.0;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw malformed("Engine confidence out of range", capability, endpoint, null,
                    String.valueOf(obj.opt("confidence")));
        }

        String version = obj.optString("model_version", "");
        if (version.isBlank()) {
            version = fallbackVersion;
        }

        Map<String, Object> payload = Map.of();
        if (obj.has("results") && !obj.isNull("results")) {
            JSONObject results = obj.optJSONObject("results");
            if (results == null) {
                throw malformed("Engine results must be an object", capability, endpoint, null, body);
            }
            payload = results.toMap();
        }
        return new EngineReply(version, confidence, payload);
    }

    private static EngineCallException malformed(String message, Capability capability, String endpoint,
                                                 Throwable cause, String preview) {
        return EngineCallExceptionBuilder.create(message)
                .capability(capability)
                .endpoint(endpoint)
                .cause(cause)
                .metadata("body", preview == null ? null : LogSanitizer.truncate(preview, BODY_PREVIEW_CHARS))
                .build();
    }
}
