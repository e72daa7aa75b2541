package com.phillippitts.sitedetect.service.engine;

import java.util.Map;

/**
 * Parsed success response of an inference engine.
 *
 * @param modelVersion version reported by the engine (or the selected version when absent)
 * @param confidence confidence in [0, 1]
 * @param payload structured engine output
 */
public record EngineReply(
        String modelVersion,
        double confidence,
        Map<String, Object> payload
) {}
