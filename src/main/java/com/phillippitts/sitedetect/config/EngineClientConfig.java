package com.phillippitts.sitedetect.config;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.service.engine.HttpInferenceEngineClient;
import com.phillippitts.sitedetect.service.engine.InferenceEngineClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * HTTP transport to the inference engines. Predictions use the longest configured capability
 * deadline as read timeout; probes use {@code health-check-timeout-ms}.
 */
@Configuration
public class EngineClientConfig {

    @Bean
    public InferenceEngineClient inferenceEngineClient(RestTemplateBuilder builder, OrchestratorProperties props) {
        long predictMs = props.maxEngineTimeoutMs();
        long probeMs = props.getHealthCheckTimeoutMs();
        return new HttpInferenceEngineClient(
                builder.setConnectTimeout(Duration.ofMillis(Math.min(predictMs, 2_000L)))
                        .setReadTimeout(Duration.ofMillis(predictMs))
                        .build(),
                builder.setConnectTimeout(Duration.ofMillis(probeMs))
                        .setReadTimeout(Duration.ofMillis(probeMs))
                        .build(),
                predictMs,
                probeMs);
    }
}
