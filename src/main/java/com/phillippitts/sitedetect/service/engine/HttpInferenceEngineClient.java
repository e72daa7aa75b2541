package com.phillippitts.sitedetect.service.engine;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.exception.EngineCallExceptionBuilder;
import com.phillippitts.sitedetect.exception.EngineTimeoutException;
import com.phillippitts.sitedetect.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * HTTP/JSON client for inference engines.
 *
 * <p>Wire contract:
 * <ul>
 *   <li>{@code POST {endpoint}/predict} with photo reference, capability, model identity,
 *       threshold, priority, metadata and capability parameters; headers
 *       {@code X-Correlation-ID} and {@code X-Request-ID}</li>
 *   <li>{@code GET {endpoint}/health}; any 2xx is live</li>
 * </ul>
 *
 * <p>Uses two {@link RestTemplate}s so probes run under a shorter timeout than predictions.
 */
public class HttpInferenceEngineClient implements InferenceEngineClient {

    private static final Logger LOG = LogManager.getLogger(HttpInferenceEngineClient.class);

    static final String PREDICT_PATH = "/predict";
    static final String HEALTH_PATH = "/health";
    static final String CORRELATION_HEADER = "X-Correlation-ID";
    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final RestTemplate predictTemplate;
    private final RestTemplate probeTemplate;
    private final long predictTimeoutMs;
    private final long probeTimeoutMs;

    public HttpInferenceEngineClient(RestTemplate predictTemplate, RestTemplate probeTemplate,
                                     long predictTimeoutMs, long probeTimeoutMs) {
        this.predictTemplate = Objects.requireNonNull(predictTemplate, "predictTemplate must not be null");
        this.probeTemplate = Objects.requireNonNull(probeTemplate, "probeTemplate must not be null");
        this.predictTimeoutMs = predictTimeoutMs;
        this.probeTimeoutMs = probeTimeoutMs;
    }

    @Override
    public EngineReply predict(EngineCall call) {
        String endpoint = call.endpoint();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (call.correlationId() != null) {
            headers.set(CORRELATION_HEADER, call.correlationId());
        }
        if (call.requestId() != null) {
            headers.set(REQUEST_ID_HEADER, call.requestId().toString());
        }
        HttpEntity<String> entity = new HttpEntity<>(requestBody(call).toString(), headers);

        long t0 = System.nanoTime();
        try {
            ResponseEntity<String> response = predictTemplate.exchange(
                    url(endpoint, PREDICT_PATH), HttpMethod.POST, entity, String.class);
            LOG.debug("Engine {} answered {} in {} ms", endpoint, response.getStatusCode().value(),
                    TimeUtils.elapsedMillis(t0));
            return EngineReplyParser.parse(response.getBody(), call.model().version(),
                    call.capability(), endpoint);
        } catch (HttpStatusCodeException e) {
            throw EngineCallExceptionBuilder.create("Engine returned non-success status")
                    .capability(call.capability())
                    .endpoint(endpoint)
                    .httpStatus(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new EngineTimeoutException(call.capability(), endpoint, predictTimeoutMs, e);
            }
            throw EngineCallExceptionBuilder.create("Engine unreachable")
                    .capability(call.capability())
                    .endpoint(endpoint)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw EngineCallExceptionBuilder.create("Engine call failed")
                    .capability(call.capability())
                    .endpoint(endpoint)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        }
    }

    @Override
    public void probe(Capability capability, String endpoint) {
        try {
            probeTemplate.getForEntity(url(endpoint, HEALTH_PATH), String.class);
        } catch (HttpStatusCodeException e) {
            throw EngineCallExceptionBuilder.create("Health probe returned non-success status")
                    .capability(capability)
                    .endpoint(endpoint)
                    .httpStatus(e.getStatusCode().value())
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new EngineTimeoutException(capability, endpoint, probeTimeoutMs, e);
            }
            throw EngineCallExceptionBuilder.create("Health probe failed")
                    .capability(capability)
                    .endpoint(endpoint)
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw EngineCallExceptionBuilder.create("Health probe failed")
                    .capability(capability)
                    .endpoint(endpoint)
                    .cause(e)
                    .build();
        }
    }

    static JSONObject requestBody(EngineCall call) {
        JSONObject body = new JSONObject();
        body.put("photo_id", call.request().photoId() == null ? JSONObject.NULL : call.request().photoId().toString());
        body.put("photo_url", call.request().photoUrl());
        body.put("capability", call.capability().wireName());
        body.put("model_name", call.model().name());
        body.put("model_version", call.model().version());
        body.put("confidence_threshold", call.model().confidenceThreshold());
        body.put("priority", call.request().priority().name().toLowerCase(Locale.ROOT));
        body.put("metadata", new JSONObject(call.request().metadata()));
        body.put("parameters", new JSONObject(call.parameters()));
        return body;
    }

    static String url(String endpoint, String path) {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return base + path;
    }
}
