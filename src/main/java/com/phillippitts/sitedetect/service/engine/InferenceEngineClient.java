package com.phillippitts.sitedetect.service.engine;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.exception.EngineCallException;

/**
 * Transport to remote inference engines.
 *
 * <p>Implementations must be thread-safe; the dispatcher and the health monitor call them
 * concurrently from separate pools. Deadlines are enforced by callers as well, so a client
 * that blocks past its deadline has its result discarded.
 */
public interface InferenceEngineClient {

    /**
     * Performs a prediction call.
     *
     * @param call call description, including the target endpoint
     * @return parsed engine reply
     * @throws EngineCallException on transport failure, non-success response, or malformed payload
     */
    EngineReply predict(EngineCall call);

    /**
     * Performs a lightweight liveness probe.
     *
     * @param capability capability served by the endpoint (for error context)
     * @param endpoint engine base URL
     * @throws EngineCallException when the engine is not live
     */
    void probe(Capability capability, String endpoint);
}
