/**
 * Orchestrator exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.sitedetect.exception.SiteDetectException}:
 * <ul>
 *   <li>{@link com.phillippitts.sitedetect.exception.NoHealthyEngineException} - every candidate
 *       for a capability is disabled or circuit-open</li>
 *   <li>{@link com.phillippitts.sitedetect.exception.EngineCallException} - transport failure,
 *       non-success response, or malformed payload from an engine</li>
 *   <li>{@link com.phillippitts.sitedetect.exception.EngineTimeoutException} - deadline exceeded</li>
 *   <li>{@link com.phillippitts.sitedetect.exception.UnknownCapabilityException} - nothing was
 *       ever registered for a capability</li>
 *   <li>{@link com.phillippitts.sitedetect.exception.RequestNotFoundException} - request history miss</li>
 *   <li>{@link com.phillippitts.sitedetect.exception.InvalidDetectionRequestException} - bad caller input</li>
 * </ul>
 *
 * <p>Per-capability failures never propagate out of a submit call; the dispatcher records them
 * in the capability's result using the {@link com.phillippitts.sitedetect.exception.ErrorKind}
 * prefix. The REST boundary maps the rest via {@code GlobalExceptionHandler}.
 */
package com.phillippitts.sitedetect.exception;
