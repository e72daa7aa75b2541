/**
 * Request-scoped logging context.
 *
 * <p>{@link com.phillippitts.sitedetect.config.logging.MdcFilter} fills Log4j2's ThreadContext
 * for every HTTP request; executors copy it to worker threads, and the dispatcher adds the
 * detection request id while a request is processed.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - HTTP request id (X-Request-ID or generated)</li>
 *   <li>{@code correlationId} - caller correlation id, or {@code orch-<id>} once dispatched</li>
 *   <li>{@code detectionRequestId} - id of the detection request being processed</li>
 * </ul>
 */
package com.phillippitts.sitedetect.config.logging;
