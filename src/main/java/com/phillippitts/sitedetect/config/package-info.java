/**
 * Spring configuration: thread pools and their metrics, the HTTP engine client, and the
 * orchestrator's component graph.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code orchestrator.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.sitedetect.config;
