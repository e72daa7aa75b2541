/**
 * Immutable domain model shared by the orchestrator services and the REST surface.
 *
 * <p>Records validate their invariants in compact constructors. Mutable runtime state
 * (breaker state, health counters, sample windows) lives in the service packages and is
 * exposed here only as snapshots.
 */
package com.phillippitts.sitedetect.domain;
