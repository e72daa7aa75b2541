package com.phillippitts.sitedetect.service.balancer;

/**
 * Endpoint selection strategies applied after circuit-open candidates are filtered out.
 */
public enum LoadBalancingStrategy {

    /** Shared per-capability cursor; each of K candidates is chosen once every K selections. */
    ROUND_ROBIN,

    /** Random draw weighted by inverse probe response time. */
    WEIGHTED,

    /** Lowest probe response time wins; ties go to registry order. */
    LEAST_LATENCY
}
