package com.phillippitts.sitedetect.service.health;

import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.EngineHealth;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds one {@link EngineHealthTracker} per (capability, endpoint) pair and exposes each as a
 * {@code sitedetect.health.status} gauge (1 healthy, 0 unhealthy).
 */
public class EngineHealthRegistry {

    private record Key(Capability capability, String endpoint) {}

    private final ConcurrentMap<Key, EngineHealthTracker> trackers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public EngineHealthRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    /** Returns the tracker for a pair, creating and registering it on first use. */
    public EngineHealthTracker tracker(Capability capability, String endpoint) {
        return trackers.computeIfAbsent(new Key(capability, endpoint), k -> {
            EngineHealthTracker t = new EngineHealthTracker(k.capability(), k.endpoint());
            Gauge.builder("sitedetect.health.status", t, tr -> tr.isHealthy() ? 1.0 : 0.0)
                    .description("Latest liveness probe result per engine endpoint")
                    .tag("capability", k.capability().wireName())
                    .tag("endpoint", k.endpoint())
                    .register(meterRegistry);
            return t;
        });
    }

    /** Latest probe response time for a pair, empty if never probed. */
    public OptionalLong responseTimeMs(Capability capability, String endpoint) {
        EngineHealthTracker t = trackers.get(new Key(capability, endpoint));
        Long ms = t == null ? null : t.lastResponseTimeMs();
        return ms == null ? OptionalLong.empty() : OptionalLong.of(ms);
    }

    /** True unless the latest probe for the pair failed. */
    public boolean isHealthy(Capability capability, String endpoint) {
        EngineHealthTracker t = trackers.get(new Key(capability, endpoint));
        return t == null || t.isHealthy();
    }

    /** Snapshot grouped by capability, endpoints sorted. */
    public Map<Capability, List<EngineHealth>> snapshot() {
        Map<Capability, List<EngineHealth>> out = new EnumMap<>(Capability.class);
        for (EngineHealthTracker t : trackers.values()) {
            out.computeIfAbsent(t.capability(), c -> new ArrayList<>()).add(t.snapshot());
        }
        out.values().forEach(list -> list.sort((a, b) -> a.endpoint().compareTo(b.endpoint())));
        out.replaceAll((c, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(out);
    }
}
