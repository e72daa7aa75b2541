package com.phillippitts.sitedetect.service.registry;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.exception.UnknownCapabilityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Catalog of model versions per capability, plus the A/B experiments that override default
 * balancing.
 *
 * <p>Versions are kept in insertion order per capability; that order is the default round-robin
 * order. Registration is idempotent by {@code (name, version)}: re-registering replaces the
 * existing entry in place, keeping its position.
 *
 * <p>Thread safety: reads share a read lock; writes (boot-time seeding, admin reload) are
 * serialized behind the write lock.
 */
public class ModelRegistry {

    private static final Logger LOG = LogManager.getLogger(ModelRegistry.class);

    private final Map<Capability, List<ModelVersion>> models = new EnumMap<>(Capability.class);
    private final Map<String, ABTestConfig> abTests = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Adds a version, or replaces the one with the same {@code (name, version)}.
     *
     * @param model version to register
     * @return true when an existing entry was replaced
     */
    public boolean register(ModelVersion model) {
        Objects.requireNonNull(model, "model must not be null");
        boolean replaced = write(() -> {
            List<ModelVersion> list = models.computeIfAbsent(model.capability(), c -> new ArrayList<>());
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).key().equals(model.key())) {
                    list.set(i, model);
                    return true;
                }
            }
            list.add(model);
            return false;
        });
        LOG.info("{} model {} for {} at {} (enabled={})",
                replaced ? "Updated" : "Registered", model.key(), model.capability(),
                model.endpoint(), model.enabled());
        return replaced;
    }

    /**
     * Returns the enabled versions for a capability in registration order.
     *
     * @throws UnknownCapabilityException if nothing was ever registered for the capability
     */
    public List<ModelVersion> list(Capability capability) {
        return read(() -> {
            List<ModelVersion> list = registered(capability);
            List<ModelVersion> enabled = new ArrayList<>(list.size());
            for (ModelVersion m : list) {
                if (m.enabled()) {
                    enabled.add(m);
                }
            }
            return Collections.unmodifiableList(enabled);
        });
    }

    /**
     * Looks up an enabled version by model name, or the default when {@code name} is null/blank.
     *
     * <p>The default, and the match when several versions share a name, is the most recently
     * registered enabled version.
     *
     * @throws UnknownCapabilityException if nothing was ever registered for the capability
     */
    public Optional<ModelVersion> get(Capability capability, String name) {
        return read(() -> {
            List<ModelVersion> list = registered(capability);
            for (int i = list.size() - 1; i >= 0; i--) {
                ModelVersion m = list.get(i);
                if (m.enabled() && (name == null || name.isBlank() || m.name().equals(name))) {
                    return Optional.of(m);
                }
            }
            return Optional.empty();
        });
    }

    /** Finds a registered version (enabled or not) by its {@code name:version} key. */
    public Optional<ModelVersion> findByKey(String key) {
        return read(() -> models.values().stream()
                .flatMap(List::stream)
                .filter(m -> m.key().equals(key))
                .findFirst());
    }

    /**
     * Enables or disables a registered version by replacing it with a copy.
     *
     * @return true when the version exists
     */
    public boolean setEnabled(Capability capability, String name, String version, boolean enabled) {
        boolean found = write(() -> {
            List<ModelVersion> list = models.get(capability);
            if (list == null) {
                return false;
            }
            for (int i = 0; i < list.size(); i++) {
                ModelVersion m = list.get(i);
                if (m.name().equals(name) && m.version().equals(version)) {
                    list.set(i, m.withEnabled(enabled));
                    return true;
                }
            }
            return false;
        });
        if (found) {
            LOG.info("Model {}:{} for {} {}", name, version, capability, enabled ? "enabled" : "disabled");
        }
        return found;
    }

    /** All registered versions, including disabled ones, per capability. */
    public Map<Capability, List<ModelVersion>> listAll() {
        return read(() -> {
            Map<Capability, List<ModelVersion>> copy = new EnumMap<>(Capability.class);
            models.forEach((c, list) -> copy.put(c, List.copyOf(list)));
            return Collections.unmodifiableMap(copy);
        });
    }

    /** Registers or replaces an experiment by id. */
    public void createAbTest(ABTestConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        write(() -> abTests.put(config.experimentId(), config));
        LOG.info("Created A/B test {} for {}: {} vs {} (split={})", config.experimentId(),
                config.capability(), config.modelA().key(), config.modelB().key(), config.trafficSplit());
    }

    public boolean removeAbTest(String experimentId) {
        return write(() -> abTests.remove(experimentId) != null);
    }

    /**
     * First enabled experiment for a capability, in creation order.
     */
    public Optional<ABTestConfig> activeAbTest(Capability capability) {
        return read(() -> abTests.values().stream()
                .filter(ABTestConfig::enabled)
                .filter(t -> t.capability() == capability)
                .findFirst());
    }

    public List<ABTestConfig> listAbTests() {
        return read(() -> List.copyOf(abTests.values()));
    }

    private List<ModelVersion> registered(Capability capability) {
        List<ModelVersion> list = models.get(capability);
        if (list == null || list.isEmpty()) {
            throw new UnknownCapabilityException(capability);
        }
        return list;
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
