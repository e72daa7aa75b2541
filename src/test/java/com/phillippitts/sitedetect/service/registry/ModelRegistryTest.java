package com.phillippitts.sitedetect.service.registry;

import com.phillippitts.sitedetect.domain.ABTestConfig;
import com.phillippitts.sitedetect.domain.Capability;
import com.phillippitts.sitedetect.domain.ModelVersion;
import com.phillippitts.sitedetect.exception.UnknownCapabilityException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private final ModelRegistry registry = new ModelRegistry();

    @Test
    void shouldKeepRegistrationOrder() {
        registry.register(model("damage-a", "v1", "http://a:1", true));
        registry.register(model("damage-b", "v1", "http://b:1", true));
        registry.register(model("damage-c", "v1", "http://c:1", true));

        assertThat(registry.list(Capability.DAMAGE))
                .extracting(ModelVersion::name)
                .containsExactly("damage-a", "damage-b", "damage-c");
    }

    @Test
    void shouldBeIdempotentByNameAndVersion() {
        assertThat(registry.register(model("damage", "v1", "http://old:1", true))).isFalse();
        assertThat(registry.register(model("damage", "v1", "http://new:1", true))).isTrue();

        List<ModelVersion> all = registry.listAll().get(Capability.DAMAGE);
        assertThat(all).hasSize(1);
        assertThat(all.get(0).endpoint()).isEqualTo("http://new:1");
    }

    @Test
    void shouldThrowUnknownCapabilityWhenNothingRegistered() {
        registry.register(model("damage", "v1", "http://a:1", true));

        assertThatThrownBy(() -> registry.list(Capability.VOLUME))
                .isInstanceOf(UnknownCapabilityException.class);
        assertThatThrownBy(() -> registry.get(Capability.VOLUME, null))
                .isInstanceOf(UnknownCapabilityException.class);
    }

    @Test
    void shouldListOnlyEnabledVersions() {
        registry.register(model("damage", "v1", "http://a:1", true));
        registry.register(model("damage", "v2", "http://b:1", false));

        assertThat(registry.list(Capability.DAMAGE)).extracting(ModelVersion::version).containsExactly("v1");
        assertThat(registry.listAll().get(Capability.DAMAGE)).hasSize(2);
    }

    @Test
    void shouldReturnLatestEnabledVersionAsDefault() {
        registry.register(model("damage", "v1", "http://a:1", true));
        registry.register(model("damage", "v2", "http://b:1", true));
        registry.register(model("damage-exp", "v1", "http://c:1", false));

        assertThat(registry.get(Capability.DAMAGE, null)).map(ModelVersion::version).contains("v2");
        assertThat(registry.get(Capability.DAMAGE, "damage")).map(ModelVersion::version).contains("v2");
        assertThat(registry.get(Capability.DAMAGE, "damage-exp")).isEmpty();
    }

    @Test
    void shouldToggleEnabledByReplacingVersion() {
        registry.register(model("damage", "v1", "http://a:1", true));

        assertThat(registry.setEnabled(Capability.DAMAGE, "damage", "v1", false)).isTrue();
        assertThat(registry.list(Capability.DAMAGE)).isEmpty();
        assertThat(registry.setEnabled(Capability.DAMAGE, "damage", "v9", true)).isFalse();
        assertThat(registry.setEnabled(Capability.MATERIAL, "damage", "v1", true)).isFalse();
    }

    @Test
    void shouldFindByKey() {
        registry.register(model("damage", "v1", "http://a:1", false));

        assertThat(registry.findByKey("damage:v1")).isPresent();
        assertThat(registry.findByKey("damage:v2")).isEmpty();
    }

    @Test
    void shouldReturnFirstEnabledExperimentPerCapability() {
        ModelVersion a = model("damage", "v1", "http://a:1", true);
        ModelVersion b = model("damage", "v2", "http://b:1", true);
        registry.createAbTest(new ABTestConfig("off", a, b, 0.5, false));
        registry.createAbTest(new ABTestConfig("on", a, b, 0.3, true));

        assertThat(registry.activeAbTest(Capability.DAMAGE)).map(ABTestConfig::experimentId).contains("on");
        assertThat(registry.activeAbTest(Capability.MATERIAL)).isEmpty();
        assertThat(registry.listAbTests()).hasSize(2);

        assertThat(registry.removeAbTest("on")).isTrue();
        assertThat(registry.activeAbTest(Capability.DAMAGE)).isEmpty();
    }

    private static ModelVersion model(String name, String version, String endpoint, boolean enabled) {
        return new ModelVersion(name, version, Capability.DAMAGE, endpoint, 0.75, enabled);
    }
}
