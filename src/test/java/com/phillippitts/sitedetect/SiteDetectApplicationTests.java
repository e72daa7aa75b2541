package com.phillippitts.sitedetect;

import com.phillippitts.sitedetect.service.health.HealthMonitor;
import com.phillippitts.sitedetect.service.orchestration.DetectionOrchestrator;
import com.phillippitts.sitedetect.service.registry.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SiteDetectApplicationTests {

    @Autowired
    private DetectionOrchestrator orchestrator;

    @Autowired
    private ModelRegistry registry;

    @Autowired
    private HealthMonitor healthMonitor;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(registry.listAll()).hasSize(3);
        assertThat(healthMonitor.isRunning()).isFalse();
    }
}
