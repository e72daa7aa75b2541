package com.phillippitts.sitedetect;

import com.phillippitts.sitedetect.config.properties.OrchestratorProperties;
import com.phillippitts.sitedetect.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestratorProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class SiteDetectApplication {

    public static void main(String[] args) {
        SpringApplication.run(SiteDetectApplication.class, args);
    }

}
