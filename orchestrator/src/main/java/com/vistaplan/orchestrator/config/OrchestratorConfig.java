package com.vistaplan.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({PipelineProperties.class, JudgeProperties.class})
public class OrchestratorConfig {

    /** Injected everywhere time matters, so decay and lock expiry are testable. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
