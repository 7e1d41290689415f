package com.vistaplan.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pipeline orchestration core: phase state machine, job ledger, validation,
 * rule learning and retry.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run
 */
@SpringBootApplication
@EnableScheduling
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
