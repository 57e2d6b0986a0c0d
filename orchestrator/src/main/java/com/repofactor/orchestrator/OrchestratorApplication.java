package com.repofactor.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Run service: REST API plus the background scheduler that drives submitted
 * runs through the pipeline.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
