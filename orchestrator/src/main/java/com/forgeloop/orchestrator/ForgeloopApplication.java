package com.forgeloop.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Checkpointed build orchestrator.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... GITHUB_TOKEN=ghp_... \
 *   FORGELOOP_GITHUB_OWNER=acme FORGELOOP_GITHUB_REPO=invoice-api mvn spring-boot:run
 */
@SpringBootApplication
public class ForgeloopApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeloopApplication.class, args);
    }
}
