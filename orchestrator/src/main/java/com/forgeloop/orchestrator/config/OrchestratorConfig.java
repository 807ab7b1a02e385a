package com.forgeloop.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.checkpoint.CheckpointStore;
import com.forgeloop.orchestrator.checkpoint.FileCheckpointStore;
import com.forgeloop.orchestrator.tracker.GitHubWorkItemTracker;
import com.forgeloop.orchestrator.tracker.WorkItemTracker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wiring for the collaborators that are not components themselves: the
 * checkpoint file, the live thresholds and the tracker.
 */
@Configuration
@EnableConfigurationProperties(ForgeloopProperties.class)
public class OrchestratorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    CheckpointStore checkpointStore(ForgeloopProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new FileCheckpointStore(Path.of(properties.getCheckpoint().getPath()), objectMapper, clock);
    }

    @Bean
    TunableThresholds tunableThresholds(ForgeloopProperties properties) {
        return TunableThresholds.from(properties);
    }

    @Bean
    WorkItemTracker workItemTracker(ForgeloopProperties properties, ObjectMapper objectMapper) {
        return new GitHubWorkItemTracker(properties.getGithub(), objectMapper);
    }
}
