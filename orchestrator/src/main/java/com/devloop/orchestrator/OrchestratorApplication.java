package com.devloop.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Agent orchestrator entry point.
 *
 * The work item store, worktree provisioning and PR listing default to the
 * implementations in {@code CollaboratorAutoConfiguration}; a deployment replaces any of
 * them by declaring its own bean.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
