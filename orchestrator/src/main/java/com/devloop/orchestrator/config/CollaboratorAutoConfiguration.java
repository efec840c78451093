package com.devloop.orchestrator.config;

import com.devloop.orchestrator.completion.PullRequestLookup;
import com.devloop.orchestrator.vcs.CommandRunner;
import com.devloop.orchestrator.vcs.GhPullRequestLookup;
import com.devloop.orchestrator.vcs.GitWorktreeProvisioner;
import com.devloop.orchestrator.workflow.InMemoryWorkItemStore;
import com.devloop.orchestrator.workflow.WorkItemCatalog;
import com.devloop.orchestrator.workflow.WorkItemTransitionService;
import com.devloop.orchestrator.workflow.WorktreeProvisioner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Stand-alone implementations of the work item, worktree and PR collaborators.
 *
 * Registered as an auto-configuration so the conditions are evaluated after
 * every application-defined bean. Each default backs off when the deployment
 * declares its own bean of that type: the CLI-backed ones shell out to
 * {@code git} and {@code gh}.
 *
 * The in-memory work item store answers both {@link WorkItemCatalog} and
 * {@link WorkItemTransitionService} from one map, so it is all or nothing: it
 * backs off as soon as either is declared, and a deployment that brings its
 * own catalog brings its own transition service too.
 */
@AutoConfiguration
public class CollaboratorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean({WorkItemCatalog.class, WorkItemTransitionService.class})
    public InMemoryWorkItemStore workItemStore() {
        return new InMemoryWorkItemStore();
    }

    @Bean
    @ConditionalOnMissingBean(WorktreeProvisioner.class)
    public WorktreeProvisioner worktreeProvisioner(CommandRunner commandRunner) {
        return new GitWorktreeProvisioner(commandRunner);
    }

    @Bean
    @ConditionalOnMissingBean(PullRequestLookup.class)
    public PullRequestLookup pullRequestLookup(CommandRunner commandRunner,
                                               WorkItemCatalog catalog,
                                               ObjectMapper objectMapper) {
        return new GhPullRequestLookup(commandRunner, catalog, objectMapper);
    }
}
