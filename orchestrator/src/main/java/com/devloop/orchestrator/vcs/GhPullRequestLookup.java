package com.devloop.orchestrator.vcs;

import com.devloop.orchestrator.completion.PullRequestLookup;
import com.devloop.orchestrator.workflow.ProjectInfo;
import com.devloop.orchestrator.workflow.WorkItemCatalog;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Open pull requests read with {@code gh pr list} in the project's checkout.
 * Every listing goes to {@code gh}; nothing is cached, so there is nothing to refresh.
 */
public class GhPullRequestLookup implements PullRequestLookup {

    private static final Logger log = LoggerFactory.getLogger(GhPullRequestLookup.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GhPullRequest(int number, String headRefName, String url) {}

    private static final TypeReference<List<GhPullRequest>> PR_LIST = new TypeReference<>() {};

    private final CommandRunner   commands;
    private final WorkItemCatalog catalog;
    private final ObjectMapper    json;

    public GhPullRequestLookup(CommandRunner commands, WorkItemCatalog catalog, ObjectMapper objectMapper) {
        this.commands = commands;
        this.catalog  = catalog;
        this.json     = objectMapper;
    }

    /**
     * @throws IllegalStateException if the project is unknown or {@code gh} fails
     */
    @Override
    public List<OpenPullRequest> listOpenPullRequests(String projectId) {
        ProjectInfo project = catalog.findProject(projectId)
                .orElseThrow(() -> new IllegalStateException("Project " + projectId + " not found"));
        CommandResult result = commands.run(Path.of(project.localPath()),
                "gh", "pr", "list", "--state", "open", "--json", "number,headRefName,url");
        if (!result.success()) {
            throw new IllegalStateException("gh pr list failed for project " + projectId + ": "
                    + result.error().strip());
        }
        return parse(result.output()).stream()
                .map(pr -> new OpenPullRequest(pr.headRefName(), pr.number(), pr.url()))
                .toList();
    }

    /** No-op: listings are always live. */
    @Override
    public void refreshPullRequests(String projectId) {
        log.debug("No cached PRs to refresh for project {}", projectId);
    }

    List<GhPullRequest> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        try {
            return json.readValue(output, PR_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unexpected gh pr list output: " + output, e);
        }
    }
}
