package com.devloop.orchestrator.completion;

import java.util.List;

/**
 * Read access to a project's pull requests on the hosting service.
 */
public interface PullRequestLookup {

    record OpenPullRequest(String branchName, int number, String htmlUrl) {}

    List<OpenPullRequest> listOpenPullRequests(String projectId);

    /**
     * Called after an agent opens a PR. Implementations that cache PR metadata
     * re-sync it here; ones that always list live may do nothing.
     */
    void refreshPullRequests(String projectId);
}
