package com.devloop.orchestrator.workflow;

/**
 * A work item that already has a branch, and possibly a worktree.
 *
 * @param worktreePath null until a worktree has been provisioned
 */
public record TrackedItem(String id, String projectId, String title, String branchName, String worktreePath) {

    public TrackedItem withWorktreePath(String path) {
        return new TrackedItem(id, projectId, title, branchName, path);
    }
}
