package com.devloop.orchestrator.workflow;

import java.util.Optional;

/**
 * Creates and refreshes the isolated checkouts agents work in.
 */
public interface WorktreeProvisioner {

    /**
     * Path of a worktree for {@code branchName}, creating the branch from
     * {@code baseBranch} and the worktree if needed. Empty when provisioning failed.
     */
    Optional<String> ensureWorktree(ProjectInfo project, String branchName, String baseBranch);

    /** Pull the latest remote state into the worktree. False on failure. */
    boolean pullLatest(String worktreePath);
}
