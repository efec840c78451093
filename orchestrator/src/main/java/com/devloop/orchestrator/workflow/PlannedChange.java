package com.devloop.orchestrator.workflow;

/**
 * A planned unit of work that an agent can pick up. Its id doubles as the branch name.
 *
 * @param baseBranch   branch the PR will target; null means the project default
 * @param instructions free-form implementation notes, may be null
 */
public record PlannedChange(
        String         id,
        String         projectId,
        String         title,
        String         shortTitle,
        String         description,
        String         instructions,
        String         baseBranch,
        WorkItemStatus status
) {

    public String branchName() { return id; }

    public PlannedChange withStatus(WorkItemStatus next) {
        return new PlannedChange(id, projectId, title, shortTitle, description, instructions, baseBranch, next);
    }
}
