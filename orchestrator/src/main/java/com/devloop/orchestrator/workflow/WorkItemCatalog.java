package com.devloop.orchestrator.workflow;

import java.util.List;
import java.util.Optional;

/**
 * Read access to projects and their work items.
 */
public interface WorkItemCatalog {

    List<ProjectInfo> listProjects();

    Optional<ProjectInfo> findProject(String projectId);

    Optional<TrackedItem> findTrackedItem(String itemId);

    Optional<PlannedChange> findPlannedChange(String projectId, String changeId);

    /** Remember the worktree provisioned for a tracked item. */
    void recordWorktree(String itemId, String worktreePath);
}
