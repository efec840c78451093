package com.devloop.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local catalog and status owner, used when the deployment provides none.
 *
 * Every status change is checked against {@link WorkItemStatus#canTransitionTo}.
 * Promotion removes the change from the planned set and re-registers it as a
 * tracked item carrying its PR number.
 */
public class InMemoryWorkItemStore implements WorkItemCatalog, WorkItemTransitionService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkItemStore.class);

    private final Map<String, ProjectInfo>   projects   = new ConcurrentHashMap<>();
    private final Map<String, TrackedItem>   tracked    = new ConcurrentHashMap<>();
    private final Map<String, PlannedChange> planned    = new ConcurrentHashMap<>();   // key: projectId/changeId
    private final Map<String, Integer>       prNumbers  = new ConcurrentHashMap<>();
    private final Map<String, String>        lastErrors = new ConcurrentHashMap<>();

    public void putProject(ProjectInfo project) {
        projects.put(project.id(), project);
    }

    public void putTrackedItem(TrackedItem item) {
        tracked.put(item.id(), item);
    }

    public void putPlannedChange(PlannedChange change) {
        planned.put(key(change.projectId(), change.id()), change);
    }

    public Optional<Integer> pullRequestNumber(String itemId) {
        return Optional.ofNullable(prNumbers.get(itemId));
    }

    public Optional<String> lastError(String itemId) {
        return Optional.ofNullable(lastErrors.get(itemId));
    }

    // ------------------------------------------------------------------
    // WorkItemCatalog
    // ------------------------------------------------------------------

    @Override
    public List<ProjectInfo> listProjects() {
        return List.copyOf(projects.values());
    }

    @Override
    public Optional<ProjectInfo> findProject(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public Optional<TrackedItem> findTrackedItem(String itemId) {
        return Optional.ofNullable(tracked.get(itemId));
    }

    @Override
    public Optional<PlannedChange> findPlannedChange(String projectId, String changeId) {
        return Optional.ofNullable(planned.get(key(projectId, changeId)));
    }

    @Override
    public void recordWorktree(String itemId, String worktreePath) {
        tracked.computeIfPresent(itemId, (id, item) -> item.withWorktreePath(worktreePath));
    }

    // ------------------------------------------------------------------
    // WorkItemTransitionService
    // ------------------------------------------------------------------

    @Override
    public TransitionResult transitionToInProgress(String projectId, String itemId) {
        return move(projectId, itemId, WorkItemStatus.IN_PROGRESS);
    }

    @Override
    public TransitionResult transitionToAwaitingPr(String projectId, String itemId) {
        return move(projectId, itemId, WorkItemStatus.AWAITING_PR);
    }

    @Override
    public TransitionResult handleStartFailure(String projectId, String itemId, String errorMessage) {
        lastErrors.put(itemId, errorMessage != null ? errorMessage : "unknown error");
        return move(projectId, itemId, WorkItemStatus.PENDING);
    }

    @Override
    public TransitionResult promoteToTrackedPr(String projectId, String itemId, int prNumber) {
        TransitionResult result = move(projectId, itemId, WorkItemStatus.COMPLETE);
        if (!result.success()) {
            return result;
        }
        PlannedChange change = planned.remove(key(projectId, itemId));
        if (change != null) {
            tracked.put(itemId, new TrackedItem(itemId, projectId, change.title(), change.branchName(), null));
        }
        prNumbers.put(itemId, prNumber);
        log.info("Promoted {} to tracked PR #{}", itemId, prNumber);
        return result;
    }

    private TransitionResult move(String projectId, String itemId, WorkItemStatus target) {
        String key = key(projectId, itemId);
        TransitionResult[] outcome = new TransitionResult[1];
        planned.compute(key, (k, change) -> {
            if (change == null) {
                outcome[0] = TransitionResult.failed(null, "change " + itemId + " not found in project " + projectId);
                return null;
            }
            if (!change.status().canTransitionTo(target)) {
                outcome[0] = TransitionResult.failed(change.status(),
                        change.status() + " -> " + target + " is not allowed");
                return change;
            }
            outcome[0] = TransitionResult.ok(change.status(), target);
            return change.withStatus(target);
        });
        if (outcome[0].success()) {
            log.info("Work item {} {} -> {}", itemId, outcome[0].previous(), outcome[0].current());
        } else {
            log.warn("Work item {} not moved to {}: {}", itemId, target, outcome[0].error());
        }
        return outcome[0];
    }

    private static String key(String projectId, String changeId) {
        return projectId + "/" + changeId;
    }
}
