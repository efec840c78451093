package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.client.AgentApiClient;
import com.devloop.orchestrator.client.dto.AgentMessage;
import com.devloop.orchestrator.client.dto.AgentSession;
import com.devloop.orchestrator.client.dto.PromptRequest;
import com.devloop.orchestrator.completion.CompletionMonitor;
import com.devloop.orchestrator.completion.CompletionResult;
import com.devloop.orchestrator.completion.PullRequestLookup;
import com.devloop.orchestrator.config.AgentProperties;
import com.devloop.orchestrator.server.AgentServer;
import com.devloop.orchestrator.server.AgentServerManager;
import com.devloop.orchestrator.server.AgentServerStatus;
import com.devloop.orchestrator.startup.StartupTracker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs agents against work items, from start to pull request.
 *
 * Starting a planned change moves it to IN_PROGRESS first; if anything after
 * that fails the change goes back to PENDING before the error reaches the
 * caller. Once the agent is up, a background monitor watches for the PR and
 * settles the item:
 *
 *   PR detected          → promoted to a tracked PR (COMPLETE), server stopped
 *   stream ended         → AWAITING_PR, server record cleaned up
 *   PR lookup exhausted  → AWAITING_PR, agent left running
 *   monitor failure      → AWAITING_PR
 *   cancelled (stop)     → nothing; stop() settles the item itself
 *
 * Exactly one of the monitor and stop() settles an item: whichever claims the
 * task first.
 */
@Service
public class AgentWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkflowService.class);

    private final WorkItemCatalog           catalog;
    private final WorkItemTransitionService transitions;
    private final WorktreeProvisioner       worktrees;
    private final InitialPromptFactory      promptFactory;
    private final AgentConfigWriter         configWriter;
    private final AgentServerManager        serverManager;
    private final AgentApiClient            apiClient;
    private final CompletionMonitor         completionMonitor;
    private final PullRequestLookup         pullRequests;
    private final StartupTracker            startupTracker;
    private final AgentUrlService           urls;
    private final ExecutorService           monitorExecutor;
    private final ExecutorService           promptExecutor;
    private final String                    defaultModel;

    private final ConcurrentHashMap<String, MonitoringTask> monitors = new ConcurrentHashMap<>();

    public AgentWorkflowService(WorkItemCatalog catalog,
                                WorkItemTransitionService transitions,
                                WorktreeProvisioner worktrees,
                                InitialPromptFactory promptFactory,
                                AgentConfigWriter configWriter,
                                AgentServerManager serverManager,
                                AgentApiClient apiClient,
                                CompletionMonitor completionMonitor,
                                PullRequestLookup pullRequests,
                                StartupTracker startupTracker,
                                AgentUrlService urls,
                                AgentProperties props,
                                @Qualifier("monitorExecutor") ExecutorService monitorExecutor,
                                @Qualifier("promptExecutor") ExecutorService promptExecutor) {
        this.catalog           = catalog;
        this.transitions       = transitions;
        this.worktrees         = worktrees;
        this.promptFactory     = promptFactory;
        this.configWriter      = configWriter;
        this.serverManager     = serverManager;
        this.apiClient         = apiClient;
        this.completionMonitor = completionMonitor;
        this.pullRequests      = pullRequests;
        this.startupTracker    = startupTracker;
        this.urls              = urls;
        this.monitorExecutor   = monitorExecutor;
        this.promptExecutor    = promptExecutor;
        this.defaultModel      = props.defaultModel();
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Start (or return the running) agent for an item that already has a branch.
     *
     * @param model "provider/model"; null falls back to the project's, then the global default
     * @throws WorkItemNotFoundException if the item or its project is unknown
     */
    public AgentStatus startForExistingItem(String itemId, String model) {
        TrackedItem item = catalog.findTrackedItem(itemId)
                .orElseThrow(() -> new WorkItemNotFoundException("Work item " + itemId + " not found"));
        ProjectInfo project = catalog.findProject(item.projectId())
                .orElseThrow(() -> new WorkItemNotFoundException("Project " + item.projectId() + " not found"));

        String worktreePath = item.worktreePath();
        if (worktreePath == null || worktreePath.isBlank()) {
            if (item.branchName() == null || item.branchName().isBlank()) {
                throw new IllegalStateException(
                        "Work item " + itemId + " has no branch name; cannot create a worktree");
            }
            log.info("Creating worktree for {} on branch {}", itemId, item.branchName());
            worktreePath = worktrees.ensureWorktree(project, item.branchName(), project.defaultBranch())
                    .orElseThrow(() -> new IllegalStateException("Failed to create worktree for " + itemId
                            + " (branch " + item.branchName() + "); check the git output in the logs"));
            catalog.recordWorktree(itemId, worktreePath);
        }

        return startAgent(itemId, item.title(), worktreePath, resolveModel(model, project));
    }

    /**
     * Move a planned change to IN_PROGRESS, start its agent, send the task and
     * watch for the PR. Any failure puts the change back to PENDING and rethrows.
     *
     * @throws WorkItemNotFoundException   if the project or change is unknown
     * @throws WorkItemTransitionException if the change cannot move to IN_PROGRESS
     */
    public AgentStatus startForPlannedItem(String projectId, String changeId, String model) {
        ProjectInfo project = catalog.findProject(projectId)
                .orElseThrow(() -> new WorkItemNotFoundException("Project " + projectId + " not found"));
        PlannedChange change = catalog.findPlannedChange(projectId, changeId)
                .orElseThrow(() -> new WorkItemNotFoundException(
                        "Change " + changeId + " not found in project " + projectId));

        if (!change.status().canTransitionTo(WorkItemStatus.IN_PROGRESS)) {
            throw new WorkItemTransitionException(changeId, change.status(), WorkItemStatus.IN_PROGRESS,
                    "only pending changes can be started");
        }
        TransitionResult moved = transitions.transitionToInProgress(projectId, changeId);
        if (!moved.success()) {
            throw new WorkItemTransitionException(changeId, change.status(), WorkItemStatus.IN_PROGRESS,
                    moved.error());
        }

        boolean agentUp = false;
        try {
            String baseBranch = change.baseBranch() != null ? change.baseBranch() : project.defaultBranch();
            String worktreePath = worktrees.ensureWorktree(project, change.branchName(), baseBranch)
                    .orElseThrow(() -> new IllegalStateException("Failed to create worktree for change " + changeId));

            String effectiveModel = resolveModel(model, project);
            AgentStatus status = startAgent(changeId, change.title(), worktreePath, effectiveModel);
            agentUp = true;
            String baseUrl = urls.internalBaseUrl(status.server().port());

            if (status.activeSession() != null) {
                sendInitialPrompt(changeId, baseUrl, status.activeSession().id(),
                        promptFactory.buildInitialPrompt(change, project), effectiveModel);
            }
            startMonitoring(changeId, projectId, change.branchName(), baseUrl);
            return status;
        } catch (RuntimeException e) {
            log.error("Failed to start agent for change {}; reverting to PENDING", changeId, e);
            if (agentUp) {
                startupTracker.markFailed(changeId, e.getMessage());
                try {
                    serverManager.stopServer(changeId);
                } catch (RuntimeException stopFailure) {
                    log.error("Could not stop agent server for change {}", changeId, stopFailure);
                    e.addSuppressed(stopFailure);
                }
            }
            try {
                transitions.handleStartFailure(projectId, changeId, e.getMessage());
            } catch (RuntimeException rollback) {
                log.error("Could not revert change {} to PENDING", changeId, rollback);
                e.addSuppressed(rollback);
            }
            throw e;
        }
    }

    private AgentStatus startAgent(String entityId, String title, String worktreePath, String model) {
        Optional<AgentServer> existing = serverManager.getServerForEntity(entityId)
                .filter(s -> s.getStatus() == AgentServerStatus.RUNNING);
        if (existing.isPresent()) {
            log.info("Agent already running for {}", entityId);
            return buildStatus(existing.get());
        }

        startupTracker.markStarting(entityId);
        boolean serverStarted = false;
        try {
            if (!worktrees.pullLatest(worktreePath)) {
                log.warn("Failed to pull latest changes for {}, continuing anyway", entityId);
            }
            configWriter.write(worktreePath, configWriter.defaultConfig(model));

            AgentServer server = serverManager.startServer(entityId, worktreePath, false);
            serverStarted = true;

            List<AgentSession> sessions = apiClient.listSessions(server.baseUrl());
            AgentSession active;
            if (sessions.isEmpty()) {
                active = apiClient.createSession(server.baseUrl(), title);
                sessions = List.of(active);
            } else {
                active = sessions.stream()
                        .max(Comparator.comparingLong(AgentSession::lastActivity))
                        .orElseThrow();
            }
            serverManager.setActiveSession(entityId, active.id());
            startupTracker.markStarted(entityId);

            log.info("Agent started for {} on port {}, session {}", entityId, server.getPort(), active.id());
            return new AgentStatus(entityId, RunningServerInfo.of(server, urls), active, sessions);
        } catch (RuntimeException e) {
            startupTracker.markFailed(entityId, e.getMessage());
            if (serverStarted) {
                serverManager.stopServer(entityId);
            }
            throw e;
        }
    }

    private void sendInitialPrompt(String entityId, String baseUrl, String sessionId, String prompt, String model) {
        promptExecutor.execute(() -> {
            MDC.put("entityId", entityId);
            try {
                apiClient.sendPromptAsync(baseUrl, sessionId, PromptRequest.fromText(prompt, model));
                log.info("Sent initial prompt for {} to session {}", entityId, sessionId);
            } catch (RuntimeException e) {
                log.error("Failed to send initial prompt for {} to session {}", entityId, sessionId, e);
            } finally {
                MDC.remove("entityId");
            }
        });
    }

    private String resolveModel(String requested, ProjectInfo project) {
        if (requested != null && !requested.isBlank()) return requested;
        if (project != null && project.defaultModel() != null && !project.defaultModel().isBlank()) {
            return project.defaultModel();
        }
        return defaultModel;
    }

    // ------------------------------------------------------------------
    // Background monitoring
    // ------------------------------------------------------------------

    private void startMonitoring(String entityId, String projectId, String branchName, String baseUrl) {
        MonitoringTask task = new MonitoringTask(entityId, projectId, branchName);
        MonitoringTask previous = monitors.put(entityId, task);
        if (previous != null) {
            previous.cancellation().cancel();
        }
        try {
            monitorExecutor.execute(() -> runMonitor(task, baseUrl));
            log.info("Monitoring {} for PR creation on branch {}", entityId, branchName);
        } catch (RejectedExecutionException e) {
            monitors.remove(entityId, task);
            throw e;
        }
    }

    private void runMonitor(MonitoringTask task, String baseUrl) {
        String entityId = task.entityId();
        MDC.put("entityId", entityId);
        boolean claimed = false;
        try {
            CompletionResult result = completionMonitor.monitorForCompletion(
                    baseUrl, task.projectId(), task.branchName(), task.cancellation());
            if (task.cancellation().isCancelled() || result.outcome() == CompletionResult.Outcome.CANCELLED) {
                log.info("Monitor for {} cancelled", entityId);
                return;
            }
            if (!task.claimSettlement()) {
                log.info("{} already settled by stop; ignoring {}", entityId, result.outcome());
                return;
            }
            claimed = true;
            applyCompletion(task.projectId(), entityId, result);
        } catch (Exception e) {
            if (!claimed && (task.cancellation().isCancelled() || !task.claimSettlement())) {
                log.info("Monitor for {} ended after cancellation: {}", entityId, e.getMessage());
                return;
            }
            log.error("Completion monitor for {} failed; moving to AWAITING_PR", entityId, e);
            moveToAwaitingPr(task.projectId(), entityId);
        } finally {
            monitors.remove(entityId, task);
            task.done().complete(null);
            MDC.remove("entityId");
        }
    }

    private void applyCompletion(String projectId, String entityId, CompletionResult result) {
        switch (result.outcome()) {
            case PR_DETECTED -> {
                log.info("Agent for {} opened PR #{}", entityId, result.prNumber());
                promote(projectId, entityId, result.prNumber());
                serverManager.stopServer(entityId);
            }
            case STREAM_ENDED -> {
                log.info("{}: {}", entityId, result.reason());
                moveToAwaitingPr(projectId, entityId);
                serverManager.stopServer(entityId);
            }
            case PR_NOT_FOUND -> {
                log.warn("{}: {}", entityId, result.reason());
                moveToAwaitingPr(projectId, entityId);
            }
            case CANCELLED -> { }
        }
    }

    private void promote(String projectId, String entityId, int prNumber) {
        TransitionResult promoted = transitions.promoteToTrackedPr(projectId, entityId, prNumber);
        if (!promoted.success()) {
            log.warn("Could not promote {} to PR #{}: {}", entityId, prNumber, promoted.error());
        }
        try {
            pullRequests.refreshPullRequests(projectId);
        } catch (RuntimeException e) {
            log.warn("PR refresh for project {} failed: {}", projectId, e.getMessage());
        }
    }

    private void moveToAwaitingPr(String projectId, String entityId) {
        try {
            TransitionResult moved = transitions.transitionToAwaitingPr(projectId, entityId);
            if (!moved.success()) {
                log.warn("Could not move {} to AWAITING_PR: {}", entityId, moved.error());
            }
        } catch (RuntimeException e) {
            log.error("Transition of {} to AWAITING_PR failed", entityId, e);
        }
    }

    // ------------------------------------------------------------------
    // Stop
    // ------------------------------------------------------------------

    /**
     * Cancel monitoring, stop the agent, then settle the item once: promoted if
     * its PR exists, AWAITING_PR otherwise.
     */
    public void stop(String itemId) {
        MonitoringTask task = monitors.remove(itemId);
        if (task != null) {
            task.cancellation().cancel();
        }
        serverManager.stopServer(itemId);
        startupTracker.clearState(itemId);
        log.info("Agent stopped for {}", itemId);

        if (task != null && !task.claimSettlement()) {
            log.info("Monitor for {} is already settling it", itemId);
            return;
        }
        settleAfterStop(itemId, task);
    }

    private void settleAfterStop(String itemId, MonitoringTask task) {
        Optional<PlannedChange> change = task != null
                ? catalog.findPlannedChange(task.projectId(), itemId)
                : findInProgressChange(itemId);
        if (change.isEmpty() || change.get().status() != WorkItemStatus.IN_PROGRESS) {
            log.debug("No in-progress item {} to settle after stop", itemId);
            return;
        }

        String projectId  = change.get().projectId();
        String branchName = task != null ? task.branchName() : change.get().branchName();
        try {
            Optional<PullRequestLookup.OpenPullRequest> pr = pullRequests.listOpenPullRequests(projectId).stream()
                    .filter(p -> p.branchName() != null && p.branchName().equalsIgnoreCase(branchName))
                    .findFirst();
            if (pr.isPresent() && pr.get().number() > 0) {
                log.info("Found PR #{} for {} after stop", pr.get().number(), itemId);
                promote(projectId, itemId, pr.get().number());
            } else {
                log.info("No PR for {} after stop; moving to AWAITING_PR", itemId);
                moveToAwaitingPr(projectId, itemId);
            }
        } catch (RuntimeException e) {
            log.error("PR lookup for {} failed after stop; moving to AWAITING_PR", itemId, e);
            moveToAwaitingPr(projectId, itemId);
        }
    }

    private Optional<PlannedChange> findInProgressChange(String itemId) {
        for (ProjectInfo project : catalog.listProjects()) {
            Optional<PlannedChange> change = catalog.findPlannedChange(project.id(), itemId)
                    .filter(c -> c.status() == WorkItemStatus.IN_PROGRESS);
            if (change.isPresent()) {
                return change;
            }
        }
        return Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        new ArrayList<>(monitors.values()).forEach(t -> t.cancellation().cancel());
        monitors.clear();
    }

    // ------------------------------------------------------------------
    // Running agents
    // ------------------------------------------------------------------

    /**
     * Send a prompt to the item's active session and wait for the reply.
     *
     * @throws IllegalStateException if no agent is running for the item or it has no active session
     */
    public AgentMessage sendPrompt(String itemId, String text) {
        AgentServer server = requireActiveSession(itemId);
        log.info("Sending prompt to {} ({} chars)", itemId, text.length());
        return apiClient.sendPrompt(server.baseUrl(), server.getActiveSessionId(), PromptRequest.fromText(text));
    }

    /**
     * @throws IllegalStateException if no agent is running for the item or it has no active session
     */
    public boolean abort(String itemId) {
        AgentServer server = requireActiveSession(itemId);
        return apiClient.abortSession(server.baseUrl(), server.getActiveSessionId());
    }

    /** Status of the item's agent, or null unless it is running. */
    public AgentStatus getStatus(String itemId) {
        return serverManager.getServerForEntity(itemId)
                .filter(s -> s.getStatus() == AgentServerStatus.RUNNING)
                .map(this::buildStatus)
                .orElse(null);
    }

    public List<RunningServerInfo> getRunningAgents() {
        return serverManager.getRunningServers().stream()
                .map(s -> RunningServerInfo.of(s, urls))
                .toList();
    }

    public boolean isMonitoring(String itemId) {
        return monitors.containsKey(itemId);
    }

    private AgentServer requireActiveSession(String itemId) {
        AgentServer server = serverManager.getServerForEntity(itemId)
                .filter(s -> s.getStatus() == AgentServerStatus.RUNNING)
                .orElseThrow(() -> new IllegalStateException("No agent running for " + itemId));
        if (server.getActiveSessionId() == null || server.getActiveSessionId().isBlank()) {
            throw new IllegalStateException("No active session for " + itemId);
        }
        return server;
    }

    private AgentStatus buildStatus(AgentServer server) {
        List<AgentSession> sessions = apiClient.listSessions(server.baseUrl());
        AgentSession active = sessions.stream()
                .filter(s -> s.id() != null && s.id().equals(server.getActiveSessionId()))
                .findFirst()
                .orElse(null);
        return new AgentStatus(server.getEntityId(), RunningServerInfo.of(server, urls), active, sessions);
    }
}
