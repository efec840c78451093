package com.devloop.orchestrator.api;

import com.devloop.orchestrator.api.dto.AbortResponse;
import com.devloop.orchestrator.api.dto.PromptRequestBody;
import com.devloop.orchestrator.api.dto.StartAgentRequest;
import com.devloop.orchestrator.client.AgentApiException;
import com.devloop.orchestrator.client.dto.AgentMessage;
import com.devloop.orchestrator.notify.AgentNotificationHub;
import com.devloop.orchestrator.server.AgentStartupException;
import com.devloop.orchestrator.server.PortCapacityExceededException;
import com.devloop.orchestrator.startup.AgentStartupInfo;
import com.devloop.orchestrator.startup.StartupTracker;
import com.devloop.orchestrator.workflow.AgentConfigException;
import com.devloop.orchestrator.workflow.AgentStatus;
import com.devloop.orchestrator.workflow.AgentWorkflowService;
import com.devloop.orchestrator.workflow.RunningServerInfo;
import com.devloop.orchestrator.workflow.WorkItemNotFoundException;
import com.devloop.orchestrator.workflow.WorkItemTransitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.function.Supplier;

/**
 * REST API for agent lifecycle.
 *
 * GET  /agents                                           : running agents
 * GET  /agents/{entityId}                                : status of one running agent
 * GET  /agents/startup                                   : startup state of every tracked item
 * GET  /agents/events                                    : SSE stream of server list and startup changes
 * POST /agents/items/{itemId}/start                      : start for an item that already has a branch
 * POST /agents/projects/{projectId}/changes/{changeId}/start : start for a planned change
 * POST /agents/{entityId}/stop                           : stop and settle the item
 * POST /agents/{entityId}/prompt                         : send a prompt, wait for the reply
 * POST /agents/{entityId}/abort                          : abort the active session
 */
@RestController
@RequestMapping("/agents")
public class AgentController {

    private final AgentWorkflowService workflow;
    private final StartupTracker       startupTracker;
    private final AgentNotificationHub notifications;

    public AgentController(AgentWorkflowService workflow,
                           StartupTracker startupTracker,
                           AgentNotificationHub notifications) {
        this.workflow       = workflow;
        this.startupTracker = startupTracker;
        this.notifications  = notifications;
    }

    @GetMapping
    public List<RunningServerInfo> listRunning() {
        return workflow.getRunningAgents();
    }

    /**
     * Returns 404 unless an agent is running for the entity.
     */
    @GetMapping("/{entityId}")
    public AgentStatus getStatus(@PathVariable String entityId) {
        AgentStatus status = call(() -> workflow.getStatus(entityId));
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No agent running for " + entityId);
        }
        return status;
    }

    @GetMapping("/startup")
    public List<AgentStartupInfo> startupStates() {
        return startupTracker.getAllStates();
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return notifications.subscribe();
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/agents/items/pr-17/start \
     *     -H "Content-Type: application/json" -d '{"model":"anthropic/claude-opus-4-5"}'
     */
    @PostMapping("/items/{itemId}/start")
    public AgentStatus startForItem(@PathVariable String itemId,
                                    @RequestBody(required = false) StartAgentRequest req) {
        return call(() -> workflow.startForExistingItem(itemId, req != null ? req.model() : null));
    }

    @PostMapping("/projects/{projectId}/changes/{changeId}/start")
    public AgentStatus startForChange(@PathVariable String projectId,
                                      @PathVariable String changeId,
                                      @RequestBody(required = false) StartAgentRequest req) {
        return call(() -> workflow.startForPlannedItem(projectId, changeId, req != null ? req.model() : null));
    }

    @PostMapping("/{entityId}/stop")
    public ResponseEntity<Void> stop(@PathVariable String entityId) {
        call(() -> {
            workflow.stop(entityId);
            return null;
        });
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{entityId}/prompt")
    public AgentMessage prompt(@PathVariable String entityId, @RequestBody PromptRequestBody body) {
        if (body == null || body.text() == null || body.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Prompt text is required");
        }
        return call(() -> workflow.sendPrompt(entityId, body.text()));
    }

    @PostMapping("/{entityId}/abort")
    public AbortResponse abort(@PathVariable String entityId) {
        return new AbortResponse(entityId, call(() -> workflow.abort(entityId)));
    }

    /** Map workflow failures onto HTTP statuses. */
    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (WorkItemNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (WorkItemTransitionException | IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        } catch (PortCapacityExceededException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        } catch (AgentStartupException | AgentApiException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        } catch (AgentConfigException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }
}
