package com.devloop.orchestrator.api;

import com.devloop.orchestrator.client.AgentApiException;
import com.devloop.orchestrator.client.dto.AgentSession;
import com.devloop.orchestrator.notify.AgentNotificationHub;
import com.devloop.orchestrator.server.AgentStartupException;
import com.devloop.orchestrator.server.PortCapacityExceededException;
import com.devloop.orchestrator.startup.AgentStartupInfo;
import com.devloop.orchestrator.startup.AgentStartupState;
import com.devloop.orchestrator.startup.StartupTracker;
import com.devloop.orchestrator.workflow.AgentConfigException;
import com.devloop.orchestrator.workflow.AgentStatus;
import com.devloop.orchestrator.workflow.AgentWorkflowService;
import com.devloop.orchestrator.workflow.RunningServerInfo;
import com.devloop.orchestrator.workflow.WorkItemNotFoundException;
import com.devloop.orchestrator.workflow.WorkItemStatus;
import com.devloop.orchestrator.workflow.WorkItemTransitionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for AgentController.
 *
 * Only the web layer starts; the workflow service and its neighbours are mocks,
 * so each test checks how one outcome maps onto HTTP.
 */
@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean AgentWorkflowService workflow;
    @MockitoBean StartupTracker       startupTracker;
    @MockitoBean AgentNotificationHub notifications;

    static RunningServerInfo serverInfo(String entityId) {
        return new RunningServerInfo(entityId, 4097, "http://127.0.0.1:4097", "/repo/.worktrees/" + entityId,
                Instant.parse("2025-01-01T00:00:00Z"), "ses_1",
                "http://127.0.0.1:4097/L3JlcG8/session/ses_1");
    }

    static AgentStatus agentStatus(String entityId) {
        AgentSession session = new AgentSession("ses_1", "Add login", null, null);
        return new AgentStatus(entityId, serverInfo(entityId), session, List.of(session));
    }

    // ------------------------------------------------------------------
    // GET /agents
    // ------------------------------------------------------------------

    @Test
    void listRunning_returnsServerInfo() throws Exception {
        when(workflow.getRunningAgents()).thenReturn(List.of(serverInfo("feat-login")));

        mockMvc.perform(get("/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entityId").value("feat-login"))
                .andExpect(jsonPath("$[0].port").value(4097))
                .andExpect(jsonPath("$[0].activeSessionId").value("ses_1"));
    }

    @Test
    void getStatus_running_returns200() throws Exception {
        when(workflow.getStatus("feat-login")).thenReturn(agentStatus("feat-login"));

        mockMvc.perform(get("/agents/feat-login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.server.port").value(4097))
                .andExpect(jsonPath("$.activeSession.id").value("ses_1"));
    }

    @Test
    void getStatus_notRunning_returns404() throws Exception {
        when(workflow.getStatus("feat-login")).thenReturn(null);

        mockMvc.perform(get("/agents/feat-login"))
                .andExpect(status().isNotFound());
    }

    @Test
    void startupStates_listsTrackerEntries() throws Exception {
        when(startupTracker.getAllStates()).thenReturn(List.of(
                new AgentStartupInfo("feat-login", AgentStartupState.FAILED, "port pool exhausted")));

        mockMvc.perform(get("/agents/startup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("FAILED"))
                .andExpect(jsonPath("$[0].errorMessage").value("port pool exhausted"));
    }

    // ------------------------------------------------------------------
    // POST start
    // ------------------------------------------------------------------

    @Test
    void startForChange_passesModelAndReturnsStatus() throws Exception {
        when(workflow.startForPlannedItem("proj-1", "feat-login", "openai/gpt-5")).thenReturn(agentStatus("feat-login"));

        mockMvc.perform(post("/agents/projects/proj-1/changes/feat-login/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"model":"openai/gpt-5"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("feat-login"));
    }

    @Test
    void startForItem_withoutBody_usesDefaultModel() throws Exception {
        when(workflow.startForExistingItem(eq("item-7"), isNull())).thenReturn(agentStatus("item-7"));

        mockMvc.perform(post("/agents/items/item-7/start"))
                .andExpect(status().isOk());

        verify(workflow).startForExistingItem("item-7", null);
    }

    @Test
    void start_poolFull_returns503() throws Exception {
        when(workflow.startForPlannedItem(any(), any(), any())).thenThrow(new PortCapacityExceededException(10));

        mockMvc.perform(post("/agents/projects/proj-1/changes/feat-login/start"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void start_agentUnhealthy_returns502() throws Exception {
        when(workflow.startForPlannedItem(any(), any(), any()))
                .thenThrow(new AgentStartupException("feat-login", "did not become healthy"));

        mockMvc.perform(post("/agents/projects/proj-1/changes/feat-login/start"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void start_changeNotPending_returns409() throws Exception {
        when(workflow.startForPlannedItem(any(), any(), any())).thenThrow(new WorkItemTransitionException(
                "feat-login", WorkItemStatus.COMPLETE, WorkItemStatus.IN_PROGRESS, "only pending changes can be started"));

        mockMvc.perform(post("/agents/projects/proj-1/changes/feat-login/start"))
                .andExpect(status().isConflict());
    }

    @Test
    void start_unknownItem_returns404() throws Exception {
        when(workflow.startForExistingItem(any(), any())).thenThrow(new WorkItemNotFoundException("Work item x not found"));

        mockMvc.perform(post("/agents/items/x/start"))
                .andExpect(status().isNotFound());
    }

    @Test
    void start_configWriteFails_returns500() throws Exception {
        when(workflow.startForExistingItem(any(), any()))
                .thenThrow(new AgentConfigException("Failed to write agent config", new IOException("read-only")));

        mockMvc.perform(post("/agents/items/item-7/start"))
                .andExpect(status().isInternalServerError());
    }

    // ------------------------------------------------------------------
    // POST stop / prompt / abort
    // ------------------------------------------------------------------

    @Test
    void stop_returns204() throws Exception {
        mockMvc.perform(post("/agents/feat-login/stop"))
                .andExpect(status().isNoContent());

        verify(workflow).stop("feat-login");
    }

    @Test
    void prompt_blankText_returns400WithoutCallingWorkflow() throws Exception {
        mockMvc.perform(post("/agents/feat-login/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"  "}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(workflow);
    }

    @Test
    void prompt_noAgentRunning_returns409() throws Exception {
        when(workflow.sendPrompt("feat-login", "hello"))
                .thenThrow(new IllegalStateException("No agent running for feat-login"));

        mockMvc.perform(post("/agents/feat-login/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"hello"}
                                """))
                .andExpect(status().isConflict());
    }

    @Test
    void prompt_agentApiFails_returns502() throws Exception {
        when(workflow.sendPrompt("feat-login", "hello")).thenThrow(new AgentApiException("send prompt failed"));

        mockMvc.perform(post("/agents/feat-login/prompt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"hello"}
                                """))
                .andExpect(status().isBadGateway());
    }

    @Test
    void abort_returnsOutcome() throws Exception {
        when(workflow.abort("feat-login")).thenReturn(true);

        mockMvc.perform(post("/agents/feat-login/abort"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityId").value("feat-login"))
                .andExpect(jsonPath("$.aborted").value(true));
    }
}
