package com.devloop.orchestrator.client;

import com.devloop.orchestrator.client.dto.AgentSession;
import com.devloop.orchestrator.client.dto.HealthResponse;
import com.devloop.orchestrator.client.dto.PromptRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AgentApiClient.
 *
 * The JDK {@link HttpClient} is mocked; each test scripts the agent's reply.
 */
@ExtendWith(MockitoExtension.class)
class AgentApiClientTest {

    static final String BASE = "http://127.0.0.1:4097";

    @Mock HttpClient           http;
    @Mock HttpResponse<String> response;

    AgentApiClient client;

    @BeforeEach
    void setUp() {
        client = new AgentApiClient(http, new ObjectMapper());
    }

    private void agentReplies(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        doReturn(response).when(http).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        return captor.getValue();
    }

    // ------------------------------------------------------------------
    // Health and path
    // ------------------------------------------------------------------

    @Test
    void getHealth_parsesResponse() throws Exception {
        agentReplies(200, "{\"healthy\":true,\"version\":\"0.9.1\"}");

        HealthResponse health = client.getHealth(BASE);

        assertThat(health.healthy()).isTrue();
        assertThat(health.version()).isEqualTo("0.9.1");
        assertThat(sentRequest().uri().toString()).isEqualTo(BASE + "/global/health");
    }

    @Test
    void getHealth_non2xx_throwsWithStatusCode() throws Exception {
        agentReplies(503, "starting");

        assertThatThrownBy(() -> client.getHealth(BASE))
                .isInstanceOf(AgentApiException.class)
                .satisfies(e -> assertThat(((AgentApiException) e).statusCode()).isEqualTo(503));
    }

    @Test
    void getHealth_connectionRefused_wrapsError() throws Exception {
        doThrow(new IOException("Connection refused")).when(http).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.getHealth(BASE))
                .isInstanceOf(AgentApiException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void getCurrentPath_readsFirstKnownField() throws Exception {
        agentReplies(200, "{\"state\":\"/x/state\",\"worktree\":\"/repo/.worktrees/feat\",\"cwd\":\"/other\"}");

        assertThat(client.getCurrentPath(BASE)).isEqualTo("/repo/.worktrees/feat");
    }

    @Test
    void getCurrentPath_plainString_isAccepted() throws Exception {
        agentReplies(200, "\"/repo\"");

        assertThat(client.getCurrentPath(BASE)).isEqualTo("/repo");
    }

    @Test
    void getCurrentPath_failure_returnsNull() throws Exception {
        agentReplies(500, "boom");

        assertThat(client.getCurrentPath(BASE)).isNull();
    }

    // ------------------------------------------------------------------
    // Sessions and prompts
    // ------------------------------------------------------------------

    @Test
    void listSessions_parsesTimes() throws Exception {
        agentReplies(200, """
                [{"id":"ses_1","title":"a","time":{"created":100,"updated":300}},
                 {"id":"ses_2","title":"b","time":{"created":200}}]
                """);

        List<AgentSession> sessions = client.listSessions(BASE);

        assertThat(sessions).extracting(AgentSession::id).containsExactly("ses_1", "ses_2");
        assertThat(sessions.get(0).lastActivity()).isEqualTo(300L);
        assertThat(sessions.get(1).lastActivity()).isEqualTo(200L);
    }

    @Test
    void createSession_postsTitle() throws Exception {
        agentReplies(200, "{\"id\":\"ses_9\",\"title\":\"Fix login\"}");

        AgentSession session = client.createSession(BASE, "Fix login");

        assertThat(session.id()).isEqualTo("ses_9");
        HttpRequest sent = sentRequest();
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.uri().toString()).isEqualTo(BASE + "/session");
    }

    @Test
    void sendPromptAsync_postsToPromptAsync() throws Exception {
        agentReplies(204, "");

        client.sendPromptAsync(BASE, "ses_1", PromptRequest.fromText("hello", "anthropic/claude-sonnet-4"));

        assertThat(sentRequest().uri().toString()).isEqualTo(BASE + "/session/ses_1/prompt_async");
    }

    @Test
    void abortSession_reportsSuccessFromStatus() throws Exception {
        @SuppressWarnings("unchecked")
        HttpResponse<Void> discarded = mock(HttpResponse.class);
        when(discarded.statusCode()).thenReturn(200);
        doReturn(discarded).when(http).send(any(HttpRequest.class), any());

        assertThat(client.abortSession(BASE, "ses_1")).isTrue();
        assertThat(sentRequest().uri().toString()).isEqualTo(BASE + "/session/ses_1/abort");
    }
}
