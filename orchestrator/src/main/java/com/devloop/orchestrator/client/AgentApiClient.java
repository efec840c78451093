package com.devloop.orchestrator.client;

import com.devloop.orchestrator.client.dto.AgentMessage;
import com.devloop.orchestrator.client.dto.AgentSession;
import com.devloop.orchestrator.client.dto.HealthResponse;
import com.devloop.orchestrator.client.dto.PromptRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for a single agent server's REST API.
 *
 * Every method takes the server's base URL ({@code http://127.0.0.1:{port}})
 * because one client instance talks to every agent in the pool. The event
 * stream lives in {@link EventStreamClient}.
 */
@Component
public class AgentApiClient {

    private static final Logger log = LoggerFactory.getLogger(AgentApiClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration HEALTH_TIMEOUT  = Duration.ofSeconds(2);

    // A synchronous prompt returns only when the agent has finished replying.
    private static final Duration PROMPT_TIMEOUT  = Duration.ofMinutes(30);

    private static final TypeReference<List<AgentSession>> SESSION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<AgentMessage>> MESSAGE_LIST = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;

    public AgentApiClient(HttpClient agentHttpClient, ObjectMapper objectMapper) {
        this.http = agentHttpClient;
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Server
    // ------------------------------------------------------------------

    public HealthResponse getHealth(String baseUrl) {
        String body = get(baseUrl + "/global/health", HEALTH_TIMEOUT, "health check");
        return read(body, HealthResponse.class, "health response");
    }

    /**
     * Working directory the agent reports via GET /path, or null if it cannot be
     * determined. Diagnostic only, so failures are logged rather than thrown.
     */
    public String getCurrentPath(String baseUrl) {
        try {
            String body = get(baseUrl + "/path", DEFAULT_TIMEOUT, "get path");
            JsonNode root = json.readTree(body);
            if (root.isTextual()) {
                return root.asText();
            }
            for (String field : List.of("directory", "worktree", "path", "cwd")) {
                JsonNode value = root.get(field);
                if (value != null && value.isTextual()) {
                    return value.asText();
                }
            }
            log.warn("No path property in /path response from {}: {}", baseUrl, body);
            return null;
        } catch (Exception e) {
            log.warn("Could not read current path from {}: {}", baseUrl, e.getMessage());
            return null;
        }
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    public List<AgentSession> listSessions(String baseUrl) {
        String body = get(baseUrl + "/session", DEFAULT_TIMEOUT, "list sessions");
        return read(body, SESSION_LIST, "session list");
    }

    public AgentSession getSession(String baseUrl, String sessionId) {
        String body = get(baseUrl + "/session/" + sessionId, DEFAULT_TIMEOUT, "get session " + sessionId);
        return read(body, AgentSession.class, "session " + sessionId);
    }

    public AgentSession createSession(String baseUrl, String title) {
        Map<String, Object> payload = new HashMap<>();
        if (title != null) payload.put("title", title);
        String body = send(post(baseUrl + "/session", toJson(payload), DEFAULT_TIMEOUT), "create session");
        return read(body, AgentSession.class, "created session");
    }

    public boolean deleteSession(String baseUrl, String sessionId) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/session/" + sessionId))
                .timeout(DEFAULT_TIMEOUT)
                .DELETE()
                .build();
        return sendForStatus(req, "delete session " + sessionId);
    }

    public boolean abortSession(String baseUrl, String sessionId) {
        HttpRequest req = post(baseUrl + "/session/" + sessionId + "/abort", "{}", DEFAULT_TIMEOUT);
        return sendForStatus(req, "abort session " + sessionId);
    }

    // ------------------------------------------------------------------
    // Messages
    // ------------------------------------------------------------------

    public List<AgentMessage> getMessages(String baseUrl, String sessionId) {
        String body = get(baseUrl + "/session/" + sessionId + "/message", DEFAULT_TIMEOUT,
                "get messages for " + sessionId);
        return read(body, MESSAGE_LIST, "message list");
    }

    /** Send a prompt and block until the agent's reply is complete. */
    public AgentMessage sendPrompt(String baseUrl, String sessionId, PromptRequest request) {
        log.info("POST {}/session/{}/message", baseUrl, sessionId);
        String body = send(post(baseUrl + "/session/" + sessionId + "/message", toJson(request), PROMPT_TIMEOUT),
                "send prompt to " + sessionId);
        return read(body, AgentMessage.class, "prompt reply");
    }

    /** Queue a prompt; returns as soon as the agent has accepted it. */
    public void sendPromptAsync(String baseUrl, String sessionId, PromptRequest request) {
        log.info("POST {}/session/{}/prompt_async", baseUrl, sessionId);
        send(post(baseUrl + "/session/" + sessionId + "/prompt_async", toJson(request), DEFAULT_TIMEOUT),
                "send async prompt to " + sessionId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String get(String url, Duration timeout, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(req, opName);
    }

    private static HttpRequest post(String url, String jsonBody, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new AgentApiException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
            }
            return resp.body();
        } catch (AgentApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentApiException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new AgentApiException(opName + " failed", e);
        }
    }

    private boolean sendForStatus(HttpRequest req, String opName) {
        try {
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() >= 200 && resp.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentApiException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new AgentApiException(opName + " failed", e);
        }
    }

    private <T> T read(String body, Class<T> type, String what) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new AgentApiException("Failed to parse " + what, e);
        }
    }

    private <T> T read(String body, TypeReference<T> type, String what) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new AgentApiException("Failed to parse " + what, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentApiException("JSON serialization failed", e);
        }
    }
}
