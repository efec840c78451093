package com.devloop.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Opens the long-lived GET /event stream of an agent server.
 *
 * No request timeout is set: an agent may work for hours between events.
 */
@Component
public class EventStreamClient {

    private static final Logger log = LoggerFactory.getLogger(EventStreamClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;

    public EventStreamClient(HttpClient agentHttpClient, ObjectMapper objectMapper) {
        this.http = agentHttpClient;
        this.json = objectMapper;
    }

    /**
     * @throws AgentApiException if the stream cannot be opened
     */
    public EventSubscription subscribe(String baseUrl) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/event"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        try {
            HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                resp.body().close();
                throw new AgentApiException("subscribe to " + baseUrl + "/event failed: HTTP "
                        + resp.statusCode(), resp.statusCode());
            }
            log.info("Subscribed to event stream at {}", baseUrl);
            InputStream body = resp.body();
            BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
            return new EventSubscription(reader, body, json, baseUrl);
        } catch (AgentApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentApiException("subscribe to " + baseUrl + "/event interrupted", e);
        } catch (IOException e) {
            throw new AgentApiException("subscribe to " + baseUrl + "/event failed", e);
        }
    }
}
