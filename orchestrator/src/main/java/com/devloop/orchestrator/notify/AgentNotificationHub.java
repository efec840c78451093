package com.devloop.orchestrator.notify;

import com.devloop.orchestrator.server.AgentServerEvent;
import com.devloop.orchestrator.server.AgentServerManager;
import com.devloop.orchestrator.startup.AgentStartupInfo;
import com.devloop.orchestrator.workflow.AgentUrlService;
import com.devloop.orchestrator.workflow.RunningServerInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes agent notifications to connected UI clients over Server-Sent Events.
 *
 *   event: servers   data: [RunningServerInfo...]   whenever a server starts, stops or changes session
 *   event: startup   data: AgentStartupInfo      on every startup state change
 *
 * Clients whose connection has gone away are dropped on the next send.
 */
@Component
public class AgentNotificationHub {

    private static final Logger log = LoggerFactory.getLogger(AgentNotificationHub.class);

    static final String SERVERS_EVENT = "servers";
    static final String STARTUP_EVENT = "startup";

    private static final Duration EMITTER_TIMEOUT = Duration.ofMinutes(30);

    private final AgentServerManager serverManager;
    private final AgentUrlService    urls;
    private final List<SseEmitter>   emitters = new CopyOnWriteArrayList<>();

    public AgentNotificationHub(AgentServerManager serverManager, AgentUrlService urls) {
        this.serverManager = serverManager;
        this.urls          = urls;
    }

    /** Register a new subscriber and send it the current server list. */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT.toMillis());
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));

        send(emitter, SERVERS_EVENT, runningServers());
        log.debug("UI subscriber connected ({} total)", emitters.size());
        return emitter;
    }

    public int subscriberCount() {
        return emitters.size();
    }

    @EventListener
    public void onServerEvent(AgentServerEvent event) {
        broadcast(SERVERS_EVENT, runningServers());
    }

    @EventListener
    public void onStartupState(AgentStartupInfo info) {
        broadcast(STARTUP_EVENT, info);
    }

    private List<RunningServerInfo> runningServers() {
        return serverManager.getRunningServers().stream()
                .map(s -> RunningServerInfo.of(s, urls))
                .toList();
    }

    private void broadcast(String name, Object payload) {
        for (SseEmitter emitter : emitters) {
            send(emitter, name, payload);
        }
    }

    private void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping UI subscriber: {}", e.getMessage());
            emitters.remove(emitter);
        }
    }
}
