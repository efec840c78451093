package com.devloop.orchestrator.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory record of which agents are starting, started, or failed to start.
 *
 * Every transition is handed to registered listeners and published as an
 * {@link AgentStartupInfo} application event. A failing listener is logged and
 * does not stop the others.
 */
@Component
public class StartupTracker {

    private static final Logger log = LoggerFactory.getLogger(StartupTracker.class);

    private final ConcurrentHashMap<String, AgentStartupInfo> states = new ConcurrentHashMap<>();
    private final List<Consumer<AgentStartupInfo>> listeners = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher events;

    public StartupTracker(ApplicationEventPublisher events) {
        this.events = events;
    }

    public AgentStartupInfo getState(String entityId) {
        AgentStartupInfo info = states.get(entityId);
        return info != null ? info : new AgentStartupInfo(entityId, AgentStartupState.NOT_STARTED);
    }

    public List<AgentStartupInfo> getAllStates() {
        return List.copyOf(states.values());
    }

    public void markStarting(String entityId) {
        update(new AgentStartupInfo(entityId, AgentStartupState.STARTING));
    }

    public void markStarted(String entityId) {
        update(new AgentStartupInfo(entityId, AgentStartupState.STARTED));
    }

    public void markFailed(String entityId, String errorMessage) {
        update(new AgentStartupInfo(entityId, AgentStartupState.FAILED, errorMessage));
    }

    public void clearState(String entityId) {
        states.remove(entityId);
        notifyListeners(new AgentStartupInfo(entityId, AgentStartupState.NOT_STARTED));
    }

    public boolean isStarting(String entityId) {
        return getState(entityId).state() == AgentStartupState.STARTING;
    }

    public boolean hasFailed(String entityId) {
        return getState(entityId).state() == AgentStartupState.FAILED;
    }

    public void addListener(Consumer<AgentStartupInfo> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<AgentStartupInfo> listener) {
        listeners.remove(listener);
    }

    private void update(AgentStartupInfo info) {
        states.put(info.entityId(), info);
        notifyListeners(info);
    }

    private void notifyListeners(AgentStartupInfo info) {
        log.debug("Agent startup state for {} -> {}", info.entityId(), info.state());
        for (Consumer<AgentStartupInfo> listener : listeners) {
            try {
                listener.accept(info);
            } catch (RuntimeException e) {
                log.warn("Startup listener failed for {}: {}", info.entityId(), e.getMessage());
            }
        }
        events.publishEvent(info);
    }
}
