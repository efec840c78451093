package com.devloop.orchestrator.proxy;

import com.devloop.orchestrator.config.AgentProperties;
import com.devloop.orchestrator.server.AgentServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live routing table for the agent reverse proxy.
 *
 * Each add or remove builds a fresh {@link RouteSnapshot} from the current one
 * plus or minus a single entry, publishes it atomically, then fires the old
 * snapshot's change signal. Readers never see a partially updated table.
 *
 * Routes follow server lifecycle: added on STARTED, removed on STOPPED.
 */
@Component
public class ProxyRouteManager {

    private static final Logger log = LoggerFactory.getLogger(ProxyRouteManager.class);

    private final String basePath;
    private final AtomicReference<RouteSnapshot> current = new AtomicReference<>(new RouteSnapshot(Map.of()));

    public ProxyRouteManager(AgentProperties props) {
        this.basePath = props.proxyBasePath();
    }

    public String basePath() { return basePath; }

    public RouteSnapshot snapshot() {
        return current.get();
    }

    public void addRoute(int port) {
        ProxyRoute route = ProxyRoute.forPort(basePath, port);
        RouteSnapshot previous = current.getAndUpdate(snap -> {
            Map<Integer, ProxyRoute> next = new HashMap<>();
            snap.routes().forEach(r -> next.put(r.port(), r));
            next.put(port, route);
            return new RouteSnapshot(next);
        });
        previous.signalChanged();
        log.info("Added proxy route {} -> {}", route.pathPrefix(), route.destination());
    }

    public void removeRoute(int port) {
        RouteSnapshot previous = current.getAndUpdate(snap -> {
            Map<Integer, ProxyRoute> next = new HashMap<>();
            snap.routes().forEach(r -> next.put(r.port(), r));
            next.remove(port);
            return new RouteSnapshot(next);
        });
        previous.signalChanged();
        log.info("Removed proxy route for port {}", port);
    }

    @EventListener
    public void onServerEvent(AgentServerEvent event) {
        switch (event.kind()) {
            case STARTED -> addRoute(event.port());
            case STOPPED -> removeRoute(event.port());
            case UPDATED -> { }
        }
    }
}
