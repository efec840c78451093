package com.devloop.orchestrator.proxy;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One immutable version of the proxy routing table.
 *
 * A snapshot never changes after publication; when a newer one replaces it,
 * its change signal fires so readers holding it know to re-read.
 */
public final class RouteSnapshot {

    private final Map<Integer, ProxyRoute> routes;
    private final AtomicBoolean stale = new AtomicBoolean();

    RouteSnapshot(Map<Integer, ProxyRoute> routes) {
        this.routes = Map.copyOf(routes);
    }

    public ProxyRoute route(int port) {
        return routes.get(port);
    }

    public Collection<ProxyRoute> routes() {
        return routes.values();
    }

    public int size() {
        return routes.size();
    }

    /** True once a newer snapshot has been published. */
    public boolean isStale() {
        return stale.get();
    }

    void signalChanged() {
        stale.set(true);
    }
}
