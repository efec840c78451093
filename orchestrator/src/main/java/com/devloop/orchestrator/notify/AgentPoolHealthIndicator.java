package com.devloop.orchestrator.notify;

import com.devloop.orchestrator.server.AgentServerManager;
import com.devloop.orchestrator.server.PortAllocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * {@code /actuator/health/agents}: port pool usage and running servers.
 * Reports OUT_OF_SERVICE while the pool is exhausted.
 */
@Component("agents")
public class AgentPoolHealthIndicator implements HealthIndicator {

    private final PortAllocator      ports;
    private final AgentServerManager servers;

    public AgentPoolHealthIndicator(PortAllocator ports, AgentServerManager servers) {
        this.ports   = ports;
        this.servers = servers;
    }

    @Override
    public Health health() {
        int outstanding = ports.outstanding();
        int capacity    = ports.capacity();
        Health.Builder builder = outstanding >= capacity ? Health.outOfService() : Health.up();
        return builder
                .withDetail("portsInUse", outstanding)
                .withDetail("capacity", capacity)
                .withDetail("runningServers", servers.getRunningServers().size())
                .build();
    }
}
