package com.devloop.orchestrator.notify;

import com.devloop.orchestrator.server.AgentServerManager;
import com.devloop.orchestrator.server.PortAllocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentPoolHealthIndicatorTest {

    @Mock AgentServerManager servers;

    @Test
    void health_poolHasRoom_isUp() {
        when(servers.getRunningServers()).thenReturn(List.of());
        PortAllocator ports = new PortAllocator(5000, 2);
        ports.allocatePort();

        Health health = new AgentPoolHealthIndicator(ports, servers).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("portsInUse", 1).containsEntry("capacity", 2);
    }

    @Test
    void health_poolExhausted_isOutOfService() {
        when(servers.getRunningServers()).thenReturn(List.of());
        PortAllocator ports = new PortAllocator(5000, 1);
        ports.allocatePort();

        Health health = new AgentPoolHealthIndicator(ports, servers).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }
}
