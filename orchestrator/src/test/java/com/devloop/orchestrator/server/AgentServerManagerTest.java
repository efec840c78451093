package com.devloop.orchestrator.server;

import com.devloop.orchestrator.client.AgentApiClient;
import com.devloop.orchestrator.client.AgentApiException;
import com.devloop.orchestrator.client.dto.HealthResponse;
import com.devloop.orchestrator.config.AgentProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AgentServerManager.
 *
 * The process launcher and agent HTTP API are mocked; ports come from a real
 * allocator so leaks show up as outstanding ports.
 */
@ExtendWith(MockitoExtension.class)
class AgentServerManagerTest {

    @Mock AgentProcessLauncher      launcher;
    @Mock AgentApiClient            apiClient;
    @Mock ApplicationEventPublisher events;
    @Mock Process                   process;

    @TempDir Path worktree;

    PortAllocator       ports;
    SimpleMeterRegistry meters;
    AgentServerManager  manager;

    @BeforeEach
    void setUp() {
        lenient().when(process.isAlive()).thenReturn(true);
        managerWithCapacity(10);
    }

    private void managerWithCapacity(int capacity) {
        AgentProperties props = new AgentProperties(null, 5000, capacity,
                Duration.ofMillis(400), Duration.ofMillis(50), null, null, null, 0, null);
        ports   = new PortAllocator(5000, capacity);
        meters  = new SimpleMeterRegistry();
        manager = new AgentServerManager(props, ports, launcher, apiClient, events, meters);
    }

    private void launchSucceeds() throws IOException {
        when(launcher.launch(anyString(), anyInt(), anyString(), anyBoolean())).thenReturn(process);
    }

    private void healthy() {
        when(apiClient.getHealth(anyString())).thenReturn(new HealthResponse(true, "1.0.0"));
    }

    // ------------------------------------------------------------------
    // startServer()
    // ------------------------------------------------------------------

    @Test
    void startServer_healthy_marksRunningAndPublishesStarted() throws Exception {
        launchSucceeds();
        healthy();
        when(apiClient.getCurrentPath(anyString())).thenReturn(worktree.toString());

        AgentServer server = manager.startServer("item-1", worktree.toString(), false);

        assertThat(server.getStatus()).isEqualTo(AgentServerStatus.RUNNING);
        assertThat(server.getPort()).isEqualTo(5000);
        assertThat(server.baseUrl()).isEqualTo("http://127.0.0.1:5000");
        assertThat(manager.getServerForEntity("item-1")).containsSame(server);
        assertThat(manager.getRunningServers()).containsExactly(server);

        ArgumentCaptor<AgentServerEvent> captor = ArgumentCaptor.forClass(AgentServerEvent.class);
        verify(events).publishEvent(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(AgentServerEvent.Kind.STARTED);
        assertThat(captor.getValue().port()).isEqualTo(5000);
        assertThat(meters.counter("devloop.agent.starts", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void startServer_alreadyRunning_returnsSameRecordWithoutSpawning() throws Exception {
        launchSucceeds();
        healthy();

        AgentServer first  = manager.startServer("item-1", worktree.toString(), false);
        AgentServer second = manager.startServer("item-1", worktree.toString(), true);

        assertThat(second).isSameAs(first);
        verify(launcher, times(1)).launch(anyString(), anyInt(), anyString(), anyBoolean());
        assertThat(ports.outstanding()).isEqualTo(1);
    }

    @Test
    void startServer_concurrentCallsForSameEntity_spawnOneProcess() throws Exception {
        launchSucceeds();
        when(apiClient.getHealth(anyString())).thenAnswer(inv -> {
            Thread.sleep(100);
            return new HealthResponse(true, "1.0.0");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AgentServer>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return manager.startServer("item-1", worktree.toString(), false);
            }));
        }
        go.countDown();

        AgentServer winner = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<AgentServer> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(winner);
        }
        pool.shutdownNow();

        verify(launcher, times(1)).launch(anyString(), anyInt(), anyString(), anyBoolean());
        assertThat(ports.outstanding()).isEqualTo(1);
    }

    @Test
    void startServer_concurrentCallsAtFullCapacity_allJoinTheOneStart() throws Exception {
        managerWithCapacity(1);
        launchSucceeds();
        when(apiClient.getHealth(anyString())).thenAnswer(inv -> {
            Thread.sleep(100);
            return new HealthResponse(true, "1.0.0");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AgentServer>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return manager.startServer("item-1", worktree.toString(), false);
            }));
        }
        go.countDown();

        AgentServer winner = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<AgentServer> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(winner);
        }
        pool.shutdownNow();

        assertThat(winner.getPort()).isEqualTo(5000);
        verify(launcher, times(1)).launch(anyString(), anyInt(), anyString(), anyBoolean());
        assertThat(ports.outstanding()).isEqualTo(1);
        assertThat(meters.counter("devloop.agent.starts", "outcome", "capacity").count()).isZero();
    }

    @Test
    void startServer_healthNeverPasses_failsAndLeavesNothingBehind() throws Exception {
        launchSucceeds();
        when(apiClient.getHealth(anyString())).thenThrow(new AgentApiException("connection refused"));

        assertThatThrownBy(() -> manager.startServer("item-1", worktree.toString(), false))
                .isInstanceOf(AgentStartupException.class)
                .hasMessageContaining("did not become healthy");

        assertThat(manager.getServerForEntity("item-1")).isEmpty();
        assertThat(ports.outstanding()).isZero();
        verify(process).destroyForcibly();
        verify(events, never()).publishEvent(any());
        assertThat(meters.counter("devloop.agent.starts", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void startServer_processExitsEarly_reportsExitCode() throws Exception {
        launchSucceeds();
        when(apiClient.getHealth(anyString())).thenThrow(new AgentApiException("connection refused"));
        when(process.isAlive()).thenReturn(false);
        when(process.exitValue()).thenReturn(3);

        assertThatThrownBy(() -> manager.startServer("item-1", worktree.toString(), false))
                .isInstanceOf(AgentStartupException.class)
                .hasMessageContaining("exited with code 3");

        assertThat(ports.outstanding()).isZero();
    }

    @Test
    void startServer_spawnFails_wrapsErrorAndReleasesPort() throws Exception {
        when(launcher.launch(anyString(), anyInt(), anyString(), anyBoolean()))
                .thenThrow(new IOException("No such file"));

        assertThatThrownBy(() -> manager.startServer("item-1", worktree.toString(), false))
                .isInstanceOf(AgentStartupException.class)
                .hasMessageContaining("Failed to spawn")
                .hasCauseInstanceOf(IOException.class);

        assertThat(ports.outstanding()).isZero();
        assertThat(manager.getServerForEntity("item-1")).isEmpty();
    }

    @Test
    void startServer_poolFull_rejectsSecondEntityWithoutSpawning() throws Exception {
        managerWithCapacity(1);
        launchSucceeds();
        healthy();

        manager.startServer("item-1", worktree.toString(), false);

        assertThatThrownBy(() -> manager.startServer("item-2", worktree.toString(), false))
                .isInstanceOf(PortCapacityExceededException.class);
        verify(launcher, times(1)).launch(anyString(), anyInt(), anyString(), anyBoolean());
        assertThat(manager.getServerForEntity("item-2")).isEmpty();
        assertThat(ports.outstanding()).isEqualTo(1);
        assertThat(meters.counter("devloop.agent.starts", "outcome", "capacity").count()).isEqualTo(1.0);
    }

    @Test
    void startServer_afterStop_reusesReleasedPort() throws Exception {
        managerWithCapacity(1);
        launchSucceeds();
        healthy();

        manager.startServer("item-1", worktree.toString(), false);
        manager.stopServer("item-1");
        AgentServer next = manager.startServer("item-2", worktree.toString(), false);

        assertThat(next.getPort()).isEqualTo(5000);
        assertThat(ports.mintedCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // stopServer()
    // ------------------------------------------------------------------

    @Test
    void stopServer_running_killsProcessReleasesPortAndPublishesStopped() throws Exception {
        launchSucceeds();
        healthy();
        AgentServer server = manager.startServer("item-1", worktree.toString(), false);

        manager.stopServer("item-1");

        assertThat(server.getStatus()).isEqualTo(AgentServerStatus.STOPPED);
        assertThat(manager.getServerForEntity("item-1")).isEmpty();
        assertThat(ports.outstanding()).isZero();
        verify(process).destroyForcibly();

        ArgumentCaptor<AgentServerEvent> captor = ArgumentCaptor.forClass(AgentServerEvent.class);
        verify(events, times(2)).publishEvent(captor.capture());
        assertThat(captor.getAllValues().get(1).kind()).isEqualTo(AgentServerEvent.Kind.STOPPED);
    }

    @Test
    void stopServer_calledTwice_secondIsNoOp() throws Exception {
        launchSucceeds();
        healthy();
        manager.startServer("item-1", worktree.toString(), false);

        manager.stopServer("item-1");
        manager.stopServer("item-1");

        verify(process, times(1)).destroyForcibly();
        assertThat(ports.outstanding()).isZero();
    }

    @Test
    void stopServer_unknownEntity_doesNothing() {
        manager.stopServer("nope");

        verifyNoInteractions(events);
    }

    @Test
    void shutdown_stopsEveryServer() throws Exception {
        launchSucceeds();
        healthy();
        manager.startServer("item-1", worktree.toString(), false);
        manager.startServer("item-2", worktree.toString(), false);

        manager.shutdown();

        assertThat(manager.getRunningServers()).isEmpty();
        assertThat(ports.outstanding()).isZero();
    }

    // ------------------------------------------------------------------
    // setActiveSession()
    // ------------------------------------------------------------------

    @Test
    void setActiveSession_recordsSessionAndPublishesUpdate() throws Exception {
        launchSucceeds();
        healthy();
        AgentServer server = manager.startServer("item-1", worktree.toString(), false);

        manager.setActiveSession("item-1", "ses_1");

        assertThat(server.getActiveSessionId()).isEqualTo("ses_1");
        ArgumentCaptor<AgentServerEvent> captor = ArgumentCaptor.forClass(AgentServerEvent.class);
        verify(events, times(2)).publishEvent(captor.capture());
        assertThat(captor.getAllValues().get(1).kind()).isEqualTo(AgentServerEvent.Kind.UPDATED);
    }
}
