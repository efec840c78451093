package com.devloop.orchestrator.server;

import com.devloop.orchestrator.client.AgentApiClient;
import com.devloop.orchestrator.client.dto.HealthResponse;
import com.devloop.orchestrator.config.AgentProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns every agent server process: spawning, health-gating, tracking and killing.
 *
 * At most one server exists per entity id. Startup is all-or-nothing: when any
 * step fails the process is killed, the port goes back to the pool and no
 * record is left behind. Concurrent starts for the same entity collapse onto a
 * single process: the record is registered before a port is taken, and the
 * losers wait for the winner's outcome.
 *
 * <pre>
 *   devloop.agent.starts{outcome="success|failed|capacity"}
 *   devloop.agent.start.duration
 * </pre>
 */
@Service
public class AgentServerManager {

    private static final Logger log = LoggerFactory.getLogger(AgentServerManager.class);

    private static final long INITIAL_POLL_MS = 100;
    private static final long MAX_POLL_MS     = 1_000;

    private final PortAllocator             portAllocator;
    private final AgentProcessLauncher      launcher;
    private final AgentApiClient            apiClient;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meterRegistry;
    private final Duration                  startTimeout;
    private final Duration                  exitTimeout;

    private final ConcurrentHashMap<String, AgentServer> servers = new ConcurrentHashMap<>();

    public AgentServerManager(AgentProperties props,
                              PortAllocator portAllocator,
                              AgentProcessLauncher launcher,
                              AgentApiClient apiClient,
                              ApplicationEventPublisher events,
                              MeterRegistry meterRegistry) {
        this.portAllocator = portAllocator;
        this.launcher      = launcher;
        this.apiClient     = apiClient;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.startTimeout  = props.serverStartTimeout();
        this.exitTimeout   = props.processExitTimeout();
    }

    // ------------------------------------------------------------------
    // Start
    // ------------------------------------------------------------------

    /**
     * Start (or return the already running) agent server for {@code entityId}.
     *
     * @throws PortCapacityExceededException if the pool is full
     * @throws AgentStartupException         if the process fails to come up healthy
     */
    public AgentServer startServer(String entityId, String worktreePath, boolean continueSession) {
        while (true) {
            AgentServer existing = servers.get(entityId);
            if (existing != null) {
                if (existing.getStatus() == AgentServerStatus.RUNNING) {
                    log.warn("Agent server already running for {} on port {}", entityId, existing.getPort());
                    return existing;
                }
                if (existing.getStatus() == AgentServerStatus.STARTING) {
                    return awaitConcurrentStart(existing);
                }
                // FAILED or STOPPED leftovers are replaced
                servers.remove(entityId, existing);
                continue;
            }

            AgentServer server = new AgentServer(entityId, worktreePath, continueSession);
            if (servers.putIfAbsent(entityId, server) != null) {
                continue;
            }

            int port;
            try {
                port = portAllocator.allocatePort();
            } catch (PortCapacityExceededException e) {
                meterRegistry.counter("devloop.agent.starts", "outcome", "capacity").increment();
                log.warn("Cannot start agent for {}: {}", entityId, e.getMessage());
                servers.remove(entityId, server);
                server.markFailed(e);
                throw e;
            }
            if (!server.assignPort(port)) {
                portAllocator.releasePort(port);
                AgentStartupException stopped = new AgentStartupException(entityId,
                        "Agent server for " + entityId + " was stopped during startup");
                server.markFailed(stopped);
                throw stopped;
            }
            return launch(server);
        }
    }

    private AgentServer launch(AgentServer server) {
        String entityId = server.getEntityId();
        MDC.put("entityId", entityId);
        MDC.put("port", String.valueOf(server.getPort()));
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            log.info("Starting agent server for {} on port {} in {}",
                    entityId, server.getPort(), server.getWorktreePath());

            Process process;
            try {
                process = launcher.launch(entityId, server.getPort(),
                        server.getWorktreePath(), server.isContinueSession());
            } catch (IOException e) {
                throw new AgentStartupException(entityId,
                        "Failed to spawn agent server for " + entityId + ": " + e.getMessage(), e);
            }
            server.attachProcess(process);

            waitForHealthy(server);
            verifyWorkingDirectory(server);

            if (servers.get(entityId) != server) {
                throw new AgentStartupException(entityId,
                        "Agent server for " + entityId + " was stopped during startup");
            }
            server.markRunning();
            log.info("Agent server for {} is running at {}", entityId, server.baseUrl());
            events.publishEvent(new AgentServerEvent(AgentServerEvent.Kind.STARTED, entityId, server.getPort()));
            return server;
        } catch (RuntimeException e) {
            outcome = "failed";
            log.error("Agent server for {} failed to start: {}", entityId, e.getMessage());
            servers.remove(entityId, server);
            teardown(server);
            server.markFailed(e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("devloop.agent.start.duration"));
            meterRegistry.counter("devloop.agent.starts", "outcome", outcome).increment();
            MDC.remove("entityId");
            MDC.remove("port");
        }
    }

    private AgentServer awaitConcurrentStart(AgentServer pending) {
        String entityId = pending.getEntityId();
        log.info("Agent server for {} is already starting; waiting for it", entityId);
        long waitMs = startTimeout.plus(exitTimeout).toMillis();
        try {
            return pending.readiness().get(waitMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentStartupException ase) throw ase;
            if (cause instanceof PortCapacityExceededException full) throw full;
            throw new AgentStartupException(entityId,
                    "Concurrent start of agent server for " + entityId + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new AgentStartupException(entityId,
                    "Timed out waiting for concurrent start of agent server for " + entityId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentStartupException(entityId, "Interrupted waiting for agent server for " + entityId, e);
        }
    }

    /** Poll the health endpoint with doubling backoff until healthy, exited, or out of time. */
    private void waitForHealthy(AgentServer server) {
        String entityId = server.getEntityId();
        long deadline = System.nanoTime() + startTimeout.toNanos();
        long delay = INITIAL_POLL_MS;

        while (true) {
            if (isHealthy(server)) {
                return;
            }
            Process process = server.getProcess();
            if (process != null && !process.isAlive()) {
                throw new AgentStartupException(entityId,
                        "Agent server for " + entityId + " exited with code " + process.exitValue()
                                + " before becoming healthy");
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                throw new AgentStartupException(entityId,
                        "Agent server for " + entityId + " did not become healthy within "
                                + startTimeout.toMillis() + " ms");
            }
            try {
                Thread.sleep(Math.min(delay, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentStartupException(entityId, "Interrupted waiting for agent server health", e);
            }
            delay = Math.min(delay * 2, MAX_POLL_MS);
        }
    }

    private void verifyWorkingDirectory(AgentServer server) {
        String reported = apiClient.getCurrentPath(server.baseUrl());
        if (reported == null) {
            log.warn("Agent server for {} did not report a working directory", server.getEntityId());
            return;
        }
        Path expected = Path.of(server.getWorktreePath()).toAbsolutePath().normalize();
        Path actual   = Path.of(reported).toAbsolutePath().normalize();
        if (expected.equals(actual)) {
            log.info("Agent server for {} confirmed working directory {}", server.getEntityId(), actual);
        } else {
            log.warn("Agent server for {} reports working directory {} but was started in {}",
                    server.getEntityId(), actual, expected);
        }
    }

    // ------------------------------------------------------------------
    // Stop
    // ------------------------------------------------------------------

    /** Kill the server for {@code entityId} and everything it spawned. No-op if none exists. */
    public void stopServer(String entityId) {
        AgentServer server = servers.remove(entityId);
        if (server == null) {
            log.debug("No agent server to stop for {}", entityId);
            return;
        }
        log.info("Stopping agent server for {} on port {}", entityId, server.getPort());
        teardown(server);
        server.markStopped();
        events.publishEvent(new AgentServerEvent(AgentServerEvent.Kind.STOPPED, entityId, server.getPort()));
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(servers.keySet());
        if (!ids.isEmpty()) {
            log.info("Shutting down {} agent server(s)", ids.size());
        }
        ids.forEach(this::stopServer);
    }

    /** Kill the process tree, if still alive, and release the port exactly once. */
    private void teardown(AgentServer server) {
        Process process = server.getProcess();
        if (process != null && process.isAlive()) {
            killProcessTree(server.getEntityId(), process);
        }
        int port = server.claimPortRelease();
        if (port > 0) {
            portAllocator.releasePort(port);
        }
    }

    private void killProcessTree(String entityId, Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            if (!process.waitFor(exitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent process for {} did not exit within {} ms", entityId, exitTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for agent process for {} to exit", entityId);
        } catch (RuntimeException e) {
            log.warn("Failed to kill agent process for {}: {}", entityId, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<AgentServer> getServerForEntity(String entityId) {
        return Optional.ofNullable(servers.get(entityId));
    }

    public List<AgentServer> getRunningServers() {
        return servers.values().stream()
                .filter(s -> s.getStatus() == AgentServerStatus.RUNNING)
                .toList();
    }

    /** Record the session the agent is working in and let listeners know. */
    public void setActiveSession(String entityId, String sessionId) {
        AgentServer server = servers.get(entityId);
        if (server == null) {
            log.warn("Cannot set session {} for {}: no agent server", sessionId, entityId);
            return;
        }
        server.setActiveSessionId(sessionId);
        events.publishEvent(new AgentServerEvent(AgentServerEvent.Kind.UPDATED, entityId, server.getPort()));
    }

    public boolean isHealthy(AgentServer server) {
        try {
            HealthResponse health = apiClient.getHealth(server.baseUrl());
            return health != null && health.healthy();
        } catch (RuntimeException e) {
            log.trace("Health check for {} failed: {}", server.getEntityId(), e.getMessage());
            return false;
        }
    }
}
