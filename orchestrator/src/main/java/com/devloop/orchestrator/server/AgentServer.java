package com.devloop.orchestrator.server;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One agent server process bound to a work item.
 *
 * Owned by {@link AgentServerManager}; other components read it but only the
 * manager signals the process or releases its port.
 */
public class AgentServer {

    private final String  entityId;
    private final String  worktreePath;
    private final boolean continueSession;
    private final Instant startedAt = Instant.now();

    private volatile AgentServerStatus status = AgentServerStatus.STARTING;
    private volatile String  activeSessionId;
    private volatile Process process;
    private volatile int     port;

    // Completes once startup has either succeeded or failed; concurrent starters wait on it.
    private final CompletableFuture<AgentServer> ready = new CompletableFuture<>();
    private boolean portReleased;

    public AgentServer(String entityId, String worktreePath, int port, boolean continueSession) {
        this.entityId        = entityId;
        this.worktreePath    = worktreePath;
        this.port            = port;
        this.continueSession = continueSession;
    }

    /** A STARTING record with no port yet; the manager registers it before allocating one. */
    AgentServer(String entityId, String worktreePath, boolean continueSession) {
        this(entityId, worktreePath, 0, continueSession);
    }

    public String  getEntityId()        { return entityId; }
    public String  getWorktreePath()    { return worktreePath; }
    public int     getPort()            { return port; }
    public boolean isContinueSession()  { return continueSession; }
    public Instant getStartedAt()       { return startedAt; }
    public AgentServerStatus getStatus(){ return status; }
    public String  getActiveSessionId() { return activeSessionId; }
    public Process getProcess()         { return process; }

    public String baseUrl() {
        return "http://127.0.0.1:" + port;
    }

    public void setActiveSessionId(String sessionId) { this.activeSessionId = sessionId; }

    // ------------------------------------------------------------------
    // Lifecycle, driven by AgentServerManager
    // ------------------------------------------------------------------

    void attachProcess(Process process) { this.process = process; }

    void markRunning() {
        status = AgentServerStatus.RUNNING;
        ready.complete(this);
    }

    void markFailed(Throwable cause) {
        status = AgentServerStatus.FAILED;
        ready.completeExceptionally(cause);
    }

    void markStopped() {
        status = AgentServerStatus.STOPPED;
        ready.completeExceptionally(new IllegalStateException("Agent server for " + entityId + " was stopped"));
    }

    CompletableFuture<AgentServer> readiness() { return ready; }

    /**
     * Bind the allocated port. Returns false if the record was already torn
     * down, in which case the caller still owns the port.
     */
    synchronized boolean assignPort(int allocated) {
        if (portReleased) {
            return false;
        }
        this.port = allocated;
        return true;
    }

    /**
     * The port to hand back to the pool, for exactly one caller; 0 when there
     * is nothing to release. No port can be assigned afterwards.
     */
    synchronized int claimPortRelease() {
        if (portReleased) {
            return 0;
        }
        portReleased = true;
        return port;
    }

    @Override
    public String toString() {
        return "AgentServer[" + entityId + " port=" + port + " " + status + "]";
    }
}
