package com.devloop.orchestrator.server;

import java.io.IOException;

/**
 * Spawns the agent server executable. The returned process is owned by the caller.
 */
public interface AgentProcessLauncher {

    /**
     * Start {@code <agent> serve --port <port> --hostname 127.0.0.1 [--continue]}
     * in {@code workingDirectory}.
     *
     * @throws IOException if the directory does not exist or the process cannot be started
     */
    Process launch(String entityId, int port, String workingDirectory, boolean continueSession)
            throws IOException;
}
