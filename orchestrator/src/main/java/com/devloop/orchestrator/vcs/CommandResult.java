package com.devloop.orchestrator.vcs;

/**
 * Exit status and captured output of a finished command. Exit code -1 means it never ran or timed out.
 */
public record CommandResult(int exitCode, String output, String error) {

    public boolean success() {
        return exitCode == 0;
    }
}
