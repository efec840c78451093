package com.devloop.orchestrator.completion;

/**
 * What a completion monitor concluded about an agent run.
 *
 * @param prNumber PR number when {@code outcome} is PR_DETECTED, else null
 * @param prUrl    PR URL when known
 * @param reason   human-readable explanation for every outcome but PR_DETECTED
 */
public record CompletionResult(
        Outcome outcome,
        Integer prNumber,
        String  prUrl,
        String  branchName,
        String  reason
) {

    public enum Outcome {
        PR_DETECTED,
        STREAM_ENDED,
        PR_NOT_FOUND,
        CANCELLED
    }

    public static CompletionResult prDetected(int number, String url, String branchName) {
        return new CompletionResult(Outcome.PR_DETECTED, number, url, branchName, null);
    }

    public static CompletionResult streamEnded(String branchName) {
        return new CompletionResult(Outcome.STREAM_ENDED, null, null, branchName,
                "Agent server stopped without creating a PR (stream ended)");
    }

    public static CompletionResult prNotFound(String branchName, int attempts) {
        return new CompletionResult(Outcome.PR_NOT_FOUND, null, null, branchName,
                "PR creation detected but no open PR found for branch " + branchName
                        + " after " + attempts + " attempts");
    }

    public static CompletionResult cancelled(String branchName) {
        return new CompletionResult(Outcome.CANCELLED, null, null, branchName, "Monitoring cancelled");
    }

    public boolean success() {
        return outcome == Outcome.PR_DETECTED;
    }
}
