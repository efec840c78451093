package com.devloop.orchestrator.completion;

import com.devloop.orchestrator.client.EventStreamClient;
import com.devloop.orchestrator.client.EventSubscription;
import com.devloop.orchestrator.client.dto.AgentEvent;
import com.devloop.orchestrator.config.AgentProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Watches an agent's event stream until the agent creates a pull request.
 *
 * There is no overall timeout: the stream runs for as long as the agent does.
 * When a PR creation is seen, the PR number comes from the command output if a
 * URL is there, otherwise from the hosting service's open-PR list, polled a
 * bounded number of times.
 *
 * <pre>
 *   devloop.agent.completions{outcome="pr_detected|stream_ended|pr_not_found|cancelled"}
 * </pre>
 */
@Component
public class CompletionMonitor {

    private static final Logger log = LoggerFactory.getLogger(CompletionMonitor.class);

    private final EventStreamClient    eventStreamClient;
    private final PullRequestLookup    pullRequests;
    private final MeterRegistry        meterRegistry;
    private final int                  retryCount;
    private final Duration             retryDelay;
    private final PullRequestUrlParser urlParser = new PullRequestUrlParser();

    public CompletionMonitor(EventStreamClient eventStreamClient,
                             PullRequestLookup pullRequests,
                             MeterRegistry meterRegistry,
                             AgentProperties props) {
        this.eventStreamClient = eventStreamClient;
        this.pullRequests      = pullRequests;
        this.meterRegistry     = meterRegistry;
        this.retryCount        = props.completion().prDetectionRetryCount();
        this.retryDelay        = props.completion().prDetectionRetryDelay();
    }

    /**
     * Block until the agent at {@code baseUrl} creates a PR, its stream ends, or {@code token} is cancelled.
     *
     * @throws com.devloop.orchestrator.client.AgentApiException if the stream cannot be opened
     */
    public CompletionResult monitorForCompletion(String baseUrl, String projectId, String branchName,
                                                 CancellationToken token) {
        CompletionResult result = monitor(baseUrl, projectId, branchName, token);
        meterRegistry.counter("devloop.agent.completions",
                "outcome", result.outcome().name().toLowerCase()).increment();
        return result;
    }

    private CompletionResult monitor(String baseUrl, String projectId, String branchName,
                                     CancellationToken token) {
        if (token.isCancelled()) {
            return CompletionResult.cancelled(branchName);
        }

        EventSubscription events = eventStreamClient.subscribe(baseUrl);
        token.register(events);
        try {
            while (events.hasNext()) {
                AgentEvent event = events.next();
                Optional<String> output = PrCreationDetector.detect(event);
                if (output.isEmpty()) {
                    continue;
                }
                log.info("Detected PR creation for branch {}", branchName);
                return resolvePullRequest(output.get(), projectId, branchName, token);
            }
        } finally {
            token.unregister(events);
            events.close();
        }

        if (token.isCancelled()) {
            log.info("Monitoring of branch {} cancelled", branchName);
            return CompletionResult.cancelled(branchName);
        }
        log.info("Event stream for branch {} ended without a PR", branchName);
        return CompletionResult.streamEnded(branchName);
    }

    private CompletionResult resolvePullRequest(String output, String projectId, String branchName,
                                                CancellationToken token) {
        Optional<PullRequestUrlParser.PullRequestUrl> parsed = urlParser.find(output);
        if (parsed.isPresent()) {
            log.info("PR URL found in output: {} (#{})", parsed.get().url(), parsed.get().number());
            return CompletionResult.prDetected(parsed.get().number(), parsed.get().url(), branchName);
        }
        return findPullRequestByBranch(projectId, branchName, token);
    }

    private CompletionResult findPullRequestByBranch(String projectId, String branchName,
                                                     CancellationToken token) {
        for (int attempt = 1; attempt <= retryCount; attempt++) {
            if (attempt > 1) {
                log.debug("Retrying PR lookup for {} (attempt {}/{})", branchName, attempt, retryCount);
                if (!token.sleep(retryDelay)) {
                    return CompletionResult.cancelled(branchName);
                }
            }
            Optional<PullRequestLookup.OpenPullRequest> match = pullRequests.listOpenPullRequests(projectId)
                    .stream()
                    .filter(pr -> pr.branchName() != null && pr.branchName().equalsIgnoreCase(branchName))
                    .findFirst();
            if (match.isPresent()) {
                log.info("Found PR #{} for branch {} on attempt {}", match.get().number(), branchName, attempt);
                return CompletionResult.prDetected(match.get().number(), match.get().htmlUrl(), branchName);
            }
        }
        log.warn("No open PR found for branch {} after {} attempts", branchName, retryCount);
        return CompletionResult.prNotFound(branchName, retryCount);
    }
}
