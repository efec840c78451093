package com.devloop.orchestrator.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and the shared HTTP client.
 *
 * Completion monitors block on an SSE socket for as long as the agent runs,
 * so they get a fixed pool sized to the server limit: one worker per live agent.
 * Fire-and-forget prompt sends use a separate small pool so a slow agent API
 * can never starve the monitors.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("monitorExecutor")
    public ExecutorService monitorExecutor(AgentProperties props) {
        return Executors.newFixedThreadPool(props.maxConcurrentServers(), namedThreads("agent-monitor"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("promptExecutor")
    public ExecutorService promptExecutor() {
        return Executors.newFixedThreadPool(2, namedThreads("agent-prompt"));
    }

    @Bean
    public HttpClient agentHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // agent servers speak plain HTTP/1.1
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
