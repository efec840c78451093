package com.devloop.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed settings for the agent process pool, bound from {@code devloop.agent.*}.
 *
 * @param executablePath       agent executable; a bare name is resolved against PATH
 * @param basePort             first port handed out to agent servers
 * @param maxConcurrentServers upper bound on live agent servers (and on the port pool)
 * @param serverStartTimeout   how long to wait for {@code /global/health} after spawning
 * @param processExitTimeout   how long to wait for a killed process to exit
 * @param proxyBasePath        external path prefix under which agents are proxied
 * @param defaultModel         "provider/model" used when neither caller nor project choose one
 * @param externalHostname     host used in externally visible agent URLs; null means local mode
 * @param externalPort         port used in externally visible agent URLs
 * @param completion           PR detection settings for the completion monitor
 */
@ConfigurationProperties(prefix = "devloop.agent")
public record AgentProperties(
        String     executablePath,
        int        basePort,
        int        maxConcurrentServers,
        Duration   serverStartTimeout,
        Duration   processExitTimeout,
        String     proxyBasePath,
        String     defaultModel,
        String     externalHostname,
        int        externalPort,
        Completion completion
) {

    // Compact constructor: fill in defaults for anything left out of application.yml.
    public AgentProperties {
        if (executablePath == null || executablePath.isBlank()) executablePath = "opencode";
        if (basePort <= 0)                  basePort = 4096;
        if (maxConcurrentServers <= 0)      maxConcurrentServers = 10;
        if (serverStartTimeout == null)     serverStartTimeout = Duration.ofSeconds(15);
        if (processExitTimeout == null)     processExitTimeout = Duration.ofSeconds(10);
        if (proxyBasePath == null || proxyBasePath.isBlank()) proxyBasePath = "/agent";
        if (proxyBasePath.endsWith("/"))    proxyBasePath = proxyBasePath.substring(0, proxyBasePath.length() - 1);
        if (defaultModel == null || defaultModel.isBlank()) defaultModel = "anthropic/claude-opus-4-5";
        if (externalPort <= 0)              externalPort = 80;
        if (completion == null)             completion = new Completion(0, null);
    }

    /** Settings with every value defaulted; handy for tests and tooling. */
    public static AgentProperties defaults() {
        return new AgentProperties(null, 0, 0, null, null, null, null, null, 0, null);
    }

    public boolean externalMode() {
        return externalHostname != null && !externalHostname.isBlank();
    }

    /**
     * @param prDetectionRetryCount attempts against the PR-listing API when the
     *                              command output carries no PR URL
     * @param prDetectionRetryDelay pause between those attempts
     */
    public record Completion(int prDetectionRetryCount, Duration prDetectionRetryDelay) {
        public Completion {
            if (prDetectionRetryCount <= 0)    prDetectionRetryCount = 3;
            if (prDetectionRetryDelay == null) prDetectionRetryDelay = Duration.ofSeconds(2);
        }
    }
}
