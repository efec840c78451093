package com.devloop.orchestrator.proxy;

/**
 * Maps {@code {pathPrefix}/**} on the orchestrator to {@code {destination}/**} on a local agent.
 *
 * @param port        agent server port, also the route key
 * @param pathPrefix  external prefix, e.g. {@code /agent/4097}
 * @param destination internal origin, e.g. {@code http://127.0.0.1:4097}
 */
public record ProxyRoute(int port, String pathPrefix, String destination) {

    public static ProxyRoute forPort(String basePath, int port) {
        return new ProxyRoute(port, basePath + "/" + port, "http://127.0.0.1:" + port);
    }

    /**
     * Downstream path for a request path under this route, always starting with {@code /}.
     *
     * @throws IllegalArgumentException if {@code requestPath} is not under {@link #pathPrefix()}
     */
    public String downstreamPath(String requestPath) {
        if (!matches(requestPath)) {
            throw new IllegalArgumentException(requestPath + " is not under " + pathPrefix);
        }
        String rest = requestPath.substring(pathPrefix.length());
        return rest.isEmpty() ? "/" : rest;
    }

    public boolean matches(String requestPath) {
        return requestPath.equals(pathPrefix) || requestPath.startsWith(pathPrefix + "/");
    }
}
