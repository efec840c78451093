package com.devloop.orchestrator.proxy;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;

/**
 * Reverse proxy from {@code {basePath}/{port}/**} to the agent server listening on that port.
 *
 * Any method is forwarded with the prefix stripped. HTML bodies are rewritten so
 * root-relative asset links stay under the prefix; everything else is streamed
 * through unchanged, which keeps the agent's own event stream usable from the
 * browser.
 *
 * GET {basePath}/{port}/session/...      : redirected to add an absolute ?url= when missing
 * ANY {basePath}/{port}/**             : forwarded; 404 for unknown ports, 502 if unreachable
 */
@RestController
public class AgentProxyController {

    private static final Logger log = LoggerFactory.getLogger(AgentProxyController.class);

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade",
            // not hop-by-hop, but recomputed or restricted by the client
            "host", "content-length", "expect", "accept-encoding");

    private final ProxyRouteManager routeManager;
    private final HtmlPathRewriter  htmlRewriter;
    private final HttpClient        http;

    // Last snapshot read; refreshed only after the route manager publishes a newer one.
    private volatile RouteSnapshot routes;

    public AgentProxyController(ProxyRouteManager routeManager,
                                HtmlPathRewriter htmlRewriter,
                                HttpClient agentHttpClient) {
        this.routeManager = routeManager;
        this.htmlRewriter = htmlRewriter;
        this.http         = agentHttpClient;
        this.routes       = routeManager.snapshot();
    }

    @RequestMapping("${devloop.agent.proxy-base-path:/agent}/{port}/**")
    public ResponseEntity<?> forward(@PathVariable int port, HttpServletRequest request) throws IOException {
        ProxyRoute route = currentRoutes().route(port);
        if (route == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body("No agent is running on port " + port);
        }

        String path = request.getRequestURI().substring(request.getContextPath().length());
        ResponseEntity<?> redirect = redirectForAbsoluteUrl(route, path, request);
        if (redirect != null) {
            return redirect;
        }

        String target = route.destination() + route.downstreamPath(path)
                + (request.getQueryString() != null ? "?" + request.getQueryString() : "");

        HttpResponse<InputStream> upstream;
        try {
            upstream = http.send(buildUpstreamRequest(target, request), HttpResponse.BodyHandlers.ofInputStream());
        } catch (ConnectException e) {
            log.warn("Agent on port {} is unreachable: {}", port, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body("Agent on port " + port + " is unreachable");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body("Proxy request interrupted");
        } catch (IOException e) {
            log.warn("Proxy request to {} failed: {}", target, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body("Agent on port " + port + " failed to respond");
        }

        HttpHeaders headers = new HttpHeaders();
        upstream.headers().map().forEach((name, values) -> {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT)) && !name.startsWith(":")) {
                headers.addAll(name, values);
            }
        });

        String contentType = upstream.headers().firstValue("content-type").orElse("");
        if (contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
            String html;
            try (InputStream body = upstream.body()) {
                html = new String(body.readAllBytes(), StandardCharsets.UTF_8);
            }
            byte[] rewritten = htmlRewriter.rewrite(html, route.pathPrefix()).getBytes(StandardCharsets.UTF_8);
            return ResponseEntity.status(upstream.statusCode()).headers(headers).body(rewritten);
        }

        StreamingResponseBody body = out -> {
            try (InputStream in = upstream.body()) {
                byte[] buffer = new byte[8192];
                int n;
                while ((n = in.read(buffer)) != -1) {
                    out.write(buffer, 0, n);
                    out.flush();
                }
            }
        };
        return ResponseEntity.status(upstream.statusCode()).headers(headers).body(body);
    }

    private RouteSnapshot currentRoutes() {
        RouteSnapshot snap = routes;
        if (snap.isStale()) {
            snap = routeManager.snapshot();
            routes = snap;
        }
        return snap;
    }

    /**
     * The agent's web UI needs an absolute {@code ?url=} pointing back through the proxy;
     * session page requests without one get a 302 that adds it.
     */
    private ResponseEntity<?> redirectForAbsoluteUrl(ProxyRoute route, String path, HttpServletRequest request) {
        boolean pageRequest = path.contains("/session/") && !path.contains("/api/");
        if (!pageRequest) {
            return null;
        }
        String url = request.getParameter("url");
        if (url != null && !url.isEmpty() && !url.startsWith("/")) {
            return null;
        }

        String host = request.getHeader(HttpHeaders.HOST);
        if (host == null) {
            host = request.getServerName() + ":" + request.getServerPort();
        }
        String absoluteBase = request.getScheme() + "://" + host + route.pathPrefix();
        String location = UriComponentsBuilder.fromPath(path)
                .query(request.getQueryString())
                .replaceQueryParam("url", UriUtils.encodeQueryParam(absoluteBase, StandardCharsets.UTF_8))
                .build(true)
                .toUriString();

        log.debug("Redirecting to add absolute ?url= parameter: {}", location);
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }

    private static HttpRequest buildUpstreamRequest(String target, HttpServletRequest request) throws IOException {
        byte[] body = request.getInputStream().readAllBytes();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(target))
                .method(request.getMethod(), body.length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));

        for (String name : Collections.list(request.getHeaderNames())) {
            if (HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : Collections.list(request.getHeaders(name))) {
                builder.header(name, value);
            }
        }
        return builder.build();
    }
}
