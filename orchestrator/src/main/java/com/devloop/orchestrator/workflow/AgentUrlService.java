package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds the URLs under which an agent is reachable.
 *
 * In local mode the UI talks to the agent directly on loopback. When an
 * external hostname is configured, URLs go through the reverse proxy instead.
 */
@Component
public class AgentUrlService {

    private final AgentProperties props;

    public AgentUrlService(AgentProperties props) {
        this.props = props;
    }

    public String internalBaseUrl(int port) {
        return "http://127.0.0.1:" + port;
    }

    public String externalBaseUrl(int port) {
        if (!props.externalMode()) {
            return internalBaseUrl(port);
        }
        String portSuffix = props.externalPort() == 80 ? "" : ":" + props.externalPort();
        return "http://" + props.externalHostname() + portSuffix + props.proxyBasePath() + "/" + port;
    }

    /** Agent web UI page for a session; null without a session. */
    public String webViewUrl(int port, String worktreePath, String sessionId) {
        if (sessionId == null) {
            return null;
        }
        String encodedPath = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(worktreePath.getBytes(StandardCharsets.UTF_8));
        return externalBaseUrl(port) + "/" + encodedPath + "/session/" + sessionId;
    }
}
