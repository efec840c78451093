package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.config.AgentProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code opencode.json} into a worktree so the agent starts with the
 * chosen model, full tool permissions, no self-update and automatic compaction.
 */
@Component
public class AgentConfigWriter {

    private static final Logger log = LoggerFactory.getLogger(AgentConfigWriter.class);

    static final String CONFIG_FILE = "opencode.json";
    static final String SCHEMA      = "https://opencode.ai/config.json";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AgentConfig(
            @JsonProperty("$schema") String schema,
            String model,
            Map<String, String> permission,
            boolean autoupdate,
            Compaction compaction
    ) {}

    public record Compaction(boolean auto, boolean prune) {}

    private final ObjectMapper json;
    private final String       defaultModel;

    public AgentConfigWriter(ObjectMapper objectMapper, AgentProperties props) {
        this.json         = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.defaultModel = props.defaultModel();
    }

    public AgentConfig defaultConfig(String model) {
        Map<String, String> permission = new LinkedHashMap<>();
        for (String tool : new String[] {"edit", "bash", "write", "read", "webfetch"}) {
            permission.put(tool, "allow");
        }
        return new AgentConfig(SCHEMA, model != null ? model : defaultModel, permission,
                false, new Compaction(true, true));
    }

    /**
     * @throws AgentConfigException if the file cannot be written
     */
    public Path write(String worktreePath, AgentConfig config) {
        Path target = Path.of(worktreePath, CONFIG_FILE);
        try {
            Files.writeString(target, json.writeValueAsString(config));
        } catch (IOException e) {
            throw new AgentConfigException("Failed to write agent config to " + target, e);
        }
        log.info("Wrote agent config to {} (model={})", target, config.model());
        return target;
    }
}
