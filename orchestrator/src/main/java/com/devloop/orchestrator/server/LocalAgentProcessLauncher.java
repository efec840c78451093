package com.devloop.orchestrator.server;

import com.devloop.orchestrator.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches agent servers as local child processes.
 *
 * The executable is resolved once: an absolute path that exists is used as-is,
 * otherwise PATH and the usual per-user install locations are searched. When
 * nothing matches the bare name is kept and the OS reports the failure at
 * launch time.
 *
 * Standard output and error are drained on daemon threads and logged at DEBUG
 * so the child never blocks on a full pipe.
 */
@Component
public class LocalAgentProcessLauncher implements AgentProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentProcessLauncher.class);

    private final String executable;

    @Autowired
    public LocalAgentProcessLauncher(AgentProperties props) {
        this(resolveExecutable(props.executablePath(),
                System.getenv("PATH"),
                System.getProperty("user.home")));
    }

    LocalAgentProcessLauncher(String resolvedExecutable) {
        this.executable = resolvedExecutable;
        log.info("Agent executable: {}", executable);
    }

    public String executable() { return executable; }

    @Override
    public Process launch(String entityId, int port, String workingDirectory, boolean continueSession)
            throws IOException {
        Path dir = Path.of(workingDirectory).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            log.error("Agent working directory does not exist: {}", dir);
            throw new NoSuchFileException(dir.toString(), null, "agent working directory does not exist");
        }

        List<String> command = buildCommand(executable, port, continueSession);
        log.info("Starting agent server: command={} workingDirectory={}", command, dir);

        Process process = new ProcessBuilder(command)
                .directory(dir.toFile())
                .redirectErrorStream(false)
                .start();

        log.info("Started agent process pid={} port={} entity={}", process.pid(), port, entityId);
        drain(process.getInputStream(), entityId, "stdout");
        drain(process.getErrorStream(), entityId, "stderr");
        return process;
    }

    static List<String> buildCommand(String executable, int port, boolean continueSession) {
        List<String> command = new ArrayList<>(List.of(
                executable, "serve",
                "--port", String.valueOf(port),
                "--hostname", "127.0.0.1"));
        if (continueSession) {
            command.add("--continue");
        }
        return command;
    }

    /**
     * Find {@code name} on {@code pathEnv} or in common install directories under {@code home}.
     * Returns {@code name} unchanged when it is already an existing absolute path or cannot be found.
     */
    static String resolveExecutable(String name, String pathEnv, String home) {
        Path given = Path.of(name);
        if (given.isAbsolute() && Files.isRegularFile(given)) {
            return name;
        }

        List<String> searchPaths = new ArrayList<>();
        if (pathEnv != null) {
            for (String entry : pathEnv.split(File.pathSeparator)) {
                if (!entry.isBlank()) searchPaths.add(entry);
            }
        }
        if (home != null) {
            searchPaths.add(Path.of(home, ".npm-global", "bin").toString());
            searchPaths.add(Path.of(home, ".local", "bin").toString());
            searchPaths.add(Path.of(home, ".bun", "bin").toString());
            searchPaths.add(Path.of(home, ".volta", "bin").toString());
            searchPaths.add(Path.of(home, ".asdf", "shims").toString());
            searchPaths.add(Path.of(home, ".yarn", "bin").toString());
        }
        searchPaths.add("/usr/local/bin");
        searchPaths.add("/usr/bin");
        searchPaths.add("/opt/homebrew/bin");

        for (String dir : searchPaths) {
            Path candidate = Path.of(dir, name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate.toString();
            }
        }

        log.warn("Could not find '{}' in PATH or common install locations ({} directories searched); "
                + "the process may fail to start", name, searchPaths.size());
        return name;
    }

    private static void drain(InputStream stream, String entityId, String channel) {
        Thread t = new Thread(() -> {
            MDC.put("entityId", entityId);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] {}", channel, line);
                }
            } catch (IOException e) {
                log.debug("Agent {} closed: {}", channel, e.getMessage());
            } finally {
                MDC.clear();
            }
        }, "agent-" + channel + "-" + entityId);
        t.setDaemon(true);
        t.start();
    }
}
