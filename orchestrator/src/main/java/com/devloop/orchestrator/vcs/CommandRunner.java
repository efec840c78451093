package com.devloop.orchestrator.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived CLI commands ({@code git}, {@code gh}) and captures their output.
 *
 * Failures never throw: a command that cannot start or exceeds its timeout
 * comes back with exit code -1 and the reason in {@link CommandResult#error()}.
 */
@Component
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    public CommandResult run(Path workingDirectory, String... command) {
        return run(workingDirectory, DEFAULT_TIMEOUT, command);
    }

    public CommandResult run(Path workingDirectory, Duration timeout, String... command) {
        List<String> argv = List.of(command);
        log.debug("Running {} in {}", argv, workingDirectory);

        Process process;
        try {
            process = new ProcessBuilder(new ArrayList<>(argv))
                    .directory(workingDirectory.toFile())
                    .start();
        } catch (IOException e) {
            log.warn("Could not start {}: {}", argv.get(0), e.getMessage());
            return new CommandResult(-1, "", e.getMessage());
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread outReader = drain(process.getInputStream(), stdout);
        Thread errReader = drain(process.getErrorStream(), stderr);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("{} timed out after {} ms", argv, timeout.toMillis());
                return new CommandResult(-1, stdout.toString(StandardCharsets.UTF_8),
                        "timed out after " + timeout.toMillis() + " ms");
            }
            outReader.join(1_000);
            errReader.join(1_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(-1, "", "interrupted");
        }

        CommandResult result = new CommandResult(process.exitValue(),
                stdout.toString(StandardCharsets.UTF_8), stderr.toString(StandardCharsets.UTF_8));
        if (!result.success()) {
            log.debug("{} exited {}: {}", argv, result.exitCode(), result.error().strip());
        }
        return result;
    }

    private static Thread drain(InputStream in, ByteArrayOutputStream sink) {
        Thread t = new Thread(() -> {
            try (in) {
                in.transferTo(sink);
            } catch (IOException e) {
                log.trace("Output stream closed: {}", e.getMessage());
            }
        }, "command-output");
        t.setDaemon(true);
        t.start();
        return t;
    }
}
