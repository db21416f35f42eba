package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.etl.model.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external tools (git, dvc) with a bounded wait. Failures are reported through
 * {@link CommandResult#errorCode()} rather than thrown.
 */
@Component
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public CommandResult run(Path workDir, Duration timeout, String... command) {
        return run(workDir, timeout, Map.of(), Arrays.asList(command));
    }

    public CommandResult run(Path workDir, Duration timeout, Map<String, String> env, List<String> command) {
        List<String> commandLine = List.copyOf(command);
        long started = System.nanoTime();
        ProcessBuilder builder = new ProcessBuilder(commandLine);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        if (env != null && !env.isEmpty()) {
            builder.environment().putAll(env);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            String code = isMissingExecutable(e) ? "not_found" : "io_error";
            log.debug("Failed to start {}: {}", commandLine, e.getMessage());
            return failure(commandLine, started, code, e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command {} timed out after {}s", commandLine, timeout.toSeconds());
                return failure(commandLine, started, "timeout", "Command timed out after " + timeout.toSeconds() + "s");
            }
            String out = stdout.get(5, TimeUnit.SECONDS);
            String err = stderr.get(5, TimeUnit.SECONDS);
            CommandResult result = new CommandResult(
                commandLine,
                process.exitValue(),
                out,
                err,
                Duration.ofNanos(System.nanoTime() - started),
                null,
                null
            );
            log.debug("Command {} exited with {}", commandLine, result.exitCode());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return failure(commandLine, started, "interrupted", "Interrupted while waiting for command");
        } catch (ExecutionException | TimeoutException e) {
            return failure(commandLine, started, "io_error", "Failed to read command output: " + e.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("Failed to read process stream: {}", e.getMessage());
            return "";
        }
    }

    private static boolean isMissingExecutable(IOException e) {
        String message = e.getMessage();
        return message != null && (message.contains("error=2") || message.contains("No such file"));
    }

    private static CommandResult failure(List<String> command, long started, String errorCode, String message) {
        return new CommandResult(command, -1, "", "", Duration.ofNanos(System.nanoTime() - started), errorCode, message);
    }
}
