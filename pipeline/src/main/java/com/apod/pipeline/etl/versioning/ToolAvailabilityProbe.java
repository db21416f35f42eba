package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checks whether the metadata tool can be used right now. Nothing is cached between calls.
 */
@Component
public class ToolAvailabilityProbe {
    private static final Logger log = LoggerFactory.getLogger(ToolAvailabilityProbe.class);

    private final PipelineProperties properties;
    private final CommandRunner commandRunner;
    private final Supplier<String> pathSupplier;

    @Autowired
    public ToolAvailabilityProbe(PipelineProperties properties, CommandRunner commandRunner) {
        this(properties, commandRunner, () -> System.getenv("PATH"));
    }

    ToolAvailabilityProbe(PipelineProperties properties, CommandRunner commandRunner, Supplier<String> pathSupplier) {
        this.properties = properties;
        this.commandRunner = commandRunner;
        this.pathSupplier = pathSupplier;
    }

    public boolean probe() {
        String tool = properties.getVersioning().getMetadataTool();
        Optional<Path> executable = resolveExecutable(tool);
        if (executable.isEmpty()) {
            log.info("Metadata tool '{}' not found on PATH", tool);
            return false;
        }
        CommandResult result = commandRunner.run(
            null,
            Duration.ofSeconds(properties.getVersioning().getCommandTimeoutSeconds()),
            Map.of(),
            List.of(executable.get().toString(), "version")
        );
        if (!result.isSuccessful()) {
            log.info(
                "Metadata tool '{}' is not usable (exit={}, error={})",
                tool,
                result.exitCode(),
                result.errorCode()
            );
            return false;
        }
        log.debug("Metadata tool '{}' available at {}", tool, executable.get());
        return true;
    }

    Optional<Path> resolveExecutable(String tool) {
        if (tool == null || tool.isBlank()) {
            return Optional.empty();
        }
        try {
            Path direct = Path.of(tool);
            if (direct.isAbsolute()) {
                return isExecutable(direct) ? Optional.of(direct) : Optional.empty();
            }
            String path = pathSupplier.get();
            if (path == null || path.isBlank()) {
                return Optional.empty();
            }
            for (String entry : path.split(File.pathSeparator)) {
                if (entry.isBlank()) {
                    continue;
                }
                Path candidate = Path.of(entry).resolve(tool);
                if (isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        } catch (InvalidPathException e) {
            log.debug("Ignoring invalid path while resolving '{}': {}", tool, e.getMessage());
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }
}
