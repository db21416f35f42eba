package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommandResult;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs git against the data directory, which doubles as the working tree.
 */
@Component
public class GitClient {
    private final PipelineProperties properties;
    private final CommandRunner commandRunner;

    public GitClient(PipelineProperties properties, CommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
    }

    public Path workTree() {
        return properties.getData().directory();
    }

    public boolean isRepository() {
        return Files.exists(workTree().resolve(".git"));
    }

    public CommandResult git(String... args) {
        return git(Map.of(), args);
    }

    public CommandResult git(Map<String, String> env, String... args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getVersioning().getGitBinary());
        command.addAll(Arrays.asList(args));
        return commandRunner.run(workTree(), timeout(), env, command);
    }

    public Duration timeout() {
        return Duration.ofSeconds(properties.getVersioning().getCommandTimeoutSeconds());
    }

    public String remoteName() {
        return properties.getVersioning().getRemoteName();
    }
}
