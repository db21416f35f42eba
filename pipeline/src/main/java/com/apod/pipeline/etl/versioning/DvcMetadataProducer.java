package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.CommandResult;
import com.apod.pipeline.etl.model.MetadataResult;
import com.apod.pipeline.etl.model.MetadataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Component
public class DvcMetadataProducer implements MetadataProducer {
    private static final Logger log = LoggerFactory.getLogger(DvcMetadataProducer.class);

    private final PipelineProperties properties;
    private final CommandRunner commandRunner;

    public DvcMetadataProducer(PipelineProperties properties, CommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
    }

    @Override
    public MetadataResult produceMetadata(Path dataFile) {
        if (!Files.isRegularFile(dataFile)) {
            throw new IllegalStateException("Data file does not exist: " + dataFile);
        }
        Path workTree = dataFile.getParent();
        if (!Files.isDirectory(workTree.resolve(".dvc"))) {
            if (Files.exists(workTree.resolve(".git"))) {
                tool(workTree, "init");
            } else {
                tool(workTree, "init", "--no-scm");
            }
            log.info("Initialized metadata tool in {}", workTree);
        }
        tool(workTree, "add", dataFile.getFileName().toString());

        Path document = MetadataDocument.documentPathFor(dataFile);
        MetadataDocument.Entry entry;
        try {
            entry = MetadataDocument.read(document)
                .orElseThrow(() -> new MetadataToolException("Metadata document " + document + " has no outs entry"));
        } catch (IOException e) {
            throw new MetadataToolException("Failed to read metadata document " + document, e);
        }
        log.info("Metadata tool tracked {} (md5={}, size={})", dataFile.getFileName(), entry.md5(), entry.size());
        return new MetadataResult(dataFile, document, entry.md5(), entry.size(), MetadataSource.REAL);
    }

    private CommandResult tool(Path workTree, String... args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getVersioning().getMetadataTool());
        command.addAll(Arrays.asList(args));
        CommandResult result = commandRunner.run(
            workTree,
            Duration.ofSeconds(properties.getVersioning().getCommandTimeoutSeconds()),
            Map.of(),
            command
        );
        log.debug("{} -> exit={} output={}", command, result.exitCode(), result.combinedOutput());
        if (!result.isSuccessful()) {
            throw new MetadataToolException(
                "Command " + command + " failed (exit=" + result.exitCode() + ", error=" + result.errorCode() + "): "
                    + result.combinedOutput()
            );
        }
        return result;
    }
}
