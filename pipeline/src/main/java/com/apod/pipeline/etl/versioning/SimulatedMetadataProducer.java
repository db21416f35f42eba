package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.etl.model.MetadataResult;
import com.apod.pipeline.etl.model.MetadataSource;
import com.apod.pipeline.etl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * Writes the metadata document without the external tool, in the same layout the tool uses.
 */
@Component
public class SimulatedMetadataProducer implements MetadataProducer {
    private static final Logger log = LoggerFactory.getLogger(SimulatedMetadataProducer.class);

    @Override
    public MetadataResult produceMetadata(Path dataFile) {
        if (!Files.isRegularFile(dataFile)) {
            throw new IllegalStateException("Data file does not exist: " + dataFile);
        }
        Path document = MetadataDocument.documentPathFor(dataFile);
        String fileName = dataFile.getFileName().toString();
        try {
            String checksum = HashUtils.md5Hex(dataFile);
            long size = Files.size(dataFile);
            MetadataDocument.Entry wanted = new MetadataDocument.Entry(checksum, size, fileName);

            Optional<MetadataDocument.Entry> existing = readQuietly(document);
            if (existing.isPresent() && existing.get().equals(wanted)) {
                log.info("Metadata document {} already matches md5={}", document.getFileName(), checksum);
            } else {
                Path tmp = document.resolveSibling(document.getFileName() + ".tmp");
                Files.writeString(tmp, MetadataDocument.render(wanted), StandardCharsets.UTF_8);
                Files.move(tmp, document, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.info("Wrote simulated metadata document {} (md5={}, size={})", document.getFileName(), checksum, size);
            }
            ensureIgnored(dataFile.getParent().resolve(".gitignore"), "/" + fileName);
            return new MetadataResult(dataFile, document, checksum, size, MetadataSource.SIMULATED);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write metadata document for " + dataFile, e);
        }
    }

    private Optional<MetadataDocument.Entry> readQuietly(Path document) {
        try {
            return MetadataDocument.read(document);
        } catch (IOException e) {
            log.warn("Replacing unreadable metadata document {}: {}", document, e.getMessage());
            return Optional.empty();
        }
    }

    static void ensureIgnored(Path gitignore, String entry) throws IOException {
        if (Files.exists(gitignore)) {
            List<String> lines = Files.readAllLines(gitignore, StandardCharsets.UTF_8);
            if (lines.stream().map(String::trim).anyMatch(entry::equals)) {
                return;
            }
            String content = Files.readString(gitignore, StandardCharsets.UTF_8);
            String prefix = content.isEmpty() || content.endsWith("\n") ? "" : "\n";
            Files.writeString(gitignore, prefix + entry + "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } else {
            Files.writeString(gitignore, entry + "\n", StandardCharsets.UTF_8);
        }
    }
}
