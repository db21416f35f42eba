package com.apod.pipeline.etl.versioning;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the {@code .dvc} descriptor that stands in for the data file in git.
 */
final class MetadataDocument {
    static final String SUFFIX = ".dvc";

    private MetadataDocument() {
    }

    record Entry(String md5, long size, String path) {}

    static Path documentPathFor(Path dataFile) {
        return dataFile.resolveSibling(dataFile.getFileName().toString() + SUFFIX);
    }

    static String render(Entry entry) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("md5", entry.md5());
        out.put("size", entry.size());
        out.put("hash", "md5");
        out.put("path", entry.path());
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("outs", List.of(out));

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        return new Yaml(options).dump(root);
    }

    static Optional<Entry> read(Path document) throws IOException {
        if (!Files.isRegularFile(document)) {
            return Optional.empty();
        }
        Object loaded;
        try (Reader reader = Files.newBufferedReader(document, StandardCharsets.UTF_8)) {
            loaded = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Unreadable metadata document " + document + ": " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map<?, ?> root) || !(root.get("outs") instanceof List<?> outs) || outs.isEmpty()) {
            return Optional.empty();
        }
        if (!(outs.get(0) instanceof Map<?, ?> first)) {
            return Optional.empty();
        }
        Object md5 = first.get("md5");
        Object size = first.get("size");
        Object path = first.get("path");
        if (md5 == null || !(size instanceof Number number) || path == null) {
            return Optional.empty();
        }
        return Optional.of(new Entry(md5.toString(), number.longValue(), path.toString()));
    }
}
