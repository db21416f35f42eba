package com.apod.pipeline.etl.persistence;

import com.apod.pipeline.config.PipelineProperties;
import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.Provenance;
import com.apod.pipeline.etl.model.RawApod;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat-file sink: one CSV row per APOD date, newest first. Rewrites go through a temp file
 * that replaces the target in one move.
 */
@Component
public class ApodCsvStore {
    private static final Logger log = LoggerFactory.getLogger(ApodCsvStore.class);

    static final String[] HEADERS = {
        "date",
        "title",
        "url",
        "hdurl",
        "media_type",
        "explanation",
        "copyright",
        "retrieved_at",
        "provenance"
    };

    private final PipelineProperties properties;

    public ApodCsvStore(PipelineProperties properties) {
        this.properties = properties;
    }

    public Path csvPath() {
        return properties.getData().csvPath();
    }

    public boolean exists() {
        return Files.isRegularFile(csvPath());
    }

    public synchronized int appendAndDedupe(ApodRecord record) throws IOException {
        Path target = csvPath();
        Files.createDirectories(target.getParent());

        Map<String, String[]> rowsByDate = new LinkedHashMap<>();
        if (Files.isRegularFile(target)) {
            for (CSVRecord existing : readRecords(target)) {
                String date = getColumn(existing, "date");
                if (date == null || date.equals(record.date().toString())) {
                    continue;
                }
                rowsByDate.put(date, toRow(existing));
            }
        }
        rowsByDate.put(record.date().toString(), toRow(record));

        List<String[]> rows = new ArrayList<>(rowsByDate.values());
        rows.sort(Comparator.comparing((String[] row) -> row[0]).reversed());

        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(HEADERS).build())) {
                for (String[] row : rows) {
                    printer.printRecord((Object[]) row);
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("CSV {} now holds {} rows ({} bytes)", target, rows.size(), Files.size(target));
        return rows.size();
    }

    public List<RawApod> readAll() throws IOException {
        Path target = csvPath();
        if (!Files.isRegularFile(target)) {
            return List.of();
        }
        List<RawApod> out = new ArrayList<>();
        for (CSVRecord record : readRecords(target)) {
            out.add(new RawApod(
                getColumn(record, "date"),
                getColumn(record, "title"),
                getColumn(record, "url"),
                getColumn(record, "hdurl"),
                getColumn(record, "media_type"),
                getColumn(record, "explanation"),
                getColumn(record, "copyright"),
                getColumn(record, "retrieved_at"),
                getColumn(record, "provenance")
            ));
        }
        return out;
    }

    public int rowCount() throws IOException {
        return readAll().size();
    }

    /**
     * Newest row that can be re-served as cached data. Placeholder rows left by an earlier
     * outage are skipped.
     */
    public Optional<RawApod> latestServable() throws IOException {
        RawApod latest = null;
        LocalDate latestDate = null;
        for (RawApod row : readAll()) {
            LocalDate date = parseDate(row.date());
            if (date == null || !isServable(row)) {
                continue;
            }
            if (latestDate == null || date.isAfter(latestDate)) {
                latestDate = date;
                latest = row;
            }
        }
        return Optional.ofNullable(latest);
    }

    public Optional<RawApod> findServable(LocalDate date) throws IOException {
        for (RawApod row : readAll()) {
            if (date.equals(parseDate(row.date())) && isServable(row)) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    private static boolean isServable(RawApod row) {
        return Provenance.fromWireValue(row.provenance()) != Provenance.PLACEHOLDER;
    }

    private List<CSVRecord> readRecords(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            return parser.getRecords();
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        return CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build()
            .parse(reader);
    }

    private String[] toRow(CSVRecord record) {
        String[] row = new String[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            String value = getColumn(record, HEADERS[i]);
            row[i] = value == null ? "" : value;
        }
        return row;
    }

    private String[] toRow(ApodRecord record) {
        return new String[] {
            record.date().toString(),
            safe(record.title()),
            safe(record.mediaUrl()),
            safe(record.highDefUrl()),
            record.mediaType() == null ? "" : record.mediaType().wireValue(),
            safe(record.explanation()),
            safe(record.attribution()),
            record.retrievedAt() == null ? "" : record.retrievedAt().toString(),
            record.provenance() == null ? "" : record.provenance().wireValue()
        };
    }

    private static String getColumn(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return null;
        }
        String value = record.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
