package com.apod.pipeline.etl.api;

import com.apod.pipeline.etl.model.ApodRecord;
import com.apod.pipeline.etl.model.PipelineRunReport;
import com.apod.pipeline.etl.model.PipelineStatusResponse;
import com.apod.pipeline.etl.persistence.ApodJdbcRepository;
import com.apod.pipeline.etl.service.PipelineRunService;
import com.apod.pipeline.etl.service.PipelineStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 100;

    private final PipelineRunService runService;
    private final PipelineStatusService statusService;
    private final ApodJdbcRepository repository;

    public PipelineController(
        PipelineRunService runService,
        PipelineStatusService statusService,
        ApodJdbcRepository repository
    ) {
        this.runService = runService;
        this.statusService = statusService;
        this.repository = repository;
    }

    @PostMapping("/pipeline/run")
    public PipelineRunReport run(@RequestParam(name = "date", required = false) String date) {
        return runService.run(date == null || date.isBlank() ? null : parseDate(date));
    }

    @GetMapping("/pipeline/status")
    public PipelineStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/records")
    public List<ApodRecord> records(@RequestParam(name = "limit", required = false) Integer limit) {
        int safeLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return repository.findNewest(safeLimit);
    }

    @GetMapping("/records/{date}")
    public ApodRecord record(@PathVariable("date") String date) {
        LocalDate parsed = parseDate(date);
        return repository.findByDate(parsed)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No APOD record for " + parsed));
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid date: " + value);
        }
    }
}
