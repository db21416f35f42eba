package com.apod.pipeline.etl.api;

import com.apod.pipeline.etl.http.FatalUpstreamException;
import com.apod.pipeline.etl.model.VerificationReport;
import com.apod.pipeline.etl.service.ActivePipelineRunException;
import com.apod.pipeline.etl.service.SinkWriteException;
import com.apod.pipeline.etl.service.ValidationException;
import com.apod.pipeline.etl.service.VerificationFailedException;
import com.apod.pipeline.etl.versioning.RepositoryStateException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(ActivePipelineRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActivePipelineRunException ex) {
    return error(HttpStatus.CONFLICT, "active_pipeline_run", ex.getMessage());
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(ValidationException ex) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "validation_failed", ex.getMessage());
  }

  @ExceptionHandler(FatalUpstreamException.class)
  public ResponseEntity<Map<String, String>> handleUpstream(FatalUpstreamException ex) {
    Map<String, String> body = new LinkedHashMap<>(body("upstream_fatal", ex.getMessage()));
    body.put("reason", ex.getReason() == null ? "" : ex.getReason());
    body.put("upstreamStatus", String.valueOf(ex.getStatusCode()));
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }

  @ExceptionHandler(SinkWriteException.class)
  public ResponseEntity<Map<String, String>> handleSink(SinkWriteException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "sink_write_failed", ex.getSink() + ": " + ex.getMessage());
  }

  @ExceptionHandler(VerificationFailedException.class)
  public ResponseEntity<Map<String, String>> handleVerification(VerificationFailedException ex) {
    VerificationReport report = ex.getReport();
    Map<String, String> body = new LinkedHashMap<>(body("verification_failed", ex.getMessage()));
    body.put("date", String.valueOf(report.date()));
    body.put("postgresCount", String.valueOf(report.postgresCount()));
    body.put("csvExists", String.valueOf(report.csvExists()));
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  @ExceptionHandler(RepositoryStateException.class)
  public ResponseEntity<Map<String, String>> handleRepositoryState(RepositoryStateException ex) {
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "repository_state", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(body(code, message));
  }

  private static Map<String, String> body(String code, String message) {
    return Map.of("error", code, "message", message == null ? "" : message);
  }
}
