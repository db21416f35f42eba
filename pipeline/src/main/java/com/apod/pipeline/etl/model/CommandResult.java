package com.apod.pipeline.etl.model;

import java.time.Duration;
import java.util.List;

public record CommandResult(
    List<String> command,
    int exitCode,
    String stdout,
    String stderr,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return errorCode == null && exitCode == 0;
    }

    public String combinedOutput() {
        StringBuilder out = new StringBuilder();
        if (stdout != null) {
            out.append(stdout);
        }
        if (stderr != null) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(stderr);
        }
        if (errorMessage != null) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(errorMessage);
        }
        return out.toString();
    }
}
