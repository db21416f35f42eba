package com.apod.pipeline.etl.util;

import com.apod.pipeline.etl.model.CommandResult;

import java.util.Locale;

public final class PublishReasonClassifier {
  public static final String PUSHED = "pushed";
  public static final String UP_TO_DATE = "up-to-date";
  public static final String NO_REMOTE = "no-remote";
  public static final String NO_REPOSITORY = "no-repository";
  public static final String NO_COMMITS = "no-commits";
  public static final String DISABLED = "disabled";
  public static final String AUTH_FAILED = "auth-failed";
  public static final String NETWORK = "network";
  public static final String TIMEOUT = "timeout";
  public static final String REJECTED = "rejected";
  public static final String PUSH_FAILED = "push-failed";

  private PublishReasonClassifier() {}

  public static String classify(CommandResult result) {
    if (result == null) {
      return PUSH_FAILED;
    }
    if ("timeout".equals(result.errorCode())) {
      return TIMEOUT;
    }
    String lower = result.combinedOutput().toLowerCase(Locale.ROOT);
    if (lower.contains("authentication failed")
        || lower.contains("could not read username")
        || lower.contains("permission denied")
        || lower.contains("403")) {
      return AUTH_FAILED;
    }
    if (lower.contains("could not resolve host")
        || lower.contains("unable to access")
        || lower.contains("connection refused")
        || lower.contains("network is unreachable")
        || lower.contains("timed out")) {
      return NETWORK;
    }
    if (lower.contains("rejected") || lower.contains("non-fast-forward")) {
      return REJECTED;
    }
    return PUSH_FAILED;
  }

  public static boolean isUpToDate(CommandResult result) {
    return result != null
        && result.combinedOutput().toLowerCase(Locale.ROOT).contains("everything up-to-date");
  }
}
