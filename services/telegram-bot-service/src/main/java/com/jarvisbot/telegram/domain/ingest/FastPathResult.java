package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.client.dto.IngestDtos.IngestResponse;

/**
 * Outcome of one fast-path attempt. The orchestrator decides on {@link #status()} alone; anything
 * but {@code SUCCESS} sends the file down the fallback path.
 */
public record FastPathResult(Status status, IngestResponse response, String failureReason) {

  public enum Status {
    SUCCESS,
    RECOVERABLE_FAILURE,
    SKIPPED
  }

  public static FastPathResult success(IngestResponse response) {
    return new FastPathResult(Status.SUCCESS, response, null);
  }

  public static FastPathResult failure(String reason) {
    return new FastPathResult(Status.RECOVERABLE_FAILURE, null, reason);
  }

  public static FastPathResult skipped() {
    return new FastPathResult(Status.SKIPPED, null, "fast path is not configured");
  }
}
