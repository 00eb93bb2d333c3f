package com.jarvisbot.telegram.domain.ingest;

/**
 * What became of one audio file.
 *
 * <ul>
 *   <li>{@code PROCESSED}: analysed on the fast path, {@code analysis} is set;
 *   <li>{@code DEFERRED}: stored for out-of-band processing, {@code storedFileName} is set;
 *   <li>{@code FAILED}: neither worked, {@code error} carries the cause.
 * </ul>
 */
public record IngestOutcome(
    Status status, AnalysisResult analysis, String storedFileName, String error) {

  public enum Status {
    PROCESSED,
    DEFERRED,
    FAILED
  }

  public static IngestOutcome processed(AnalysisResult analysis) {
    return new IngestOutcome(Status.PROCESSED, analysis, null, null);
  }

  public static IngestOutcome deferred(String storedFileName) {
    return new IngestOutcome(Status.DEFERRED, null, storedFileName, null);
  }

  public static IngestOutcome failed(String error) {
    return new IngestOutcome(Status.FAILED, null, null, error);
  }
}
