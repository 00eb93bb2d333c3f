package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.domain.dialog.PendingReference;
import java.util.List;

/** Structured fast-path result, already split into linked and unresolved mentions. */
public record AnalysisResult(
    String summary,
    int transcriptLength,
    List<LinkedReference> linked,
    List<PendingReference> unresolved) {

  public AnalysisResult {
    linked = linked == null ? List.of() : List.copyOf(linked);
    unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
  }

  public boolean hasUnresolved() {
    return !unresolved.isEmpty();
  }
}
