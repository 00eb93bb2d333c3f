package com.jarvisbot.telegram.domain.dialog;

import java.util.Optional;

/** Result of resolving the current reference: what was resolved and what comes next, if any. */
public record DialogAdvance(
    PendingReference resolved, ResolutionOutcome outcome, Optional<DialogStep> next) {

  public boolean completed() {
    return next.isEmpty();
  }
}
