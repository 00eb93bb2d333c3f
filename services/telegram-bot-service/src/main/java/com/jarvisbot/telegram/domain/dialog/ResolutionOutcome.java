package com.jarvisbot.telegram.domain.dialog;

public enum ResolutionOutcome {
  LINKED,
  CREATED,
  SKIPPED
}
