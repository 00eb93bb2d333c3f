package com.jarvisbot.telegram.domain.dialog;

import java.util.Optional;

/** Button actions. The prefix is the first character of every token minted for the kind. */
public enum ActionKind {
  LINK('l'),
  CREATE('c'),
  SKIP('s'),
  CORRECT('x');

  private final char prefix;

  ActionKind(char prefix) {
    this.prefix = prefix;
  }

  public char prefix() {
    return prefix;
  }

  public static Optional<ActionKind> fromPrefix(char prefix) {
    for (ActionKind kind : values()) {
      if (kind.prefix == prefix) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
