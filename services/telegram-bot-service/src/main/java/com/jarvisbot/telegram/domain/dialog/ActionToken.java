package com.jarvisbot.telegram.domain.dialog;

import java.util.Optional;

/**
 * Decoded callback token: kind prefix plus decimal sequence, e.g. {@code l42}.
 *
 * <p>Tokens stay far below Telegram's 64-byte callback_data limit.
 */
public record ActionToken(ActionKind kind, long sequence) {

  private static final int MAX_LENGTH = 20;

  public static Optional<ActionToken> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String data = raw.trim();
    if (data.length() < 2 || data.length() > MAX_LENGTH) {
      return Optional.empty();
    }
    Optional<ActionKind> kind = ActionKind.fromPrefix(data.charAt(0));
    if (kind.isEmpty()) {
      return Optional.empty();
    }
    String digits = data.substring(1);
    for (int i = 0; i < digits.length(); i++) {
      if (!Character.isDigit(digits.charAt(i))) {
        return Optional.empty();
      }
    }
    try {
      return Optional.of(new ActionToken(kind.get(), Long.parseLong(digits)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  public String encode() {
    return kind.prefix() + Long.toString(sequence);
  }

  @Override
  public String toString() {
    return encode();
  }
}
