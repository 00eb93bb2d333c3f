package com.jarvisbot.telegram.model;

import jakarta.validation.constraints.NotBlank;

public record OutgoingMessage(@NotBlank String text, UiHints uiHints) {

  public OutgoingMessage(String text) {
    this(text, null);
  }

  public static OutgoingMessage plain(String text) {
    return new OutgoingMessage(text, null);
  }

  public OutgoingMessage preferEdit() {
    UiHints hints = uiHints == null ? new UiHints(true, null, null) : uiHints;
    return new OutgoingMessage(text, hints.withPreferEdit(true));
  }

  public OutgoingMessage withKeyboard(InlineKeyboard keyboard) {
    UiHints hints = uiHints == null ? new UiHints(false, null, keyboard) : uiHints;
    return new OutgoingMessage(text, hints.withInlineKeyboard(keyboard));
  }

  public InlineKeyboard keyboard() {
    return uiHints == null ? null : uiHints.inlineKeyboard();
  }
}
