package com.jarvisbot.telegram.model;

public record UiHints(boolean preferEdit, String parseModeHint, InlineKeyboard inlineKeyboard) {

  public UiHints withPreferEdit(boolean value) {
    return new UiHints(value, parseModeHint, inlineKeyboard);
  }

  public UiHints withInlineKeyboard(InlineKeyboard keyboard) {
    return new UiHints(preferEdit, parseModeHint, keyboard);
  }
}
