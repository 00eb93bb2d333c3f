package com.jarvisbot.telegram.model;

/**
 * Inbound audio as announced by Telegram, before the bytes are downloaded.
 *
 * <p>{@code fileUniqueId} is stable across re-deliveries of the same file and is what the
 * duplicate guard keys on; {@code fileId} is only good for downloading.
 */
public record AudioMessage(
    String userId,
    String username,
    String chatId,
    AudioKind kind,
    String fileId,
    String fileUniqueId,
    String mimeType,
    Integer durationSeconds) {

  public String handle() {
    return username == null || username.isBlank() ? userId : username;
  }

  public String effectiveMimeType() {
    return mimeType == null || mimeType.isBlank() ? kind.defaultMimeType() : mimeType;
  }
}
