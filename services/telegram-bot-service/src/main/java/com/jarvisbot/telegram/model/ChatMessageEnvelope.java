package com.jarvisbot.telegram.model;

import jakarta.validation.constraints.NotBlank;

/**
 * One inbound text message, already stripped of the transport's update format.
 *
 * <p>{@code userId} keys every per-user store (dialog sessions, history).
 */
public record ChatMessageEnvelope(
    @NotBlank String userId,
    String username,
    @NotBlank String chatId,
    String messageId,
    String text) {

  /** Handle used in file names and collaborator calls: username when present, else the id. */
  public String handle() {
    return username == null || username.isBlank() ? userId : username;
  }
}
