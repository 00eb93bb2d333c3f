package com.jarvisbot.telegram.domain.conversation;

import java.time.Instant;

public record ConversationTurn(Role role, String content, Instant at) {

  public enum Role {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    Role(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }
  }
}
