package com.jarvisbot.telegram.model;

import java.util.ArrayList;
import java.util.List;

public record ChatResponse(List<OutgoingMessage> messages) {

  public static ChatResponse empty() {
    return new ChatResponse(List.of());
  }

  public static ChatResponse ofText(String text) {
    return new ChatResponse(List.of(OutgoingMessage.plain(text)));
  }

  public static ChatResponse of(OutgoingMessage... messages) {
    return new ChatResponse(List.of(messages));
  }

  public boolean isEmpty() {
    return messages == null || messages.isEmpty();
  }

  public ChatResponse and(OutgoingMessage message) {
    List<OutgoingMessage> out = new ArrayList<>(messages == null ? List.of() : messages);
    out.add(message);
    return new ChatResponse(List.copyOf(out));
  }

  /** Marks the first message to replace the source message (status line) instead of a new one. */
  public ChatResponse editingFirst() {
    if (isEmpty()) {
      return this;
    }
    List<OutgoingMessage> out = new ArrayList<>(messages);
    out.set(0, out.get(0).preferEdit());
    return new ChatResponse(List.copyOf(out));
  }
}
