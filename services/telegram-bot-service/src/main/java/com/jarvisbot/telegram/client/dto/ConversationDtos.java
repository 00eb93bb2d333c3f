package com.jarvisbot.telegram.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

public final class ConversationDtos {
  private ConversationDtos() {}

  public record ChatRequest(String message, String username, List<HistoryItem> history) {}

  public record HistoryItem(String role, String content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ChatReply(String response) {}
}
