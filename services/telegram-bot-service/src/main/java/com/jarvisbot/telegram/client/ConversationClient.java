package com.jarvisbot.telegram.client;

import com.jarvisbot.telegram.client.dto.ConversationDtos.ChatReply;
import com.jarvisbot.telegram.client.dto.ConversationDtos.ChatRequest;
import com.jarvisbot.telegram.client.dto.ConversationDtos.HistoryItem;
import com.jarvisbot.telegram.config.ConversationProperties;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** General-purpose assistant used when no contact dialog is open. */
@Service
public class ConversationClient {

  private final RestClient rest;
  private final ConversationProperties properties;

  public ConversationClient(
      @Qualifier("conversationRestClient") RestClient rest, ConversationProperties properties) {
    this.rest = rest;
    this.properties = properties;
  }

  public boolean isConfigured() {
    return properties.isConfigured();
  }

  public String chat(String message, String username, List<HistoryItem> history) {
    ChatReply reply;
    try {
      reply =
          rest.post()
              .uri(properties.url())
              .body(new ChatRequest(message, username, history))
              .retrieve()
              .body(ChatReply.class);
    } catch (RestClientException e) {
      throw new ConversationClientException("chat call failed: " + e.getMessage(), e);
    }
    if (reply == null || reply.response() == null || reply.response().isBlank()) {
      throw new ConversationClientException("chat call returned no response");
    }
    return reply.response();
  }
}
