package com.jarvisbot.telegram.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversation")
public record ConversationProperties(
    String url, Duration timeout, int maxHistoryMessages, Duration historyMaxAge) {

  public boolean isConfigured() {
    return url != null && !url.isBlank();
  }
}
