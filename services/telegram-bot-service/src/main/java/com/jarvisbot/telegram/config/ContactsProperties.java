package com.jarvisbot.telegram.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "contacts")
public record ContactsProperties(String baseUrl, Duration timeout, int searchLimit) {

  public boolean isConfigured() {
    return baseUrl != null && !baseUrl.isBlank();
  }
}
