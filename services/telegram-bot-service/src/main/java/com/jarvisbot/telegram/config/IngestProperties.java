package com.jarvisbot.telegram.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Fast-path analysis endpoint. A blank {@code processUrl} disables the fast path. */
@ConfigurationProperties(prefix = "ingest")
public record IngestProperties(String processUrl, Duration timeout) {

  public boolean isConfigured() {
    return processUrl != null && !processUrl.isBlank();
  }
}
