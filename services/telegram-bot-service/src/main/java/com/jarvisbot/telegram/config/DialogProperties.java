package com.jarvisbot.telegram.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialog")
public record DialogProperties(Duration dedupWindow, Actions actions) {

  /** Bounds for the callback-action registry; evicted tokens read as expired. */
  public record Actions(long maxSize, Duration ttl) {}
}
