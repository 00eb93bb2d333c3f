package com.jarvisbot.telegram.api;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  private final boolean polling;

  public StatusController(@Value("${telegram.polling.enabled:false}") boolean polling) {
    this.polling = polling;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "status", "Jarvis Telegram bot is running", "mode", polling ? "polling" : "webhook");
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    return Map.of("status", "healthy");
  }
}
