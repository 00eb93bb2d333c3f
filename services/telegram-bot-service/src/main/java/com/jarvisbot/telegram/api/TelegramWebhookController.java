package com.jarvisbot.telegram.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.jarvisbot.telegram.dispatch.UpdateDispatcher;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram webhook endpoint.
 *
 * <p>Only checks the secret header and queues the update; the work happens on the dispatcher's
 * pool, so Telegram gets its answer immediately even for long audio ingests.
 */
@RestController
@RequestMapping("/telegram")
@Slf4j
public class TelegramWebhookController {

  static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

  private final UpdateDispatcher dispatcher;
  private final byte[] expectedSecret;

  public TelegramWebhookController(
      UpdateDispatcher dispatcher,
      @Value("${telegram.webhook.secret-token:}") String secretToken) {
    this.dispatcher = dispatcher;
    this.expectedSecret =
        secretToken == null ? new byte[0] : secretToken.trim().getBytes(StandardCharsets.UTF_8);
  }

  @PostMapping("/webhook")
  public Map<String, Boolean> webhook(
      @RequestBody JsonNode update,
      @RequestHeader(value = SECRET_HEADER, required = false) String presented) {
    if (!secretMatches(presented)) {
      log.warn("Webhook call with a wrong secret, update_id={}", update.path("update_id"));
      return Map.of("ok", false);
    }
    return Map.of("ok", dispatcher.dispatch(update));
  }

  private boolean secretMatches(String presented) {
    if (expectedSecret.length == 0) {
      return true;
    }
    return presented != null
        && MessageDigest.isEqual(expectedSecret, presented.getBytes(StandardCharsets.UTF_8));
  }
}
