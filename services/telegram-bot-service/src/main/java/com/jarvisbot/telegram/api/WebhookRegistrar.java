package com.jarvisbot.telegram.api;

import com.jarvisbot.telegram.client.TelegramBotClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Points Telegram at {@code {public-url}/telegram/webhook} once the app is up. */
@Component
@Slf4j
public class WebhookRegistrar {

  private final TelegramBotClient bot;
  private final String publicUrl;
  private final String secretToken;
  private final boolean polling;

  public WebhookRegistrar(
      TelegramBotClient bot,
      @Value("${telegram.webhook.public-url:}") String publicUrl,
      @Value("${telegram.webhook.secret-token:}") String secretToken,
      @Value("${telegram.polling.enabled:false}") boolean polling) {
    this.bot = bot;
    this.publicUrl = publicUrl == null ? "" : publicUrl.trim();
    this.secretToken = secretToken;
    this.polling = polling;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void register() {
    if (polling || publicUrl.isBlank()) {
      return;
    }
    String url = webhookUrl(publicUrl);
    if (bot.setWebhook(url, secretToken)) {
      log.info("Webhook set to: {}", url);
    } else {
      log.warn("Could not set webhook to {}", url);
    }
  }

  static String webhookUrl(String publicUrl) {
    String base =
        publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
    return base + "/telegram/webhook";
  }
}
