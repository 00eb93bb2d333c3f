package com.jarvisbot.telegram.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.jarvisbot.telegram.client.TelegramBotClient;
import com.jarvisbot.telegram.dispatch.UpdateDispatcher;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * getUpdates loop for local runs without a public webhook URL.
 *
 * <p>The offset only moves past updates the dispatcher accepted, so an update refused by a full
 * pool is fetched again on the next tick.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "telegram.polling.enabled", havingValue = "true")
public class TelegramPollingRunner {

  private final TelegramBotClient bot;
  private final UpdateDispatcher dispatcher;
  private final int longPollSeconds;
  private final AtomicLong nextOffset = new AtomicLong(0);
  private final AtomicBoolean warnedUnconfigured = new AtomicBoolean(false);

  public TelegramPollingRunner(
      TelegramBotClient bot,
      UpdateDispatcher dispatcher,
      @Value("${telegram.polling.timeout-seconds:20}") int longPollSeconds) {
    this.bot = bot;
    this.dispatcher = dispatcher;
    this.longPollSeconds = longPollSeconds;
  }

  @Scheduled(fixedDelayString = "${telegram.polling.fixed-delay-ms:2000}")
  public void poll() {
    if (!bot.isConfigured()) {
      if (warnedUnconfigured.compareAndSet(false, true)) {
        log.warn("Polling enabled without a bot token; nothing will be fetched");
      }
      return;
    }

    JsonNode response = bot.getUpdates(nextOffset.get(), longPollSeconds);
    JsonNode updates = response == null ? null : response.path("result");
    if (updates == null || !updates.isArray()) {
      return;
    }

    for (JsonNode update : updates) {
      long updateId = update.path("update_id").asLong(-1);
      if (!dispatcher.dispatch(update)) {
        log.warn("Update {} refused by dispatcher, will refetch", updateId);
        return;
      }
      if (updateId >= nextOffset.get()) {
        nextOffset.set(updateId + 1);
      }
    }
  }

  long offset() {
    return nextOffset.get();
  }
}
