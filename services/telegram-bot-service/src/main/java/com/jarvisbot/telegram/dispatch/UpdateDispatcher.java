package com.jarvisbot.telegram.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/** Hands updates to the worker pool, each under its own correlation id. */
@Component
@Slf4j
public class UpdateDispatcher {

  public static final String MDC_KEY = "cid";

  private final TaskExecutor executor;
  private final TelegramUpdateHandler handler;

  public UpdateDispatcher(
      @Qualifier("updateExecutor") TaskExecutor executor, TelegramUpdateHandler handler) {
    this.executor = executor;
    this.handler = handler;
  }

  /** @return false if the pool is saturated and the update was dropped */
  public boolean dispatch(JsonNode update) {
    String cid = UUID.randomUUID().toString().substring(0, 8);
    MDC.put(MDC_KEY, cid);
    try {
      executor.execute(() -> run(update));
      return true;
    } catch (TaskRejectedException e) {
      log.warn("Update {} rejected, worker pool is full", update.path("update_id").asText());
      return false;
    } finally {
      MDC.remove(MDC_KEY);
    }
  }

  private void run(JsonNode update) {
    try {
      handler.handle(update);
    } catch (RuntimeException e) {
      log.error("Failed to handle update {}", update.path("update_id").asText(), e);
    }
  }
}
