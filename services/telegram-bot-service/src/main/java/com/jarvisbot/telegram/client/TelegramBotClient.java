package com.jarvisbot.telegram.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.jarvisbot.telegram.model.InlineKeyboard;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Thin Telegram Bot API client.
 *
 * <p>Failures are logged and reported as {@code null}/{@code false}; the caller decides what the
 * user sees.
 */
@Service
@Slf4j
public class TelegramBotClient {

  private static final String API_BASE = "https://api.telegram.org/bot";
  private static final String FILE_BASE = "https://api.telegram.org/file/bot";

  private final RestClient rest;
  private final String botToken;

  public TelegramBotClient(
      @Qualifier("telegramRestClient") RestClient rest,
      @Value("${telegram.bot-token:}") String botToken) {
    this.rest = rest;
    this.botToken = botToken == null ? "" : botToken.trim();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  public JsonNode getUpdates(long offset, int timeoutSeconds) {
    return call("getUpdates", Map.of("offset", offset, "timeout", timeoutSeconds));
  }

  /**
   * Resolves {@code fileId} through getFile and downloads the content.
   *
   * @return file bytes, or {@code null} if either step failed
   */
  public byte[] downloadFile(String fileId) {
    if (!isConfigured()) {
      log.warn("Bot token missing, cannot download file {}", fileId);
      return null;
    }
    try {
      JsonNode file =
          rest.get()
              .uri(API_BASE + botToken + "/getFile?file_id={fileId}", fileId)
              .retrieve()
              .body(JsonNode.class);
      String filePath = file == null ? "" : file.path("result").path("file_path").asText("");
      if (filePath.isBlank()) {
        log.warn("getFile returned no file_path for fileId={}", fileId);
        return null;
      }
      return rest.get().uri(FILE_BASE + botToken + "/" + filePath).retrieve().body(byte[].class);
    } catch (RestClientException e) {
      log.warn("Download of Telegram file {} failed: {}", fileId, e.getMessage());
      return null;
    }
  }

  public String sendMessage(String chatId, String text) {
    return sendMessage(chatId, text, null, null);
  }

  /** @return id of the sent message, or {@code null} if sending failed */
  public String sendMessage(String chatId, String text, String parseMode, InlineKeyboard keyboard) {
    JsonNode res = call("sendMessage", messageBody(chatId, null, text, parseMode, keyboard));
    return res == null ? null : res.path("result").path("message_id").asText(null);
  }

  public void editMessageText(
      String chatId, String messageId, String text, String parseMode, InlineKeyboard keyboard) {
    if (messageId == null || messageId.isBlank()) {
      return;
    }
    call("editMessageText", messageBody(chatId, messageId, text, parseMode, keyboard));
  }

  public void answerCallbackQuery(String callbackQueryId) {
    if (callbackQueryId == null || callbackQueryId.isBlank()) {
      return;
    }
    call("answerCallbackQuery", Map.of("callback_query_id", callbackQueryId));
  }

  public boolean setWebhook(String webhookUrl, String secretToken) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", webhookUrl);
    if (secretToken != null && !secretToken.isBlank()) {
      body.put("secret_token", secretToken);
    }
    JsonNode res = call("setWebhook", body);
    return res != null && res.path("ok").asBoolean(false);
  }

  private JsonNode call(String method, Map<String, ?> body) {
    if (!isConfigured()) {
      log.warn("Bot token missing, skipping {}", method);
      return null;
    }
    try {
      return rest.post()
          .uri(API_BASE + botToken + "/" + method)
          .body(body)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientException e) {
      log.warn("Telegram {} failed: {}", method, e.getMessage());
      return null;
    }
  }

  private static Map<String, Object> messageBody(
      String chatId, String messageId, String text, String parseMode, InlineKeyboard keyboard) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", chatId);
    if (messageId != null) {
      body.put("message_id", messageId);
    }
    body.put("text", text);
    if (parseMode != null && !parseMode.isBlank()) {
      body.put("parse_mode", parseMode);
    }
    if (keyboard != null) {
      body.put("reply_markup", Map.of("inline_keyboard", buttonRows(keyboard)));
    }
    return body;
  }

  private static List<List<Map<String, String>>> buttonRows(InlineKeyboard keyboard) {
    return keyboard.rows().stream()
        .map(
            row ->
                row.stream()
                    .map(b -> Map.of("text", b.text(), "callback_data", b.callbackData()))
                    .toList())
        .toList();
  }
}
