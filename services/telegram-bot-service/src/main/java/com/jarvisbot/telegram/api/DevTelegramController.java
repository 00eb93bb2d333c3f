package com.jarvisbot.telegram.api;

import com.jarvisbot.telegram.dispatch.TelegramUpdateHandler;
import com.jarvisbot.telegram.model.ChatMessageEnvelope;
import com.jarvisbot.telegram.model.ChatResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local endpoint: routes a fake text message through the same core and returns the replies
 * instead of sending them to Telegram.
 */
@RestController
@RequestMapping("/dev/telegram")
@ConditionalOnProperty(name = "dev.telegram.enabled", havingValue = "true")
public class DevTelegramController {

  private final TelegramUpdateHandler handler;

  public DevTelegramController(TelegramUpdateHandler handler) {
    this.handler = handler;
  }

  public record DevMessageRequest(
      @NotNull Long telegramUserId, @NotNull Long chatId, String username, @NotBlank String text) {}

  @PostMapping("/message")
  public ChatResponse message(@Valid @RequestBody DevMessageRequest req) {
    ChatMessageEnvelope env =
        new ChatMessageEnvelope(
            String.valueOf(req.telegramUserId()),
            req.username(),
            String.valueOf(req.chatId()),
            null,
            req.text().trim());
    return handler.respond(env, req.username());
  }
}
