package com.jarvisbot.telegram.dispatch;

import com.jarvisbot.telegram.client.TelegramBotClient;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.model.InlineKeyboard;
import com.jarvisbot.telegram.model.OutgoingMessage;
import com.jarvisbot.telegram.model.UiHints;
import org.springframework.stereotype.Component;

/** Sends a {@link ChatResponse} to a chat, editing the source message where a reply asks to. */
@Component
public class ReplySender {

  private final TelegramBotClient bot;

  public ReplySender(TelegramBotClient bot) {
    this.bot = bot;
  }

  public void send(
      String chatId, String sourceMessageId, boolean allowEdit, ChatResponse response) {
    if (response == null || response.messages() == null) {
      return;
    }

    for (OutgoingMessage m : response.messages()) {
      if (m == null || m.text() == null || m.text().isBlank()) {
        continue;
      }

      UiHints hints = m.uiHints();
      boolean preferEdit = hints != null && hints.preferEdit();
      InlineKeyboard keyboard = hints == null ? null : hints.inlineKeyboard();
      String parseMode = hints == null ? null : hints.parseModeHint();

      if (preferEdit && allowEdit && sourceMessageId != null) {
        bot.editMessageText(chatId, sourceMessageId, m.text(), parseMode, keyboard);
      } else {
        bot.sendMessage(chatId, m.text(), parseMode, keyboard);
      }
    }
  }

  /** @return id of the status message, or {@code null} if it could not be sent */
  public String sendStatus(String chatId, String text) {
    return bot.sendMessage(chatId, text);
  }
}
