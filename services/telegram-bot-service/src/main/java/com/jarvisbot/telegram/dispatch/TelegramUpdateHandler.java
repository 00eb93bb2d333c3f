package com.jarvisbot.telegram.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.jarvisbot.telegram.client.TelegramBotClient;
import com.jarvisbot.telegram.domain.conversation.ConversationRouter;
import com.jarvisbot.telegram.domain.dialog.CallbackActionHandler;
import com.jarvisbot.telegram.domain.ingest.IngestTicket;
import com.jarvisbot.telegram.domain.ingest.VoiceIngestService;
import com.jarvisbot.telegram.model.AudioKind;
import com.jarvisbot.telegram.model.AudioMessage;
import com.jarvisbot.telegram.model.ChatMessageEnvelope;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.model.OutgoingMessage;
import com.jarvisbot.telegram.model.UiHints;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns one raw Telegram update into calls on the core and sends the replies.
 *
 * <p>Runs on a worker thread. The allow-list is checked here, before anything else sees the
 * update.
 */
@Component
@Slf4j
public class TelegramUpdateHandler {

  static final String NOT_AUTHORIZED = "❌ You are not authorized to use this bot.";
  static final String PROCESSING = "⏳ Processing your audio...";

  static final String HELP =
      "🎙️ *How to use Jarvis:*\n\n"
          + "1. Send a voice message (hold mic button)\n"
          + "2. I'll process it and show a summary\n"
          + "3. If I'm unsure who someone is, I'll ask you\n\n"
          + "*Tips:*\n"
          + "• Speak clearly\n"
          + "• Start with context: 'Meeting with John...'\n"
          + "• Mention names and dates clearly\n\n"
          + "Send /cancel to stop answering contact questions.";

  private final AccessPolicy access;
  private final TelegramBotClient bot;
  private final ReplySender replies;
  private final ConversationRouter router;
  private final CallbackActionHandler callbacks;
  private final VoiceIngestService voiceIngest;

  public TelegramUpdateHandler(
      AccessPolicy access,
      TelegramBotClient bot,
      ReplySender replies,
      ConversationRouter router,
      CallbackActionHandler callbacks,
      VoiceIngestService voiceIngest) {
    this.access = access;
    this.bot = bot;
    this.replies = replies;
    this.router = router;
    this.callbacks = callbacks;
    this.voiceIngest = voiceIngest;
  }

  public void handle(JsonNode update) {
    JsonNode callback = update.path("callback_query");
    if (!callback.isMissingNode() && !callback.isNull()) {
      handleCallback(callback);
      return;
    }

    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return;
    }

    String chatId = message.path("chat").path("id").asText();
    String fromId = message.path("from").path("id").asText();
    String username = message.path("from").path("username").asText(null);
    if (!access.isAllowed(fromId)) {
      log.warn("Unauthorized access attempt by user {} ({})", fromId, username);
      replies.send(chatId, null, false, ChatResponse.ofText(NOT_AUTHORIZED));
      return;
    }

    Optional<AudioMessage> audio = audioOf(message, fromId, username, chatId);
    if (audio.isPresent()) {
      handleAudio(audio.get());
      return;
    }

    String text = message.path("text").asText("").trim();
    if (text.isBlank()) {
      return;
    }
    String firstName = message.path("from").path("first_name").asText(null);
    ChatMessageEnvelope env =
        new ChatMessageEnvelope(
            fromId,
            username,
            chatId,
            message.path("message_id").asText(null),
            text);
    replies.send(chatId, env.messageId(), false, respond(env, firstName));
  }

  /** Text path shared with the dev endpoint: commands first, then the router. */
  public ChatResponse respond(ChatMessageEnvelope env, String firstName) {
    String command = command(env.text());
    if ("/start".equals(command)) {
      return ChatResponse.ofText(greeting(firstName));
    }
    if ("/help".equals(command)) {
      return ChatResponse.of(new OutgoingMessage(HELP, new UiHints(false, "Markdown", null)));
    }
    return router.route(env);
  }

  private void handleCallback(JsonNode callback) {
    String callbackId = callback.path("id").asText(null);
    JsonNode message = callback.path("message");
    String fromId = callback.path("from").path("id").asText();
    String data = callback.path("data").asText("").trim();
    try {
      if (message.isMissingNode() || message.isNull() || data.isBlank()) {
        return;
      }
      String chatId = message.path("chat").path("id").asText();
      if (!access.isAllowed(fromId)) {
        log.warn("Unauthorized button press by user {}", fromId);
        replies.send(chatId, null, false, ChatResponse.ofText(NOT_AUTHORIZED));
        return;
      }
      ChatResponse response = callbacks.handle(fromId, data);
      replies.send(chatId, message.path("message_id").asText(null), true, response);
    } finally {
      bot.answerCallbackQuery(callbackId);
    }
  }

  private void handleAudio(AudioMessage audio) {
    Optional<IngestTicket> ticket = voiceIngest.accept(audio);
    if (ticket.isEmpty()) {
      return;
    }
    log.info(
        "Received {} message from {} ({})", audio.kind().prefix(), audio.handle(), audio.userId());
    String statusId = replies.sendStatus(audio.chatId(), PROCESSING);
    byte[] bytes = bot.downloadFile(audio.fileId());
    ChatResponse response = voiceIngest.process(ticket.get(), bytes);
    replies.send(audio.chatId(), statusId, true, response.editingFirst());
  }

  static Optional<AudioMessage> audioOf(
      JsonNode message, String fromId, String username, String chatId) {
    AudioKind kind;
    JsonNode node = message.path("voice");
    if (!node.isMissingNode() && !node.isNull()) {
      kind = AudioKind.VOICE;
    } else {
      node = message.path("audio");
      if (node.isMissingNode() || node.isNull()) {
        return Optional.empty();
      }
      kind = AudioKind.AUDIO;
    }
    JsonNode duration = node.path("duration");
    return Optional.of(
        new AudioMessage(
            fromId,
            username,
            chatId,
            kind,
            node.path("file_id").asText(),
            node.path("file_unique_id").asText(null),
            node.path("mime_type").asText(null),
            duration.isNumber() ? duration.asInt() : null));
  }

  static String command(String text) {
    if (text == null || !text.startsWith("/")) {
      return null;
    }
    String head = text.split("\\s+", 2)[0];
    int at = head.indexOf('@');
    if (at > 0) {
      head = head.substring(0, at);
    }
    return head.toLowerCase(Locale.ROOT);
  }

  static String greeting(String firstName) {
    String name = firstName == null || firstName.isBlank() ? "there" : firstName;
    return "Hi "
        + name
        + "! 👋\n\n"
        + "I'm Jarvis, your voice memo assistant.\n\n"
        + "Send me a voice message and I'll process it for you:\n"
        + "• Transcribe it\n"
        + "• Extract key information\n"
        + "• Save it to your knowledge base\n\n"
        + "Just hold the microphone button and speak!";
  }
}
