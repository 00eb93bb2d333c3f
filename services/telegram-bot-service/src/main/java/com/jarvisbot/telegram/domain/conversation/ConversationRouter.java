package com.jarvisbot.telegram.domain.conversation;

import com.jarvisbot.telegram.client.ConversationClient;
import com.jarvisbot.telegram.client.ConversationClientException;
import com.jarvisbot.telegram.client.dto.ConversationDtos.HistoryItem;
import com.jarvisbot.telegram.domain.dialog.ContactDialogService;
import com.jarvisbot.telegram.domain.dialog.PendingLinkQueue;
import com.jarvisbot.telegram.model.ChatMessageEnvelope;
import com.jarvisbot.telegram.model.ChatResponse;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides where a free-text message goes.
 *
 * <p>While a contact question is open every message is an answer to it. Otherwise the text goes to
 * the assistant together with the user's recent history; history only grows on a successful round
 * trip.
 */
@Service
@Slf4j
public class ConversationRouter {

  static final String NOT_CONFIGURED = "⚙️ Chat is not configured.";
  static final String APOLOGY = "😔 Sorry, I couldn't get an answer right now. Please try again.";

  private final PendingLinkQueue queue;
  private final ContactDialogService dialog;
  private final ConversationClient conversation;
  private final ConversationHistoryStore history;

  public ConversationRouter(
      PendingLinkQueue queue,
      ContactDialogService dialog,
      ConversationClient conversation,
      ConversationHistoryStore history) {
    this.queue = queue;
    this.dialog = dialog;
    this.conversation = conversation;
    this.history = history;
  }

  public ChatResponse route(ChatMessageEnvelope env) {
    String userId = env.userId();
    String text = env.text() == null ? "" : env.text().trim();

    if (queue.hasSession(userId)) {
      return dialog.handle(userId, text);
    }
    if (text.isEmpty()) {
      return ChatResponse.empty();
    }
    if (ContactDialogService.CANCEL_TOKEN.equalsIgnoreCase(text)) {
      return ChatResponse.ofText("Nothing to cancel.");
    }
    if (!conversation.isConfigured()) {
      return ChatResponse.ofText(NOT_CONFIGURED);
    }

    List<HistoryItem> past =
        history.recent(userId).stream()
            .map(t -> new HistoryItem(t.role().wireName(), t.content()))
            .toList();
    try {
      String reply = conversation.chat(text, env.handle(), past);
      history.appendExchange(userId, text, reply);
      return ChatResponse.ofText(reply);
    } catch (ConversationClientException e) {
      log.warn("Conversation call failed for user {}: {}", userId, e.getMessage());
      return ChatResponse.ofText(APOLOGY);
    }
  }
}
