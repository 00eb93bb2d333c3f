package com.jarvisbot.telegram.domain.dialog;

import com.jarvisbot.telegram.client.ContactsClientException;
import com.jarvisbot.telegram.model.ChatResponse;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Button presses. Bypasses the conversation router and goes straight to the action registry.
 *
 * <p>A token is consumed before its action runs, so a second press is always reported as expired.
 * LINK, CREATE and SKIP move the dialog forward only when the button belongs to the question that
 * is still open; CORRECT relinks an already matched mention and never touches the session.
 */
@Service
@Slf4j
public class CallbackActionHandler {

  public static final String EXPIRED = "⌛ This action has expired, please start over.";
  static final String RETRY_BY_TEXT =
      "⚠️ The contacts service is not responding. Type the number again to retry.";

  private final CallbackActionRegistry registry;
  private final PendingLinkQueue queue;
  private final ContactOperations operations;

  public CallbackActionHandler(
      CallbackActionRegistry registry, PendingLinkQueue queue, ContactOperations operations) {
    this.registry = registry;
    this.queue = queue;
    this.operations = operations;
  }

  public ChatResponse handle(String userId, String callbackData) {
    Optional<CallbackAction> consumed = ActionToken.parse(callbackData).flatMap(registry::consume);
    if (consumed.isEmpty()) {
      log.info("Expired or unknown action token '{}' from user {}", callbackData, userId);
      return ChatResponse.ofText(EXPIRED);
    }
    CallbackAction action = consumed.get();
    if (!action.userId().equals(userId)) {
      log.warn("User {} pressed a button minted for user {}", userId, action.userId());
      return ChatResponse.ofText(EXPIRED);
    }

    if (action.kind() != ActionKind.SKIP && !operations.isConfigured()) {
      return ChatResponse.ofText(ContactOperations.NOT_CONFIGURED);
    }

    try {
      return switch (action.kind()) {
        case SKIP -> onCurrent(
            userId,
            action,
            ResolutionOutcome.SKIPPED,
            "⏭ Skipped \"" + action.searchedName() + "\".");
        case LINK -> onCurrent(
            userId,
            action,
            ResolutionOutcome.LINKED,
            operations.link(
                action.meetingId(),
                action.searchedName(),
                action.contactId(),
                action.contactName()));
        case CREATE -> onCurrent(
            userId,
            action,
            ResolutionOutcome.CREATED,
            operations.create(action.meetingId(), action.searchedName()));
        case CORRECT -> relink(action);
      };
    } catch (ContactsClientException e) {
      log.warn("{} action failed for user {}: {}", action.kind(), userId, e.getMessage());
      return ChatResponse.ofText(RETRY_BY_TEXT);
    }
  }

  private ChatResponse relink(CallbackAction action) {
    operations.link(
        action.meetingId(), action.searchedName(), action.contactId(), action.contactName());
    return ChatResponse.ofText(
        "🔁 Relinked \"" + action.searchedName() + "\" to " + action.contactName() + ".");
  }

  private ChatResponse onCurrent(
      String userId, CallbackAction action, ResolutionOutcome outcome, String acknowledgement) {
    Optional<DialogStep> step = queue.currentStep(userId);
    if (step.isEmpty() || !action.targets(step.get())) {
      if (outcome == ResolutionOutcome.SKIPPED) {
        return ChatResponse.ofText(ContactOperations.NO_LONGER_OPEN);
      }
      return ChatResponse.ofText(acknowledgement);
    }
    return operations.complete(userId, step.get(), outcome, acknowledgement);
  }
}
