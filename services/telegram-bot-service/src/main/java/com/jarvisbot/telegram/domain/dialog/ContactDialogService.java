package com.jarvisbot.telegram.domain.dialog;

import com.jarvisbot.telegram.client.ContactsClient;
import com.jarvisbot.telegram.client.ContactsClientException;
import com.jarvisbot.telegram.client.dto.ContactDtos.ContactItem;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.render.PromptRenderer;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Typed answers to the current contact question.
 *
 * <p>Input grammar, first match wins: {@code /cancel}; {@code 0} (skip); a number (pick a
 * candidate, 1-indexed); anything of two or more characters (new search term). A search with
 * results replaces the candidates and asks again; an empty search creates the contact and moves
 * on. Rejected input and contact-service failures leave the session untouched.
 */
@Service
@Slf4j
public class ContactDialogService {

  public static final String CANCEL_TOKEN = "/cancel";

  static final String NOTHING_PENDING = "There is no open contact question.";
  static final String CANCELLED = "🛑 Contact review cancelled.";
  static final String TOO_SHORT = "Please type at least 2 characters, or 0 to skip.";
  static final String NO_CANDIDATES =
      "There are no suggestions to pick from. Type the full name, or 0 to skip.";

  private static final int MIN_NAME_LENGTH = 2;
  private static final int MAX_NUMBER_DIGITS = 3;

  private final PendingLinkQueue queue;
  private final ContactsClient contacts;
  private final ContactOperations operations;
  private final PromptRenderer renderer;

  public ContactDialogService(
      PendingLinkQueue queue,
      ContactsClient contacts,
      ContactOperations operations,
      PromptRenderer renderer) {
    this.queue = queue;
    this.contacts = contacts;
    this.operations = operations;
    this.renderer = renderer;
  }

  public ChatResponse handle(String userId, String text) {
    Optional<DialogStep> current = queue.currentStep(userId);
    if (current.isEmpty()) {
      return ChatResponse.ofText(NOTHING_PENDING);
    }
    DialogStep step = current.get();
    PendingReference ref = step.reference();
    String input = text == null ? "" : text.trim();

    if (CANCEL_TOKEN.equalsIgnoreCase(input)) {
      queue.discard(userId);
      log.info("User {} cancelled the contact review", userId);
      return ChatResponse.ofText(CANCELLED);
    }

    if (PromptRenderer.SKIP_TOKEN.equals(input)) {
      return operations.complete(
          userId, step, ResolutionOutcome.SKIPPED, "⏭ Skipped \"" + ref.searchedName() + "\".");
    }

    if (isNumber(input)) {
      return pick(userId, step, input);
    }

    if (input.length() < MIN_NAME_LENGTH) {
      return ChatResponse.ofText(TOO_SHORT);
    }

    return searchOrCreate(userId, step, input);
  }

  private ChatResponse pick(String userId, DialogStep step, String input) {
    PendingReference ref = step.reference();
    int count = ref.candidates().size();
    Optional<Candidate> chosen =
        input.length() > MAX_NUMBER_DIGITS
            ? Optional.empty()
            : ref.candidateAt(Integer.parseInt(input));
    if (chosen.isEmpty()) {
      if (count == 0) {
        return ChatResponse.ofText(NO_CANDIDATES);
      }
      return ChatResponse.ofText("Please pick a number between 1 and " + count + ", or 0 to skip.");
    }
    if (!operations.isConfigured()) {
      return ChatResponse.ofText(ContactOperations.NOT_CONFIGURED);
    }

    Candidate candidate = chosen.get();
    try {
      String ack =
          operations.link(ref.meetingId(), ref.searchedName(), candidate.id(), candidate.name());
      return operations.complete(userId, step, ResolutionOutcome.LINKED, ack);
    } catch (ContactsClientException e) {
      log.warn(
          "Link failed for user {} on meeting {}: {}", userId, ref.meetingId(), e.getMessage());
      return ChatResponse.ofText(ContactOperations.CONTACTS_UNAVAILABLE);
    }
  }

  private ChatResponse searchOrCreate(String userId, DialogStep step, String name) {
    if (!operations.isConfigured()) {
      return ChatResponse.ofText(ContactOperations.NOT_CONFIGURED);
    }
    PendingReference ref = step.reference();
    try {
      List<Candidate> found =
          contacts.search(name).stream().map(ContactDialogService::toCandidate).toList();
      if (!found.isEmpty()) {
        log.info("Search '{}' for user {} returned {} candidates", name, userId, found.size());
        return queue
            .updateCandidatesIfCurrent(userId, step, found, name)
            .map(updated -> ChatResponse.of(renderer.prompt(userId, updated)))
            .orElseGet(() -> ChatResponse.ofText(ContactOperations.NO_LONGER_OPEN));
      }

      String ack = operations.create(ref.meetingId(), name);
      return operations.complete(userId, step, ResolutionOutcome.CREATED, ack);
    } catch (ContactsClientException e) {
      log.warn("Contact search/create failed for user {}: {}", userId, e.getMessage());
      return ChatResponse.ofText(ContactOperations.CONTACTS_UNAVAILABLE);
    }
  }

  private static boolean isNumber(String input) {
    if (input.isEmpty()) {
      return false;
    }
    for (int i = 0; i < input.length(); i++) {
      if (!Character.isDigit(input.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  static Candidate toCandidate(ContactItem item) {
    return new Candidate(item.id(), item.name(), item.company());
  }
}
