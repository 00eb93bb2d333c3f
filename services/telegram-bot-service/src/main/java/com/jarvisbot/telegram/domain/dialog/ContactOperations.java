package com.jarvisbot.telegram.domain.dialog;

import com.jarvisbot.telegram.client.ContactsClient;
import com.jarvisbot.telegram.client.dto.ContactDtos.CreateResponse;
import com.jarvisbot.telegram.client.dto.ContactDtos.LinkResponse;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.render.PromptRenderer;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Remote contact operations shared by typed answers and button presses.
 *
 * <p>Methods here call the contacts service without holding any store lock, then advance the
 * session only if it still sits at the step the caller read beforehand.
 */
@Component
@Slf4j
public class ContactOperations {

  static final String NOT_CONFIGURED = "⚙️ Contact linking is not configured.";
  static final String CONTACTS_UNAVAILABLE =
      "⚠️ The contacts service is not responding. Please try again in a moment.";
  static final String NO_LONGER_OPEN = "That question is no longer open.";

  private final ContactsClient contacts;
  private final PendingLinkQueue queue;
  private final PromptRenderer renderer;

  public ContactOperations(
      ContactsClient contacts, PendingLinkQueue queue, PromptRenderer renderer) {
    this.contacts = contacts;
    this.queue = queue;
    this.renderer = renderer;
  }

  public boolean isConfigured() {
    return contacts.isConfigured();
  }

  /** Links {@code contactId} to the meeting; returns the acknowledgement text. */
  public String link(String meetingId, String searchedName, String contactId, String contactName) {
    LinkResponse res = contacts.link(meetingId, contactId);
    log.info("Linked '{}' on meeting {} to contact {}", searchedName, meetingId, contactId);
    String company = res.company();
    String label =
        company == null || company.isBlank() ? contactName : contactName + " (" + company + ")";
    return "✅ Linked \"" + searchedName + "\" to " + label + ".";
  }

  /** Creates a contact named {@code fullName} on the meeting; returns the acknowledgement text. */
  public String create(String meetingId, String fullName) {
    NameParts parts = NameParts.split(fullName);
    CreateResponse res = contacts.create(parts.firstName(), parts.lastName(), meetingId);
    String name = res.name() == null || res.name().isBlank() ? parts.full() : res.name();
    return "➕ Created contact " + name + " and linked it.";
  }

  /**
   * Resolves {@code expected} if it is still current and renders what follows; when the session
   * moved on meanwhile only the acknowledgement is returned.
   */
  public ChatResponse complete(
      String userId, DialogStep expected, ResolutionOutcome outcome, String acknowledgement) {
    Optional<DialogAdvance> advance = queue.resolveIfCurrent(userId, expected, outcome);
    if (advance.isEmpty()) {
      log.info("Session of user {} moved on; {} reported without advancing", userId, outcome);
      return ChatResponse.ofText(acknowledgement);
    }
    return renderer.afterResolution(userId, acknowledgement, advance.get().next());
  }

  /** First whitespace-separated token is the first name, the remainder the last name. */
  record NameParts(String firstName, String lastName) {

    static NameParts split(String fullName) {
      String trimmed = fullName == null ? "" : fullName.trim();
      String[] tokens = trimmed.split("\\s+", 2);
      String last = tokens.length > 1 ? tokens[1].trim() : "";
      return new NameParts(tokens[0], last);
    }

    String full() {
      return lastName.isEmpty() ? firstName : firstName + " " + lastName;
    }
  }
}
