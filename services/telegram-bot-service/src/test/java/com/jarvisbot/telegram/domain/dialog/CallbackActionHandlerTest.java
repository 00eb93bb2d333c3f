package com.jarvisbot.telegram.domain.dialog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jarvisbot.telegram.client.ContactsClient;
import com.jarvisbot.telegram.client.ContactsClientException;
import com.jarvisbot.telegram.client.dto.ContactDtos.ContactItem;
import com.jarvisbot.telegram.client.dto.ContactDtos.CreateResponse;
import com.jarvisbot.telegram.client.dto.ContactDtos.LinkResponse;
import com.jarvisbot.telegram.model.ChatResponse;
import com.jarvisbot.telegram.model.OutgoingMessage;
import com.jarvisbot.telegram.render.PromptRenderer;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CallbackActionHandlerTest {

  private static final Candidate JON_LEE = new Candidate("c1", "Jon Lee", null);

  private ContactsClient contacts;
  private CallbackActionRegistry registry;
  private PendingLinkQueue queue;
  private PromptRenderer renderer;
  private ContactOperations operations;
  private CallbackActionHandler handler;

  @BeforeEach
  void setUp() {
    contacts = mock(ContactsClient.class);
    when(contacts.isConfigured()).thenReturn(true);
    registry = new CallbackActionRegistry(1000, Duration.ofHours(1));
    queue = new PendingLinkQueue();
    renderer = new PromptRenderer(registry);
    operations = new ContactOperations(contacts, queue, renderer);
    handler = new CallbackActionHandler(registry, queue, operations);
  }

  private static List<String> texts(ChatResponse response) {
    return response.messages().stream().map(OutgoingMessage::text).toList();
  }

  private DialogStep start(PendingReference... references) {
    return queue.startSession("u1", List.of(references)).orElseThrow();
  }

  @Test
  void linkButton_linksAdvancesAndExpires() {
    DialogStep step = start(PendingReference.of("m1", "Jon", List.of(JON_LEE)));
    when(contacts.link("m1", "c1")).thenReturn(new LinkResponse("ok", null));
    String token = registry.register(CallbackAction.link("u1", step, JON_LEE)).encode();

    ChatResponse first = handler.handle("u1", token);
    ChatResponse second = handler.handle("u1", token);

    assertThat(texts(first))
        .containsExactly("✅ Linked \"Jon\" to Jon Lee.", PromptRenderer.COMPLETED);
    assertThat(queue.hasSession("u1")).isFalse();
    assertThat(texts(second)).containsExactly(CallbackActionHandler.EXPIRED);
    verify(contacts, times(1)).link("m1", "c1");
  }

  @Test
  void earlierLinkButton_afterNewSearch_stillAdvancesSession() {
    DialogStep step = start(PendingReference.of("m1", "Jon", List.of(JON_LEE)));
    OutgoingMessage prompt = renderer.prompt("u1", step);
    String jonLeeButton = prompt.keyboard().rows().get(0).get(0).callbackData();
    when(contacts.search("Jo")).thenReturn(List.of(new ContactItem("c9", "Joanna", null)));
    when(contacts.link("m1", "c1")).thenReturn(new LinkResponse("ok", null));
    new ContactDialogService(queue, contacts, operations, renderer).handle("u1", "Jo");
    assertThat(queue.current("u1")).map(PendingReference::searchedName).contains("Jo");

    ChatResponse response = handler.handle("u1", jonLeeButton);

    assertThat(texts(response))
        .containsExactly("✅ Linked \"Jon\" to Jon Lee.", PromptRenderer.COMPLETED);
    assertThat(queue.hasSession("u1")).isFalse();
    verify(contacts, times(1)).link("m1", "c1");
  }

  @Test
  void malformedOrUnknownToken_isExpired() {
    assertThat(texts(handler.handle("u1", "garbage")))
        .containsExactly(CallbackActionHandler.EXPIRED);
    assertThat(texts(handler.handle("u1", "l424242")))
        .containsExactly(CallbackActionHandler.EXPIRED);
  }

  @Test
  void skipButton_forOtherStep_doesNotAdvance() {
    DialogStep first =
        start(
            PendingReference.of("m1", "Ann", List.of()),
            PendingReference.of("m1", "Bob", List.of()));
    DialogStep second =
        new DialogStep(first.sessionId(), PendingReference.of("m1", "Bob", List.of()), 2, 2);
    String stale = registry.register(CallbackAction.skip("u1", second)).encode();

    ChatResponse response = handler.handle("u1", stale);

    assertThat(texts(response)).containsExactly(ContactOperations.NO_LONGER_OPEN);
    assertThat(queue.current("u1")).map(PendingReference::searchedName).contains("Ann");
  }

  @Test
  void linkButton_fromReplacedSession_reportsLinkWithoutAdvancing() {
    DialogStep old = start(PendingReference.of("m1", "Jon", List.of(JON_LEE)));
    String token = registry.register(CallbackAction.link("u1", old, JON_LEE)).encode();
    start(PendingReference.of("m2", "Jon", List.of(JON_LEE)));
    when(contacts.link("m1", "c1")).thenReturn(new LinkResponse("ok", null));

    ChatResponse response = handler.handle("u1", token);

    assertThat(texts(response)).containsExactly("✅ Linked \"Jon\" to Jon Lee.");
    assertThat(queue.current("u1")).map(PendingReference::meetingId).contains("m2");
  }

  @Test
  void createButton_createsFromSearchedName() {
    DialogStep step =
        start(
            PendingReference.of("m1", "Jon Snow", List.of()),
            PendingReference.of("m1", "Ann", List.of()));
    when(contacts.create("Jon", "Snow", "m1")).thenReturn(new CreateResponse("c5", "Jon Snow"));
    String token = registry.register(CallbackAction.create("u1", step)).encode();

    ChatResponse response = handler.handle("u1", token);

    assertThat(texts(response).get(0)).isEqualTo("➕ Created contact Jon Snow and linked it.");
    assertThat(texts(response).get(1)).startsWith("❓ Who is \"Ann\"? (2/2)");
  }

  @Test
  void correctButton_relinksWithoutTouchingSession() {
    start(PendingReference.of("m1", "Bob", List.of()));
    when(contacts.link("m1", "c7")).thenReturn(new LinkResponse("ok", null));
    Candidate annJones = new Candidate("c7", "Ann Jones", null);
    String token = registry.register(CallbackAction.correct("u1", "m1", "Ann", annJones)).encode();

    ChatResponse response = handler.handle("u1", token);

    assertThat(texts(response)).containsExactly("🔁 Relinked \"Ann\" to Ann Jones.");
    assertThat(queue.current("u1")).map(PendingReference::searchedName).contains("Bob");
  }

  @Test
  void contactsFailure_asksToRetryByText() {
    DialogStep step = start(PendingReference.of("m1", "Jon", List.of(JON_LEE)));
    when(contacts.link("m1", "c1")).thenThrow(new ContactsClientException("timeout"));
    String token = registry.register(CallbackAction.link("u1", step, JON_LEE)).encode();

    ChatResponse response = handler.handle("u1", token);

    assertThat(texts(response)).containsExactly(CallbackActionHandler.RETRY_BY_TEXT);
    assertThat(queue.hasSession("u1")).isTrue();
  }

  @Test
  void buttonOfAnotherUser_isRejected() {
    DialogStep step = start(PendingReference.of("m1", "Jon", List.of(JON_LEE)));
    String token = registry.register(CallbackAction.link("u2", step, JON_LEE)).encode();

    assertThat(texts(handler.handle("u1", token))).containsExactly(CallbackActionHandler.EXPIRED);
    verify(contacts, never()).link(anyString(), anyString());
  }
}
