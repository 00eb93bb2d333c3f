package com.jarvisbot.telegram.domain.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarvisbot.telegram.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ConversationHistoryStoreTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

  @Test
  void keepsOnlyTheNewestMessages() {
    ConversationHistoryStore store = new ConversationHistoryStore(4, Duration.ofMinutes(30), clock);

    store.appendExchange("u1", "q1", "a1");
    store.appendExchange("u1", "q2", "a2");
    store.appendExchange("u1", "q3", "a3");

    assertThat(store.recent("u1"))
        .extracting(ConversationTurn::content)
        .containsExactly("q2", "a2", "q3", "a3");
  }

  @Test
  void dropsTurnsOlderThanMaxAge() {
    ConversationHistoryStore store = new ConversationHistoryStore(20, Duration.ofMinutes(30),
        clock);
    store.appendExchange("u1", "old", "old-reply");
    clock.advance(Duration.ofMinutes(20));
    store.appendExchange("u1", "new", "new-reply");
    clock.advance(Duration.ofMinutes(15));

    assertThat(store.recent("u1")).extracting(ConversationTurn::content).containsExactly("new",
        "new-reply");

    clock.advance(Duration.ofMinutes(20));
    assertThat(store.recent("u1")).isEmpty();
  }

  @Test
  void rolesAlternateUserThenAssistant() {
    ConversationHistoryStore store = new ConversationHistoryStore(20, Duration.ofMinutes(30),
        clock);
    store.appendExchange("u1", "hi", "hello");

    assertThat(store.recent("u1"))
        .extracting(t -> t.role().wireName())
        .containsExactly("user", "assistant");
    assertThat(store.recent("u2")).isEmpty();
  }
}
