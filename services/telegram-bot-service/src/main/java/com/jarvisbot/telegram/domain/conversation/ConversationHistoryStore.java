package com.jarvisbot.telegram.domain.conversation;

import com.jarvisbot.telegram.config.ConversationProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** In-memory chat history per user, capped by message count and by age. */
@Service
public class ConversationHistoryStore {

  private final ConcurrentMap<String, List<ConversationTurn>> histories = new ConcurrentHashMap<>();
  private final int maxMessages;
  private final Duration maxAge;
  private final Clock clock;

  @Autowired
  public ConversationHistoryStore(ConversationProperties properties, Clock clock) {
    this(properties.maxHistoryMessages(), properties.historyMaxAge(), clock);
  }

  public ConversationHistoryStore(int maxMessages, Duration maxAge, Clock clock) {
    this.maxMessages = maxMessages > 0 ? maxMessages : 20;
    this.maxAge = maxAge == null ? Duration.ofMinutes(30) : maxAge;
    this.clock = clock;
  }

  /** Turns still within the age limit, oldest first. */
  public List<ConversationTurn> recent(String userId) {
    Instant now = clock.instant();
    List<ConversationTurn> kept =
        histories.computeIfPresent(userId, (k, turns) -> trim(turns, now));
    return kept == null ? List.of() : kept;
  }

  /** Appends a completed exchange; both turns or neither. */
  public void appendExchange(String userId, String userText, String assistantText) {
    Instant now = clock.instant();
    histories.compute(
        userId,
        (k, turns) -> {
          List<ConversationTurn> next = new ArrayList<>(turns == null ? List.of() : turns);
          next.add(new ConversationTurn(ConversationTurn.Role.USER, userText, now));
          next.add(new ConversationTurn(ConversationTurn.Role.ASSISTANT, assistantText, now));
          return trim(next, now);
        });
  }

  private List<ConversationTurn> trim(List<ConversationTurn> turns, Instant now) {
    Instant cutoff = now.minus(maxAge);
    List<ConversationTurn> fresh =
        turns.stream().filter(t -> t.at().isAfter(cutoff)).toList();
    if (fresh.isEmpty()) {
      // null removes the map entry
      return null;
    }
    int from = Math.max(0, fresh.size() - maxMessages);
    return List.copyOf(fresh.subList(from, fresh.size()));
  }
}
