package com.jarvisbot.telegram.domain.dialog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jarvisbot.telegram.config.DialogProperties;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Short opaque tokens for inline buttons, consumed at most once.
 *
 * <p>The sequence is process-wide and never reused. Entries are bounded by size and age; an
 * evicted token behaves exactly like a consumed one.
 */
@Service
public class CallbackActionRegistry {

  private final AtomicLong sequence = new AtomicLong();
  private final Cache<String, CallbackAction> actions;

  @Autowired
  public CallbackActionRegistry(DialogProperties properties) {
    this(properties.actions().maxSize(), properties.actions().ttl());
  }

  public CallbackActionRegistry(long maxSize, Duration ttl) {
    this.actions = Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(ttl).build();
  }

  public ActionToken register(CallbackAction action) {
    ActionToken token = new ActionToken(action.kind(), sequence.incrementAndGet());
    actions.put(token.encode(), action);
    return token;
  }

  /** Atomically removes and returns the action; empty if unknown, consumed or evicted. */
  public Optional<CallbackAction> consume(ActionToken token) {
    return Optional.ofNullable(actions.asMap().remove(token.encode()));
  }
}
