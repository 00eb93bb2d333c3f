package com.jarvisbot.telegram.domain;

import com.jarvisbot.telegram.config.DialogProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drops repeat deliveries of the same physical file.
 *
 * <p>Best effort only: the map lives in memory, so a restart forgets every fingerprint.
 */
@Service
public class FingerprintCache {

  private final ConcurrentMap<String, Instant> firstSeen = new ConcurrentHashMap<>();
  private final Duration window;
  private final Clock clock;

  @Autowired
  public FingerprintCache(DialogProperties properties, Clock clock) {
    this(properties.dedupWindow(), clock);
  }

  public FingerprintCache(Duration window, Clock clock) {
    this.window = window == null ? Duration.ofMinutes(5) : window;
    this.clock = clock;
  }

  /**
   * @return true if {@code fileId} was already seen within the window; otherwise records it and
   *     returns false
   */
  public boolean seen(String fileId) {
    Instant now = clock.instant();
    firstSeen.entrySet().removeIf(e -> isExpired(e.getValue(), now));

    boolean[] duplicate = {false};
    firstSeen.compute(
        fileId,
        (k, old) -> {
          if (old != null && !isExpired(old, now)) {
            duplicate[0] = true;
            return old;
          }
          return now;
        });
    return duplicate[0];
  }

  int size() {
    return firstSeen.size();
  }

  private boolean isExpired(Instant seenAt, Instant now) {
    return !seenAt.plus(window).isAfter(now);
  }
}
