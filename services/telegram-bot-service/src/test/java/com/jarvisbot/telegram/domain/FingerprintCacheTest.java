package com.jarvisbot.telegram.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.jarvisbot.telegram.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FingerprintCacheTest {

  private MutableClock clock;
  private FingerprintCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    cache = new FingerprintCache(Duration.ofSeconds(300), clock);
  }

  @Test
  void firstSighting_isNotDuplicate_secondWithinWindow_is() {
    assertThat(cache.seen("F1")).isFalse();
    clock.advance(Duration.ofSeconds(299));
    assertThat(cache.seen("F1")).isTrue();
  }

  @Test
  void afterWindow_idIsAcceptedAgain() {
    assertThat(cache.seen("F1")).isFalse();
    clock.advance(Duration.ofSeconds(300));
    assertThat(cache.seen("F1")).isFalse();
    assertThat(cache.seen("F1")).isTrue();
  }

  @Test
  void duplicateDoesNotExtendWindow() {
    cache.seen("F1");
    clock.advance(Duration.ofSeconds(200));
    assertThat(cache.seen("F1")).isTrue();
    clock.advance(Duration.ofSeconds(100));
    assertThat(cache.seen("F1")).isFalse();
  }

  @Test
  void everyCallEvictsExpiredEntries() {
    cache.seen("F1");
    cache.seen("F2");
    clock.advance(Duration.ofMinutes(6));
    cache.seen("F3");
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void distinctIdsAreIndependent() {
    assertThat(cache.seen("F1")).isFalse();
    assertThat(cache.seen("F2")).isFalse();
  }
}
