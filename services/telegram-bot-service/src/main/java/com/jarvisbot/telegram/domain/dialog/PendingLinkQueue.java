package com.jarvisbot.telegram.domain.dialog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-user queue of unresolved references with a cursor.
 *
 * <p>At most one session per user. Sessions never expire; they end when the last reference is
 * resolved, when the user cancels, or when a newer ingest event replaces them. All mutations go
 * through {@link ConcurrentMap#compute} on immutable session snapshots, so every method is atomic
 * per user. Callers that performed a network call after reading a step must use the {@code
 * ...IfCurrent} variants.
 */
@Service
@Slf4j
public class PendingLinkQueue {

  private final ConcurrentMap<String, PendingSession> sessions = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Long> ingestGenerations = new ConcurrentHashMap<>();
  private final AtomicLong sessionIds = new AtomicLong();

  /** Replaces any session of {@code userId}; returns the step for reference #1. */
  public Optional<DialogStep> startSession(String userId, List<PendingReference> references) {
    if (references == null || references.isEmpty()) {
      sessions.remove(userId);
      return Optional.empty();
    }
    PendingSession next = newSession(references);
    PendingSession previous = sessions.put(userId, next);
    if (previous != null) {
      log.info(
          "Session {} of user {} replaced at {}/{}",
          previous.id(),
          userId,
          previous.cursor() + 1,
          previous.references().size());
    }
    return Optional.of(next.step());
  }

  /**
   * Start of an ingest event: drops the user's open session and returns a generation number that
   * must be presented to {@link #startSessionIfLatest} when the analysis completes.
   */
  public long beginIngest(String userId) {
    long generation = ingestGenerations.merge(userId, 1L, Long::sum);
    PendingSession dropped = sessions.remove(userId);
    if (dropped != null) {
      log.info("New audio from user {} discards session {}", userId, dropped.id());
    }
    return generation;
  }

  /** Like {@link #startSession}, unless a newer ingest event for the user has begun since. */
  public Optional<DialogStep> startSessionIfLatest(
      String userId, long generation, List<PendingReference> references) {
    if (references == null || references.isEmpty()) {
      return Optional.empty();
    }
    PendingSession[] installed = {null};
    sessions.compute(
        userId,
        (k, old) -> {
          Long latest = ingestGenerations.get(userId);
          if (latest == null || latest != generation) {
            return old;
          }
          installed[0] = newSession(references);
          return installed[0];
        });
    if (installed[0] == null) {
      log.info(
          "Ingest generation {} of user {} superseded; no session started", generation, userId);
    }
    return Optional.ofNullable(installed[0]).map(PendingSession::step);
  }

  public Optional<PendingReference> current(String userId) {
    return currentStep(userId).map(DialogStep::reference);
  }

  public Optional<DialogStep> currentStep(String userId) {
    PendingSession s = sessions.get(userId);
    return s == null ? Optional.empty() : Optional.of(s.step());
  }

  public boolean hasSession(String userId) {
    return sessions.containsKey(userId);
  }

  /** Resolves whatever reference is current. */
  public Optional<DialogAdvance> resolve(String userId, ResolutionOutcome outcome) {
    return advance(userId, s -> true, outcome);
  }

  /** Resolves only if the session is still at {@code expected}. */
  public Optional<DialogAdvance> resolveIfCurrent(
      String userId, DialogStep expected, ResolutionOutcome outcome) {
    return advance(userId, s -> s.isAt(expected), outcome);
  }

  public Optional<DialogStep> updateCandidates(
      String userId, List<Candidate> candidates, String newSearchName) {
    return replaceCurrent(userId, s -> true, candidates, newSearchName);
  }

  public Optional<DialogStep> updateCandidatesIfCurrent(
      String userId, DialogStep expected, List<Candidate> candidates, String newSearchName) {
    return replaceCurrent(userId, s -> s.isAt(expected), candidates, newSearchName);
  }

  public boolean discard(String userId) {
    return sessions.remove(userId) != null;
  }

  private Optional<DialogAdvance> advance(
      String userId, Predicate<PendingSession> guard, ResolutionOutcome outcome) {
    DialogAdvance[] result = {null};
    sessions.computeIfPresent(
        userId,
        (k, s) -> {
          if (!guard.test(s)) {
            return s;
          }
          PendingReference resolved = s.references().get(s.cursor());
          Optional<PendingSession> next = s.advanced();
          result[0] = new DialogAdvance(resolved, outcome, next.map(PendingSession::step));
          // returning null removes the exhausted session
          return next.orElse(null);
        });
    return Optional.ofNullable(result[0]);
  }

  private Optional<DialogStep> replaceCurrent(
      String userId,
      Predicate<PendingSession> guard,
      List<Candidate> candidates,
      String newSearchName) {
    DialogStep[] result = {null};
    sessions.computeIfPresent(
        userId,
        (k, s) -> {
          if (!guard.test(s)) {
            return s;
          }
          PendingSession updated = s.withCurrent(candidates, newSearchName);
          result[0] = updated.step();
          return updated;
        });
    return Optional.ofNullable(result[0]);
  }

  private PendingSession newSession(List<PendingReference> references) {
    return new PendingSession(sessionIds.incrementAndGet(), List.copyOf(references), 0);
  }

  private record PendingSession(long id, List<PendingReference> references, int cursor) {

    DialogStep step() {
      return new DialogStep(id, references.get(cursor), cursor + 1, references.size());
    }

    boolean isAt(DialogStep expected) {
      return expected != null && expected.sessionId() == id && expected.position() == cursor + 1;
    }

    Optional<PendingSession> advanced() {
      int next = cursor + 1;
      if (next >= references.size()) {
        return Optional.empty();
      }
      return Optional.of(new PendingSession(id, references, next));
    }

    PendingSession withCurrent(List<Candidate> candidates, String newSearchName) {
      List<PendingReference> copy = new ArrayList<>(references);
      copy.set(cursor, references.get(cursor).withCandidates(candidates, newSearchName));
      return new PendingSession(id, List.copyOf(copy), cursor);
    }
  }
}
