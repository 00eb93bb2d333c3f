package com.jarvisbot.telegram.domain.dialog;

import java.util.List;
import java.util.Optional;

/**
 * One unresolved person mention from an ingest event.
 *
 * <p>Only the candidate list (and the search term that produced it) ever changes; that happens by
 * replacing the instance through {@link #withCandidates}.
 */
public record PendingReference(
    String meetingId, String searchedName, List<Candidate> candidates, ResolutionMode mode) {

  public static final int MAX_CANDIDATES = 5;

  public PendingReference {
    candidates = cap(candidates);
    mode = mode == null ? ResolutionMode.LINK_OR_CREATE : mode;
  }

  public static PendingReference of(
      String meetingId, String searchedName, List<Candidate> candidates) {
    return new PendingReference(meetingId, searchedName, candidates, ResolutionMode.LINK_OR_CREATE);
  }

  public PendingReference withCandidates(List<Candidate> next, String newSearchName) {
    String name = newSearchName == null || newSearchName.isBlank() ? searchedName : newSearchName;
    return new PendingReference(meetingId, name, next, mode);
  }

  /** 1-indexed lookup; empty outside {@code [1, candidates().size()]}. */
  public Optional<Candidate> candidateAt(int position) {
    if (position < 1 || position > candidates.size()) {
      return Optional.empty();
    }
    return Optional.of(candidates.get(position - 1));
  }

  private static List<Candidate> cap(List<Candidate> in) {
    if (in == null || in.isEmpty()) {
      return List.of();
    }
    return List.copyOf(in.size() > MAX_CANDIDATES ? in.subList(0, MAX_CANDIDATES) : in);
  }
}
