package com.jarvisbot.telegram.domain.dialog;

/**
 * One pending button press.
 *
 * <p>LINK, CREATE and SKIP remember the dialog step ({@code sessionId} + {@code position}) they
 * were rendered for, which stays the same when the user re-searches and the candidates change.
 * CORRECT belongs to no step and carries zeros there. {@code contactId}/{@code contactName} are set
 * for LINK and CORRECT only.
 */
public record CallbackAction(
    ActionKind kind,
    String userId,
    long sessionId,
    int position,
    String meetingId,
    String searchedName,
    String contactId,
    String contactName) {

  public static CallbackAction link(String userId, DialogStep step, Candidate candidate) {
    return forStep(ActionKind.LINK, userId, step, candidate);
  }

  public static CallbackAction create(String userId, DialogStep step) {
    return forStep(ActionKind.CREATE, userId, step, null);
  }

  public static CallbackAction skip(String userId, DialogStep step) {
    return forStep(ActionKind.SKIP, userId, step, null);
  }

  public static CallbackAction correct(
      String userId, String meetingId, String searchedName, Candidate candidate) {
    return new CallbackAction(
        ActionKind.CORRECT,
        userId,
        0,
        0,
        meetingId,
        searchedName,
        candidate.id(),
        candidate.name());
  }

  /** True if this action was rendered for the session and position of {@code step}. */
  public boolean targets(DialogStep step) {
    return step != null && sessionId == step.sessionId() && position == step.position();
  }

  private static CallbackAction forStep(
      ActionKind kind, String userId, DialogStep step, Candidate candidate) {
    PendingReference ref = step.reference();
    return new CallbackAction(
        kind,
        userId,
        step.sessionId(),
        step.position(),
        ref.meetingId(),
        ref.searchedName(),
        candidate == null ? null : candidate.id(),
        candidate == null ? null : candidate.name());
  }
}
