package com.jarvisbot.telegram.domain.dialog;

/**
 * Snapshot of the reference at a session's cursor.
 *
 * <p>{@code sessionId} and {@code position} let a caller that released the store across a network
 * call check that the session still sits at the same step before mutating it.
 */
public record DialogStep(long sessionId, PendingReference reference, int position, int total) {}
