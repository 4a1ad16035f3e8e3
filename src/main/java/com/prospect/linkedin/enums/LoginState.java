package com.prospect.linkedin.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single login attempt.
 * <p>
 * LOGGING_IN resolves to SUCCESS, LOGIN_FAILED or CHECKPOINT_CHALLENGE. A challenge is then refined into
 * EMAIL_VERIFICATION_PENDING (a one-time code was sent) or PERMANENT_CHECKPOINT. A pending verification
 * may stay pending (wrong code), succeed, or turn into a permanent checkpoint.
 */
public enum LoginState {
    LOGGING_IN,
    SUCCESS,
    LOGIN_FAILED,
    CHECKPOINT_CHALLENGE,
    EMAIL_VERIFICATION_PENDING,
    PERMANENT_CHECKPOINT;

    public Set<LoginState> nextStates() {
        return switch (this) {
            case LOGGING_IN -> EnumSet.of(SUCCESS, LOGIN_FAILED, CHECKPOINT_CHALLENGE);
            case CHECKPOINT_CHALLENGE -> EnumSet.of(EMAIL_VERIFICATION_PENDING, PERMANENT_CHECKPOINT);
            case EMAIL_VERIFICATION_PENDING -> EnumSet.of(SUCCESS, EMAIL_VERIFICATION_PENDING, PERMANENT_CHECKPOINT);
            default -> EnumSet.noneOf(LoginState.class);
        };
    }

    public boolean canTransitionTo(LoginState next) {
        return nextStates().contains(next);
    }

    /**
     * @throws IllegalStateException if {@code next} is not reachable from this state
     */
    public LoginState transitionTo(LoginState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal login transition " + this + " -> " + next);
        }
        return next;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == LOGIN_FAILED || this == PERMANENT_CHECKPOINT;
    }
}
