package com.prospect.linkedin.enums;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoginStateTest {

    @Test
    void loggingInResolvesToThreeOutcomes() {
        assertThat(LoginState.LOGGING_IN.nextStates())
                .containsExactlyInAnyOrder(LoginState.SUCCESS, LoginState.LOGIN_FAILED, LoginState.CHECKPOINT_CHALLENGE);
    }

    @Test
    void challengeRefinesToPendingOrPermanent() {
        assertThat(LoginState.CHECKPOINT_CHALLENGE.nextStates())
                .containsExactlyInAnyOrder(LoginState.EMAIL_VERIFICATION_PENDING, LoginState.PERMANENT_CHECKPOINT);
    }

    @Test
    void pendingMayStayPending() {
        assertThat(LoginState.EMAIL_VERIFICATION_PENDING.transitionTo(LoginState.EMAIL_VERIFICATION_PENDING))
                .isEqualTo(LoginState.EMAIL_VERIFICATION_PENDING);
    }

    @Test
    void illegalTransitionThrows() {
        assertThatThrownBy(() -> LoginState.LOGGING_IN.transitionTo(LoginState.PERMANENT_CHECKPOINT))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> LoginState.EMAIL_VERIFICATION_PENDING.transitionTo(LoginState.LOGIN_FAILED))
                .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = LoginState.class, names = {"SUCCESS", "LOGIN_FAILED", "PERMANENT_CHECKPOINT"})
    void terminalStatesHaveNoExits(LoginState state) {
        assertThat(state.isTerminal()).isTrue();
        assertThat(state.nextStates()).isEmpty();
    }
}
