package com.ryuqq.rollups.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.ryuqq.rollups.core.statemachine.RunnerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RunnerStateTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunnerStateTransitionTest {

    @ParameterizedTest
    @CsvSource({
        "UNINITIALIZED, RECOVERING",
        "RECOVERING, STEADY",
        "RECOVERING, FAILED",
        "STEADY, FAILED",
        "STEADY, STOPPED"
    })
    void transition_AllowedTransitions_ReturnNextState(RunnerState from, RunnerState to) {
        assertEquals(to, RunnerStateTransition.transition(from, to));
    }

    @ParameterizedTest
    @CsvSource({
        "UNINITIALIZED, STEADY",
        "UNINITIALIZED, FAILED",
        "RECOVERING, STOPPED",
        "STEADY, RECOVERING",
        "STEADY, UNINITIALIZED"
    })
    void validate_ForbiddenTransitions_ThrowException(RunnerState from, RunnerState to) {
        assertThrows(IllegalStateException.class, () -> RunnerStateTransition.validate(from, to));
    }

    @Test
    void validate_FromTerminalState_ThrowsException() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> RunnerStateTransition.validate(FAILED, RECOVERING));
        assertTrue(exception.getMessage().contains("terminal"));

        assertThrows(IllegalStateException.class, () -> RunnerStateTransition.validate(STOPPED, STEADY));
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RunnerStateTransition.validate(null, STEADY));
        assertThrows(IllegalArgumentException.class, () -> RunnerStateTransition.validate(STEADY, null));
    }

    @Test
    void isTerminal_OnlyFailedAndStopped() {
        assertTrue(FAILED.isTerminal());
        assertTrue(STOPPED.isTerminal());
        assertFalse(UNINITIALIZED.isTerminal());
        assertFalse(RECOVERING.isTerminal());
        assertFalse(STEADY.isTerminal());
    }
}
