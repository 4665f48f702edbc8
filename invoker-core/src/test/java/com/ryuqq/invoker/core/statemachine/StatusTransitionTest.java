package com.ryuqq.invoker.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * <p>PENDING에서 종료 상태로의 단일 전환만 허용되는지 검증합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    @ParameterizedTest
    @EnumSource(value = InvocationStatus.class, names = {"SUCCEEDED", "FAULTED", "CANCELLED", "FAILED"})
    void transition_PendingToTerminal_Allowed(InvocationStatus terminal) {
        assertEquals(terminal, StatusTransition.transition(InvocationStatus.PENDING, terminal));
    }

    @Test
    void transition_PendingToPending_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StatusTransition.validate(InvocationStatus.PENDING, InvocationStatus.PENDING)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @ParameterizedTest
    @EnumSource(value = InvocationStatus.class, names = {"SUCCEEDED", "FAULTED", "CANCELLED", "FAILED"})
    void transition_FromTerminal_ThrowsException(InvocationStatus terminal) {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StatusTransition.validate(terminal, InvocationStatus.FAILED)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void transition_NullStates_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> StatusTransition.validate(null, InvocationStatus.SUCCEEDED));
        assertThrows(IllegalArgumentException.class,
            () -> StatusTransition.validate(InvocationStatus.PENDING, null));
    }

    @Test
    void isTerminal_OnlyPendingIsNotTerminal() {
        for (InvocationStatus status : InvocationStatus.values()) {
            assertEquals(status != InvocationStatus.PENDING, status.isTerminal(), status.name());
        }
    }
}
