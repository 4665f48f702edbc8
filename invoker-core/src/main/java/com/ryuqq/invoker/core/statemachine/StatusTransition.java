package com.ryuqq.invoker.core.statemachine;

/**
 * Invocation 상태 전이 검증 및 실행.
 *
 * <p>Invocation은 PENDING에서 정확히 하나의 종료 상태로 정확히 한 번 전이합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>PENDING → PENDING 전이 불가</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(InvocationStatus from, InvocationStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static InvocationStatus transition(InvocationStatus current, InvocationStatus next) {
        validate(current, next);
        return next;
    }
}
