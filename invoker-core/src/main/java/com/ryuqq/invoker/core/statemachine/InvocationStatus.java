package com.ryuqq.invoker.core.statemachine;

/**
 * Invocation 결과 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → SUCCEEDED (정상 완료)</li>
 *   <li>PENDING → FAULTED (비즈니스 Fault)</li>
 *   <li>PENDING → CANCELLED (취소)</li>
 *   <li>PENDING → FAILED (인프라 실패)</li>
 *   <li><strong>종료 상태에서는 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 *            ┌─► SUCCEEDED
 *            ├─► FAULTED
 * PENDING ───┤
 *            ├─► CANCELLED
 *            └─► FAILED
 * </pre>
 *
 * <p>PENDING은 비동기 Operation을 기다리는 동안에만 일시적으로 존재합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public enum InvocationStatus {

    /**
     * 대기 중 (비동기 결과 정산 전).
     */
    PENDING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 비즈니스 Fault.
     */
    FAULTED,

    /**
     * 취소됨.
     */
    CANCELLED,

    /**
     * 인프라 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return PENDING이 아니면 true
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}
