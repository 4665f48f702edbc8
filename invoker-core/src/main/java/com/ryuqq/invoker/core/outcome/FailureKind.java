package com.ryuqq.invoker.core.outcome;

/**
 * {@link Failed} 결과의 실패 종류.
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 입력 인자 개수가 선언된 입력 슬롯 수와 다름 (디스패치 전 검출).
     */
    ARGUMENT_MISMATCH,

    /**
     * 대상 인스턴스가 null (디스패치 전 검출).
     */
    INVALID_STATE,

    /**
     * 대상 Operation 또는 Invoker 기계장치에서 발생한 그 밖의 모든 오류.
     */
    INFRASTRUCTURE
}
