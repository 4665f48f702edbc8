package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.statemachine.InvocationStatus;

import java.time.Duration;
import java.util.List;

/**
 * 실패 결과.
 *
 * <p>디스패치 전 검증 실패(ARGUMENT_MISMATCH, INVALID_STATE) 또는
 * 대상 Operation/브리지 기계장치의 인프라 실패(INFRASTRUCTURE)를 나타냅니다.</p>
 *
 * @param failure Operation 이름 컨텍스트가 포함된 실패 예외 (원인 보존)
 * @param outputs 출력 인자
 * @param elapsed 경과 시간
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record Failed(
    InvocationException failure,
    List<Object> outputs,
    Duration elapsed
) implements InvocationOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failure가 null이거나 공통 필드가 유효하지 않은 경우
     */
    public Failed {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        outputs = InvocationOutcome.requireOutputs(outputs);
        elapsed = InvocationOutcome.requireElapsed(elapsed);
    }

    /**
     * 실패 종류 조회.
     *
     * @return FailureKind
     */
    public FailureKind kind() {
        return failure.getKind();
    }

    @Override
    public InvocationStatus status() {
        return InvocationStatus.FAILED;
    }
}
