package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.contract.BusinessFault;
import com.ryuqq.invoker.core.statemachine.InvocationStatus;

import java.time.Duration;
import java.util.List;

/**
 * 비즈니스 Fault 결과.
 *
 * <p>대상 Operation이 던진 {@link BusinessFault}를 감싸지 않고 그대로 보관합니다.</p>
 *
 * @param fault 원본 비즈니스 Fault
 * @param outputs 출력 인자
 * @param elapsed 경과 시간
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record Faulted(
    BusinessFault fault,
    List<Object> outputs,
    Duration elapsed
) implements InvocationOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fault가 null이거나 공통 필드가 유효하지 않은 경우
     */
    public Faulted {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
        outputs = InvocationOutcome.requireOutputs(outputs);
        elapsed = InvocationOutcome.requireElapsed(elapsed);
    }

    @Override
    public InvocationStatus status() {
        return InvocationStatus.FAULTED;
    }
}
