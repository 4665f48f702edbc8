package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.statemachine.InvocationStatus;

import java.time.Duration;
import java.util.List;

/**
 * 취소 결과.
 *
 * <p>Operation의 비동기 계산이 생산자에 의해 취소되었음을 나타냅니다.
 * "취소됨" 외의 추가 정보는 없습니다.</p>
 *
 * @param outputs 출력 인자
 * @param elapsed 경과 시간
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record Cancelled(
    List<Object> outputs,
    Duration elapsed
) implements InvocationOutcome {

    public Cancelled {
        outputs = InvocationOutcome.requireOutputs(outputs);
        elapsed = InvocationOutcome.requireElapsed(elapsed);
    }

    @Override
    public InvocationStatus status() {
        return InvocationStatus.CANCELLED;
    }
}
