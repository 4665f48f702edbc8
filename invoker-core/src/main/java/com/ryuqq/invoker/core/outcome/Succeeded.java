package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.statemachine.InvocationStatus;

import java.time.Duration;
import java.util.List;

/**
 * 성공 결과.
 *
 * <p>Operation이 정상적으로 정산되었음을 나타냅니다. returnValue는 Operation이
 * 반환값을 선언한 경우({@code VALUE}, {@code ASYNC_VALUE})에만 채워지며,
 * 그 외에는 항상 null입니다.</p>
 *
 * @param returnValue 반환값 (null 가능)
 * @param outputs 출력 인자
 * @param elapsed 경과 시간
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record Succeeded(
    Object returnValue,
    List<Object> outputs,
    Duration elapsed
) implements InvocationOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException outputs 또는 elapsed가 유효하지 않은 경우
     */
    public Succeeded {
        // returnValue는 null 허용
        outputs = InvocationOutcome.requireOutputs(outputs);
        elapsed = InvocationOutcome.requireElapsed(elapsed);
    }

    @Override
    public InvocationStatus status() {
        return InvocationStatus.SUCCEEDED;
    }
}
