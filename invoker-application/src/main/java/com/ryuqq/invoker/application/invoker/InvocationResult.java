package com.ryuqq.invoker.application.invoker;

import com.ryuqq.invoker.core.outcome.Succeeded;

import java.util.List;

/**
 * 성공한 Invocation의 (반환값, 출력 인자) 쌍.
 *
 * <p>Legacy Completion Bridge의 {@code endInvoke}가 반환합니다.</p>
 *
 * @param returnValue 반환값 (Operation이 값을 선언하지 않았으면 null)
 * @param outputs 출력 인자 (불변)
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record InvocationResult(
    Object returnValue,
    List<Object> outputs
) {

    public InvocationResult {
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null");
        }
    }

    /**
     * Succeeded 결과로부터 생성.
     *
     * @param succeeded 성공 결과
     * @return InvocationResult
     */
    public static InvocationResult from(Succeeded succeeded) {
        return new InvocationResult(succeeded.returnValue(), succeeded.outputs());
    }
}
