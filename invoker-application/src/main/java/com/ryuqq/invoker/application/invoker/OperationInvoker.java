package com.ryuqq.invoker.application.invoker;

import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.InvocationRequest;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;

import java.util.concurrent.CompletionStage;

/**
 * 단일 BoundOperation에 대한 Invocation 실행자.
 *
 * <p>디스패처로부터 인자를 받아 대상 Operation을 호출하고, 결과를 네 가지 종료 상태
 * (Succeeded, Faulted, Cancelled, Failed) 중 하나로 정규화합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Object[] inputs = invoker.allocateInputs();
 * inputs[0] = "ORDER-1";
 * inputs[1] = Boolean.TRUE;
 *
 * invoker.invoke(service, inputs, CorrelationToken.of(activityId))
 *     .thenAccept(outcome -&gt; {
 *         if (outcome instanceof Succeeded succeeded) {
 *             reply(succeeded.returnValue(), succeeded.outputs());
 *         }
 *     });
 * </pre>
 *
 * <p><strong>동시성:</strong> 같은 Invoker를 여러 스레드에서 동시에 호출해도 안전합니다.
 * 각 호출은 독립적인 입력/출력/결과 상태를 가집니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public interface OperationInvoker {

    /**
     * 이 Invoker가 호출하는 Operation.
     *
     * @return BoundOperation
     */
    BoundOperation operation();

    /**
     * 입력 버퍼 할당.
     *
     * <p>입력 슬롯 수 크기로, 각 슬롯의 기본값으로 채워진 새 배열을 반환합니다.</p>
     *
     * @return 입력 버퍼
     */
    Object[] allocateInputs();

    /**
     * Operation 호출.
     *
     * <p>디스패치 전 검증(대상 인스턴스, 입력 개수)에 실패하면 대상을 호출하지 않고
     * 이미 완료된 Failed 결과를 반환합니다. 즉시 정산되는 Operation도 이미 완료된
     * stage를 반환하며, 비동기 Operation만 정산 시점에 완료되는 stage를 반환합니다.</p>
     *
     * <p>반환된 stage는 예외로 완료되지 않습니다. 모든 실패는 {@link InvocationOutcome}으로 표현됩니다.</p>
     *
     * @param instance 대상 인스턴스
     * @param inputs 입력 인자 (입력 슬롯이 0개일 때만 null 허용)
     * @param correlationToken 호출자 토큰 (null이면 {@link CorrelationToken#none()})
     * @return 종료 결과 stage
     */
    CompletionStage<InvocationOutcome> invoke(Object instance, Object[] inputs, CorrelationToken correlationToken);

    /**
     * InvocationRequest로 Operation 호출.
     *
     * @param request 요청
     * @return 종료 결과 stage
     * @throws IllegalArgumentException request가 null인 경우
     */
    default CompletionStage<InvocationOutcome> invoke(InvocationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return invoke(request.instance(), request.inputs(), request.correlationToken());
    }
}
