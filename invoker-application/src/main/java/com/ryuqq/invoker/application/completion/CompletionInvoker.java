package com.ryuqq.invoker.application.completion;

import com.ryuqq.invoker.application.invoker.InvocationResult;
import com.ryuqq.invoker.core.model.CorrelationToken;

/**
 * Legacy begin/end 완료 프로토콜.
 *
 * <p>직접적인 일시 중단(CompletionStage)을 사용할 수 없는 호출자를 위한 2단계 API입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PendingInvocation pending = bridge.beginInvoke(service, inputs, token,
 *     completed -&gt; {
 *         try {
 *             InvocationResult result = bridge.endInvoke(completed);
 *             reply(result.returnValue(), result.outputs());
 *         } catch (BusinessFault fault) {
 *             replyFault(fault);
 *         }
 *     }, requestState);
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public interface CompletionInvoker {

    /**
     * Invocation 시작.
     *
     * <p>대상 Operation이 일시 중단되었는지와 관계없이, 결과가 준비되는 시점에
     * onComplete를 정확히 한 번 스케줄링합니다.</p>
     *
     * @param instance 대상 인스턴스
     * @param inputs 입력 인자
     * @param correlationToken 호출자 토큰 (null이면 none)
     * @param onComplete 완료 콜백 (null 가능)
     * @param asyncState 호출자 상태 (null 가능, {@link PendingInvocation#getAsyncState()}로 조회)
     * @return PendingInvocation 토큰
     */
    PendingInvocation beginInvoke(Object instance, Object[] inputs, CorrelationToken correlationToken,
                                  CompletionCallback onComplete, Object asyncState);

    /**
     * Invocation 종료 및 결과 조회.
     *
     * <p>토큰당 정확히 한 번 호출해야 합니다. 아직 완료되지 않았다면 완료될 때까지
     * 호출 스레드를 블로킹합니다.</p>
     *
     * @param pending beginInvoke가 반환한 토큰
     * @return (반환값, 출력 인자)
     * @throws com.ryuqq.invoker.core.contract.BusinessFault Faulted인 경우 원본 Fault
     * @throws java.util.concurrent.CancellationException Cancelled인 경우
     * @throws com.ryuqq.invoker.core.outcome.InvocationException Failed인 경우
     * @throws IllegalArgumentException 다른 브리지가 발급한 토큰인 경우
     * @throws IllegalStateException 같은 토큰으로 두 번 이상 호출한 경우
     */
    InvocationResult endInvoke(PendingInvocation pending);
}
