package com.ryuqq.invoker.application.completion;

/**
 * Legacy begin/end 프로토콜의 완료 콜백.
 *
 * <p>Invocation 결과가 준비되면 정확히 한 번 호출됩니다. 콜백 안에서
 * {@link CompletionInvoker#endInvoke(PendingInvocation)}를 호출하면 블로킹 없이 결과를 얻습니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionCallback {

    /**
     * 완료 알림.
     *
     * @param invocation 완료된 PendingInvocation
     */
    void onComplete(PendingInvocation invocation);
}
