/**
 * Legacy begin/end completion protocol.
 *
 * <p>For callers that consume results through a callback plus a blocking {@code endInvoke}
 * instead of composing on a {@link java.util.concurrent.CompletionStage}.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.invoker.application.completion.CompletionInvoker} - beginInvoke / endInvoke port</li>
 *   <li>{@link com.ryuqq.invoker.application.completion.PendingInvocation} - Token returned by beginInvoke</li>
 *   <li>{@link com.ryuqq.invoker.application.completion.CompletionCallback} - Scheduled exactly once on completion</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
package com.ryuqq.invoker.application.completion;
