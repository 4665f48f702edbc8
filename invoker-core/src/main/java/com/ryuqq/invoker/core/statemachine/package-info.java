/**
 * Invocation status state machine.
 *
 * <p>{@code PENDING} is the only initial state; {@code SUCCEEDED}, {@code FAULTED},
 * {@code CANCELLED} and {@code FAILED} are terminal. Exactly one transition happens per invocation.</p>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.statemachine;
