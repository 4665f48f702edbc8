/**
 * Invocation outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the terminal result of one invocation.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.core.outcome.InvocationOutcome} - Sealed interface (permits Succeeded, Faulted, Cancelled, Failed)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.core.outcome.Succeeded} - Settled normally, optional return value</li>
 *   <li>{@link com.ryuqq.invoker.core.outcome.Faulted} - Business fault passed through unchanged</li>
 *   <li>{@link com.ryuqq.invoker.core.outcome.Cancelled} - Cancelled by the producer, no payload</li>
 *   <li>{@link com.ryuqq.invoker.core.outcome.Failed} - Argument mismatch, invalid state or infrastructure failure</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Exhaustiveness:</strong> Outcomes are classified at a single site, never inferred at call sites</li>
 *   <li><strong>Output invariant:</strong> Every outcome carries exactly one output value per declared output slot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.outcome;
