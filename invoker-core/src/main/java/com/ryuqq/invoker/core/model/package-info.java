/**
 * Invocation model package.
 *
 * <p>Immutable value objects describing what is invoked and with which arguments.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.core.model.BoundOperation} - Resolved target operation and its parameter layout</li>
 *   <li>{@link com.ryuqq.invoker.core.model.ParameterSlot} - Positional input/output slot</li>
 *   <li>{@link com.ryuqq.invoker.core.model.ReturnKind} - none / value / async-none / async-value</li>
 *   <li>{@link com.ryuqq.invoker.core.model.InvocationRequest} - Target instance plus input arguments</li>
 *   <li>{@link com.ryuqq.invoker.core.model.OperationName} - Operation identity</li>
 *   <li>{@link com.ryuqq.invoker.core.model.CorrelationToken} - Caller-supplied telemetry correlation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.model;
