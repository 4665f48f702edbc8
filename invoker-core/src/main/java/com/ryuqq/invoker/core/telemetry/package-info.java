/**
 * Telemetry SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.invoker.core.telemetry.InvocationTelemetry} - Invoked / Completed / Faulted / Failed events</li>
 *   <li>{@link com.ryuqq.invoker.core.telemetry.CancellationEventPolicy} - What, if anything, a cancellation reports</li>
 *   <li>{@link com.ryuqq.invoker.core.telemetry.noop.NoOpInvocationTelemetry} - Disabled telemetry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.telemetry;
