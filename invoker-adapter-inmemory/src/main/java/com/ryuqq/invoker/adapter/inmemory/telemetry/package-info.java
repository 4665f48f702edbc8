/**
 * In-memory telemetry adapter.
 *
 * <p>This package provides a thread-safe, recording implementation of the
 * {@link com.ryuqq.invoker.core.telemetry.InvocationTelemetry} SPI for tests and local development.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.adapter.inmemory.telemetry.InMemoryTelemetry} - Event recorder</li>
 *   <li>{@link com.ryuqq.invoker.adapter.inmemory.telemetry.TelemetryEvent} - Recorded event</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
package com.ryuqq.invoker.adapter.inmemory.telemetry;
