/**
 * Runner Adapter Layer - Invoker 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.adapter.runner.TaskOperationInvoker} - 동기/비동기 Operation Invoker</li>
 *   <li>{@link com.ryuqq.invoker.adapter.runner.CompletionBridge} - Legacy begin/end 완료 브리지</li>
 *   <li>{@link com.ryuqq.invoker.adapter.runner.InvokerTable} - Operation 이름 → Invoker 테이블</li>
 *   <li>{@link com.ryuqq.invoker.adapter.runner.LoggingTelemetry} - SLF4J 텔레메트리 수집기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (TaskOperationInvoker, CompletionBridge)
 *   ↓ implements
 * application (OperationInvoker, CompletionInvoker)
 *   ↓ depends on
 * core (BoundOperation, CompiledThunk, FailureClassifier, InvocationOutcome)
 *   ↓ depends on
 * core/telemetry (InvocationTelemetry SPI)
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
package com.ryuqq.invoker.adapter.runner;
