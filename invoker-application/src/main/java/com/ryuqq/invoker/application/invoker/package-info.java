/**
 * Invoker Application Layer - direct invocation API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.invoker.application.invoker.OperationInvoker} - Invocation 실행자 (stage 기반 일시 중단)</li>
 *   <li>{@link com.ryuqq.invoker.application.invoker.InvocationResult} - (반환값, 출력 인자)</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
package com.ryuqq.invoker.application.invoker;
