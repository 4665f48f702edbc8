package com.ryuqq.invoker.core.telemetry;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;

import java.time.Duration;

/**
 * Invocation Telemetry SPI.
 *
 * <p>Invoker가 Invocation 수명주기 이벤트를 외부 수집기에 보고하는 포트입니다.
 * 순수하게 관찰 용도이며, 분류된 결과에 영향을 주어서는 안 됩니다.</p>
 *
 * <p><strong>이벤트 순서 (Invocation 하나 기준):</strong></p>
 * <pre>
 * operationInvoked (디스패치 직전, 최대 1회)
 *   ↓
 * operationCompleted | operationFaulted | operationFailed (분류 직후, 최대 1회)
 * </pre>
 *
 * <p>취소 결과의 이벤트는 {@link CancellationEventPolicy}에 따라 결정됩니다.</p>
 *
 * <p><strong>예외 격리:</strong> 구현체가 RuntimeException을 던져도 Invoker가 잡아서
 * 로그만 남기고 결과는 그대로 유지합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public interface InvocationTelemetry {

    /**
     * 계측 활성화 여부.
     *
     * <p>false이면 Invoker는 시작 시각 기록과 모든 이벤트 보고를 생략합니다.</p>
     *
     * @return 활성화 여부
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Invoked 이벤트.
     *
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     */
    void operationInvoked(OperationName operation, CorrelationToken correlationToken);

    /**
     * Completed 이벤트 (Succeeded).
     *
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     * @param elapsed 경과 시간
     */
    void operationCompleted(OperationName operation, CorrelationToken correlationToken, Duration elapsed);

    /**
     * Faulted 이벤트 (비즈니스 Fault).
     *
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     * @param elapsed 경과 시간
     */
    void operationFaulted(OperationName operation, CorrelationToken correlationToken, Duration elapsed);

    /**
     * Failed 이벤트 (인프라 실패).
     *
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     * @param elapsed 경과 시간
     */
    void operationFailed(OperationName operation, CorrelationToken correlationToken, Duration elapsed);

    /**
     * Cancelled 이벤트.
     *
     * <p>{@link CancellationEventPolicy#REPORT_AS_CANCELLED}일 때만 호출됩니다.</p>
     *
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     * @param elapsed 경과 시간
     */
    default void operationCancelled(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        // 기본 구현: 무시
    }
}
