package com.ryuqq.invoker.core.telemetry.noop;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;

import java.time.Duration;

/**
 * Invocation Telemetry NoOp 구현.
 *
 * <p>계측을 비활성화합니다 ({@link #isEnabled()}가 false).
 * 텔레메트리 수집기가 없는 환경이나 테스트에서 사용합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class NoOpInvocationTelemetry implements InvocationTelemetry {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void operationInvoked(OperationName operation, CorrelationToken correlationToken) {
        // NoOp
    }

    @Override
    public void operationCompleted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        // NoOp
    }

    @Override
    public void operationFaulted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        // NoOp
    }

    @Override
    public void operationFailed(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        // NoOp
    }
}
