package com.ryuqq.invoker.adapter.inmemory.telemetry;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;

import java.time.Duration;

/**
 * 기록된 텔레메트리 이벤트.
 *
 * @param kind 이벤트 종류
 * @param operation Operation 이름
 * @param correlationToken 호출자 토큰
 * @param elapsed 경과 시간 (INVOKED 이벤트는 null)
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record TelemetryEvent(
    Kind kind,
    OperationName operation,
    CorrelationToken correlationToken,
    Duration elapsed
) {

    public TelemetryEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (correlationToken == null) {
            throw new IllegalArgumentException("correlationToken cannot be null");
        }
    }

    /**
     * 이벤트 종류.
     */
    public enum Kind {
        INVOKED,
        COMPLETED,
        FAULTED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this != INVOKED;
        }
    }
}
