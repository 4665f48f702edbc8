package com.ryuqq.invoker.adapter.runner;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * SLF4J 기반 텔레메트리 수집기.
 *
 * <p>Invoked 이벤트는 DEBUG, Completed/Faulted/Cancelled는 INFO, Failed는 WARN 레벨로 기록합니다.
 * INFO 레벨이 꺼져 있으면 계측 자체를 비활성화합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class LoggingTelemetry implements InvocationTelemetry {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetry.class);

    @Override
    public boolean isEnabled() {
        return log.isInfoEnabled();
    }

    @Override
    public void operationInvoked(OperationName operation, CorrelationToken correlationToken) {
        log.debug("Operation invoked: {} [{}]", operation.getValue(), correlationToken.getValue());
    }

    @Override
    public void operationCompleted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        log.info("Operation completed: {} [{}] in {} ms", operation.getValue(), correlationToken.getValue(), elapsed.toMillis());
    }

    @Override
    public void operationFaulted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        log.info("Operation faulted: {} [{}] in {} ms", operation.getValue(), correlationToken.getValue(), elapsed.toMillis());
    }

    @Override
    public void operationFailed(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        log.warn("Operation failed: {} [{}] in {} ms", operation.getValue(), correlationToken.getValue(), elapsed.toMillis());
    }

    @Override
    public void operationCancelled(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        log.info("Operation cancelled: {} [{}] in {} ms", operation.getValue(), correlationToken.getValue(), elapsed.toMillis());
    }
}
