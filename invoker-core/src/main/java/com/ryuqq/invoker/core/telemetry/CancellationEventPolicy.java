package com.ryuqq.invoker.core.telemetry;

/**
 * 취소된 Invocation의 종료 이벤트 정책.
 *
 * <ul>
 *   <li>SUPPRESS: 종료 이벤트를 기록하지 않음 (기본값, 취소는 호출자 주도로 간주)</li>
 *   <li>REPORT_AS_FAILED: Failed 이벤트로 기록</li>
 *   <li>REPORT_AS_CANCELLED: 별도의 Cancelled 이벤트로 기록</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public enum CancellationEventPolicy {
    SUPPRESS,
    REPORT_AS_FAILED,
    REPORT_AS_CANCELLED
}
