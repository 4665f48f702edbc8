package com.ryuqq.invoker.adapter.runner;

import com.ryuqq.invoker.core.telemetry.CancellationEventPolicy;

/**
 * TaskOperationInvoker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>instrumentationEnabled: 텔레메트리 이벤트 보고 여부 (기본 true).
 *       false이면 텔레메트리 구현체의 {@code isEnabled()}와 관계없이 이벤트를 보고하지 않습니다.</li>
 *   <li>cancellationEventPolicy: 취소 결과의 종료 이벤트 정책 (기본 SUPPRESS)</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 * @param instrumentationEnabled 계측 활성화 여부
 * @param cancellationEventPolicy 취소 이벤트 정책 (null 불가)
 */
public record InvokerConfig(
    boolean instrumentationEnabled,
    CancellationEventPolicy cancellationEventPolicy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: instrumentationEnabled=true, cancellationEventPolicy=SUPPRESS</p>
     */
    public InvokerConfig() {
        this(true, CancellationEventPolicy.SUPPRESS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException cancellationEventPolicy가 null인 경우
     */
    public InvokerConfig {
        if (cancellationEventPolicy == null) {
            throw new IllegalArgumentException("cancellationEventPolicy cannot be null");
        }
    }

    /**
     * instrumentationEnabled만 변경한 새 인스턴스 생성.
     */
    public InvokerConfig withInstrumentationEnabled(boolean instrumentationEnabled) {
        return new InvokerConfig(instrumentationEnabled, cancellationEventPolicy);
    }

    /**
     * cancellationEventPolicy만 변경한 새 인스턴스 생성.
     */
    public InvokerConfig withCancellationEventPolicy(CancellationEventPolicy cancellationEventPolicy) {
        return new InvokerConfig(instrumentationEnabled, cancellationEventPolicy);
    }
}
