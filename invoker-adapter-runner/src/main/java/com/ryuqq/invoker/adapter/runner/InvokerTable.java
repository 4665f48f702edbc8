package com.ryuqq.invoker.adapter.runner;

import com.ryuqq.invoker.application.invoker.OperationInvoker;
import com.ryuqq.invoker.core.compiler.OperationCompiler;
import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;
import com.ryuqq.invoker.core.telemetry.noop.NoOpInvocationTelemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operation 이름 → Invoker 테이블.
 *
 * <p>시작 시점에 한 번 구성되어, 디스패처가 해석한 Operation 이름으로 Invoker를 찾습니다.
 * 등록 순서를 유지하며 구성 후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * InvokerTable table = InvokerTable.builder()
 *     .telemetry(new LoggingTelemetry())
 *     .register(getOrderTotal)
 *     .register(cancelOrder)
 *     .build();
 *
 * OperationInvoker invoker = table.get("getOrderTotal");
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class InvokerTable {

    private final Map<OperationName, OperationInvoker> invokers;

    private InvokerTable(Map<OperationName, OperationInvoker> invokers) {
        this.invokers = Collections.unmodifiableMap(new LinkedHashMap<>(invokers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Invoker 조회.
     *
     * @param name Operation 이름
     * @return Invoker (없으면 empty)
     */
    public Optional<OperationInvoker> find(OperationName name) {
        return Optional.ofNullable(invokers.get(name));
    }

    /**
     * Invoker 조회 (필수).
     *
     * @param name Operation 이름
     * @return Invoker
     * @throws IllegalArgumentException 등록되지 않은 Operation인 경우
     */
    public OperationInvoker get(String name) {
        OperationName operationName = OperationName.of(name);
        return find(operationName)
            .orElseThrow(() -> new IllegalArgumentException("No operation registered under name: " + name));
    }

    public Set<OperationName> operationNames() {
        return invokers.keySet();
    }

    public int size() {
        return invokers.size();
    }

    /**
     * InvokerTable Builder.
     *
     * <p>telemetry/compiler/config는 register 이전에 지정해야 해당 Operation에 적용됩니다.</p>
     */
    public static final class Builder {

        private final Map<OperationName, OperationInvoker> invokers = new LinkedHashMap<>();
        private InvocationTelemetry telemetry = new NoOpInvocationTelemetry();
        private OperationCompiler compiler = OperationCompiler.staticBinding();
        private InvokerConfig config = new InvokerConfig();

        private Builder() {
        }

        public Builder telemetry(InvocationTelemetry telemetry) {
            if (telemetry == null) {
                throw new IllegalArgumentException("telemetry cannot be null");
            }
            this.telemetry = telemetry;
            return this;
        }

        public Builder compiler(OperationCompiler compiler) {
            if (compiler == null) {
                throw new IllegalArgumentException("compiler cannot be null");
            }
            this.compiler = compiler;
            return this;
        }

        public Builder config(InvokerConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        /**
         * Operation 등록.
         *
         * @param operation 바인딩된 Operation
         * @return this
         * @throws IllegalArgumentException operation이 null이거나 같은 이름이 이미 등록된 경우
         */
        public Builder register(BoundOperation operation) {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            if (invokers.containsKey(operation.name())) {
                throw new IllegalArgumentException("Duplicate operation name: " + operation.name().getValue());
            }
            invokers.put(operation.name(), new TaskOperationInvoker(operation, compiler, telemetry, config));
            return this;
        }

        public InvokerTable build() {
            return new InvokerTable(invokers);
        }
    }
}
