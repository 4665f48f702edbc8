package com.ryuqq.invoker.testkit.fixture;

import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.model.ReturnKind;

/**
 * Bound operations over {@link OrderService}, one per return kind.
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class OrderOperations {

    // Utility class - prevent instantiation
    private OrderOperations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * {@code getOrderTotal(orderId, quantity)}: 2 inputs, 0 outputs, async value.
     */
    public static BoundOperation getOrderTotal() {
        return BoundOperation.builder("getOrderTotal",
                (instance, inputs, outputs) -> ((OrderService) instance).totalOf((String) inputs[0], (Integer) inputs[1]))
            .input("orderId", String.class)
            .input("quantity", int.class)
            .returns(ReturnKind.ASYNC_VALUE)
            .build();
    }

    /**
     * {@code archiveOrder(orderId)}: 1 input, 0 outputs, async without value.
     */
    public static BoundOperation archiveOrder() {
        return BoundOperation.builder("archiveOrder",
                (instance, inputs, outputs) -> ((OrderService) instance).archive((String) inputs[0]))
            .input("orderId", String.class)
            .returns(ReturnKind.ASYNC_NONE)
            .build();
    }

    /**
     * {@code describeOrder(orderId, out currency, out itemCount)}: synchronous value with 2 outputs.
     */
    public static BoundOperation describeOrder() {
        return BoundOperation.builder("describeOrder",
                (instance, inputs, outputs) -> ((OrderService) instance).describe((String) inputs[0], outputs))
            .input("orderId", String.class)
            .output("currency", String.class)
            .output("itemCount", int.class)
            .returns(ReturnKind.VALUE)
            .build();
    }

    /**
     * {@code touchOrder(orderId)}: synchronous, no value.
     */
    public static BoundOperation touchOrder() {
        return BoundOperation.builder("touchOrder",
                (instance, inputs, outputs) -> {
                    ((OrderService) instance).touch((String) inputs[0]);
                    return null;
                })
            .input("orderId", String.class)
            .returns(ReturnKind.NONE)
            .build();
    }

    /**
     * {@code trackOrderTotal(orderId, out status)}: async value with 1 output written before suspension.
     */
    public static BoundOperation trackOrderTotal() {
        return BoundOperation.builder("trackOrderTotal",
                (instance, inputs, outputs) -> {
                    outputs[0] = "TRACKED";
                    return ((OrderService) instance).totalOf((String) inputs[0], 1);
                })
            .input("orderId", String.class)
            .output("status", String.class)
            .returns(ReturnKind.ASYNC_VALUE)
            .build();
    }
}
