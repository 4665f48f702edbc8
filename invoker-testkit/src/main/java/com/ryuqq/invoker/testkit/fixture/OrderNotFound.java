package com.ryuqq.invoker.testkit.fixture;

import com.ryuqq.invoker.core.contract.BusinessFault;

/**
 * Business fault raised when an order does not exist.
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public class OrderNotFound extends BusinessFault {

    private final String orderId;

    public OrderNotFound(String orderId) {
        super("ORD-404", "Order not found: " + orderId);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
