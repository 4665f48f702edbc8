package com.ryuqq.invoker.testkit.fixture;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sample service used as the target instance in contract tests.
 *
 * <p>Order ids drive the behavior:</p>
 * <ul>
 *   <li>{@value #MISSING_ORDER} - settles with {@link OrderNotFound}</li>
 *   <li>{@value #CANCELLED_ORDER} - settles as cancelled</li>
 *   <li>{@value #BROKEN_ORDER} - throws {@link IllegalStateException}</li>
 *   <li>{@value #DEFERRED_ORDER} - returns the future handed out by {@link #defer()}</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public class OrderService {

    public static final String MISSING_ORDER = "ORDER-MISSING";
    public static final String CANCELLED_ORDER = "ORDER-CANCELLED";
    public static final String BROKEN_ORDER = "ORDER-BROKEN";
    public static final String DEFERRED_ORDER = "ORDER-DEFERRED";

    private static final int UNIT_PRICE = 21;

    private final AtomicInteger calls = new AtomicInteger();
    private volatile CompletableFuture<Integer> deferred = new CompletableFuture<>();

    /**
     * Async operation with a value: quantity times unit price (2 → 42).
     */
    public CompletionStage<Integer> totalOf(String orderId, int quantity) {
        calls.incrementAndGet();
        switch (orderId) {
            case MISSING_ORDER:
                return CompletableFuture.failedFuture(new OrderNotFound(orderId));
            case CANCELLED_ORDER:
                CompletableFuture<Integer> cancelled = new CompletableFuture<>();
                cancelled.cancel(false);
                return cancelled;
            case BROKEN_ORDER:
                throw new IllegalStateException("order store unavailable");
            case DEFERRED_ORDER:
                return deferred;
            default:
                return CompletableFuture.completedFuture(quantity * UNIT_PRICE);
        }
    }

    /**
     * Async operation without a value.
     */
    public CompletionStage<Void> archive(String orderId) {
        calls.incrementAndGet();
        if (MISSING_ORDER.equals(orderId)) {
            return CompletableFuture.failedFuture(new OrderNotFound(orderId));
        }
        if (DEFERRED_ORDER.equals(orderId)) {
            return deferred.thenAccept(ignored -> { });
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Synchronous operation with a value and two output slots (currency, item count).
     */
    public String describe(String orderId, Object[] outputs) {
        calls.incrementAndGet();
        if (MISSING_ORDER.equals(orderId)) {
            throw new OrderNotFound(orderId);
        }
        if (BROKEN_ORDER.equals(orderId)) {
            throw new IllegalStateException("order store unavailable");
        }
        outputs[0] = "KRW";
        outputs[1] = 3;
        return "order:" + orderId;
    }

    /**
     * Synchronous operation without a value.
     */
    public void touch(String orderId) {
        calls.incrementAndGet();
        if (BROKEN_ORDER.equals(orderId)) {
            throw new IllegalStateException("order store unavailable");
        }
    }

    /**
     * Returns the future that the next {@value #DEFERRED_ORDER} call hands back.
     *
     * @return a fresh, incomplete future
     */
    public CompletableFuture<Integer> defer() {
        CompletableFuture<Integer> next = new CompletableFuture<>();
        deferred = next;
        return next;
    }

    public int getCalls() {
        return calls.get();
    }
}
