package com.ryuqq.invoker.adapter.inmemory.telemetry;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link InvocationTelemetry} SPI for testing and reference purposes.
 *
 * <p>Records every event in arrival order using a {@link CopyOnWriteArrayList},
 * so concurrent invocations can report safely while tests read a consistent snapshot.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTelemetry telemetry = new InMemoryTelemetry();
 * OperationInvoker invoker = new TaskOperationInvoker(operation, telemetry);
 *
 * invoker.invoke(service, inputs, CorrelationToken.of("req-1"));
 *
 * List&lt;TelemetryEvent&gt; events = telemetry.eventsFor(CorrelationToken.of("req-1"));
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public class InMemoryTelemetry implements InvocationTelemetry {

    private final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean enabled = true;

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Enables or disables recording as reported through {@link #isEnabled()}.
     *
     * @param enabled whether the invoker should report events
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public void operationInvoked(OperationName operation, CorrelationToken correlationToken) {
        events.add(new TelemetryEvent(TelemetryEvent.Kind.INVOKED, operation, correlationToken, null));
    }

    @Override
    public void operationCompleted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        events.add(new TelemetryEvent(TelemetryEvent.Kind.COMPLETED, operation, correlationToken, elapsed));
    }

    @Override
    public void operationFaulted(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        events.add(new TelemetryEvent(TelemetryEvent.Kind.FAULTED, operation, correlationToken, elapsed));
    }

    @Override
    public void operationFailed(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        events.add(new TelemetryEvent(TelemetryEvent.Kind.FAILED, operation, correlationToken, elapsed));
    }

    @Override
    public void operationCancelled(OperationName operation, CorrelationToken correlationToken, Duration elapsed) {
        events.add(new TelemetryEvent(TelemetryEvent.Kind.CANCELLED, operation, correlationToken, elapsed));
    }

    /**
     * Returns a snapshot of all recorded events.
     *
     * @return events in arrival order
     */
    public List<TelemetryEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the events reported for one correlation token.
     *
     * @param correlationToken the caller-supplied token
     * @return matching events in arrival order
     */
    public List<TelemetryEvent> eventsFor(CorrelationToken correlationToken) {
        return events.stream()
                .filter(event -> event.correlationToken().equals(correlationToken))
                .collect(Collectors.toList());
    }

    /**
     * Returns the kinds of all recorded events.
     *
     * @return event kinds in arrival order
     */
    public List<TelemetryEvent.Kind> kinds() {
        return events.stream()
                .map(TelemetryEvent::kind)
                .collect(Collectors.toList());
    }

    /**
     * Clears all recorded events.
     */
    public void clear() {
        events.clear();
    }
}
