package com.ryuqq.invoker.testkit.contract;

import com.ryuqq.invoker.adapter.inmemory.telemetry.TelemetryEvent;
import com.ryuqq.invoker.adapter.runner.TaskOperationInvoker;
import com.ryuqq.invoker.application.invoker.OperationInvoker;
import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.outcome.Cancelled;
import com.ryuqq.invoker.core.outcome.Failed;
import com.ryuqq.invoker.core.outcome.FailureKind;
import com.ryuqq.invoker.core.outcome.Faulted;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.outcome.Succeeded;
import com.ryuqq.invoker.core.statemachine.InvocationStatus;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;
import com.ryuqq.invoker.testkit.fixture.OrderNotFound;
import com.ryuqq.invoker.testkit.fixture.OrderOperations;
import com.ryuqq.invoker.testkit.fixture.OrderService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scenario A-E Contract Test.
 *
 * <p>Dispatcher 관점에서 관찰 가능한 5가지 대표 시나리오를 검증합니다:</p>
 * <ul>
 *   <li><strong>A:</strong> 2개 입력, 값 42로 성공</li>
 *   <li><strong>B:</strong> OrderNotFound 비즈니스 오류는 그대로 Faulted</li>
 *   <li><strong>C:</strong> 오류 없는 취소는 Cancelled</li>
 *   <li><strong>D:</strong> 입력 개수 불일치는 대상 호출 없이 Failed/ARGUMENT_MISMATCH</li>
 *   <li><strong>E:</strong> 대상 인스턴스 null은 일시 중단 없이 Failed/INVALID_STATE</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
class InvocationScenarioContractTest extends AbstractInvokerContractTest {

    @Override
    protected OperationInvoker createInvoker(BoundOperation operation, InvocationTelemetry telemetry) {
        return new TaskOperationInvoker(operation, telemetry);
    }

    @Test
    void scenarioA_성공_시_반환값과_빈_출력_반환() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, "ORDER-1", 2);

        // then
        assertInstanceOf(Succeeded.class, outcome);
        assertEquals(42, ((Succeeded) outcome).returnValue());
        assertEquals(List.of(), outcome.outputs());
        assertEquals(
            List.of(TelemetryEvent.Kind.INVOKED, TelemetryEvent.Kind.COMPLETED),
            telemetry.kinds()
        );
    }

    @Test
    void scenarioA_pending_계산이_나중에_정산되어도_동일한_결과() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);
        CompletableFuture<Integer> deferred = service.defer();

        // when
        CompletableFuture<InvocationOutcome> stage =
            invoker.invoke(service, new Object[]{OrderService.DEFERRED_ORDER, 2}, TOKEN).toCompletableFuture();

        // then
        assertFalse(stage.isDone(), "Pending computation must suspend until settled");
        assertEquals(List.of(TelemetryEvent.Kind.INVOKED), telemetry.kinds());

        deferred.complete(42);
        InvocationOutcome outcome = await(stage);
        assertEquals(42, ((Succeeded) outcome).returnValue());
        assertEquals(
            List.of(TelemetryEvent.Kind.INVOKED, TelemetryEvent.Kind.COMPLETED),
            telemetry.kinds()
        );
    }

    @Test
    void scenarioB_비즈니스_오류는_래핑_없이_Faulted() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, OrderService.MISSING_ORDER, 1);

        // then
        assertInstanceOf(Faulted.class, outcome);
        Faulted faulted = (Faulted) outcome;
        assertInstanceOf(OrderNotFound.class, faulted.fault());
        assertEquals(OrderService.MISSING_ORDER, ((OrderNotFound) faulted.fault()).getOrderId());
        assertEquals("ORD-404", faulted.fault().getFaultCode());
        assertEquals(
            List.of(TelemetryEvent.Kind.INVOKED, TelemetryEvent.Kind.FAULTED),
            telemetry.kinds()
        );
    }

    @Test
    void scenarioB_동기_Operation이_던진_비즈니스_오류도_Faulted() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.describeOrder(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, OrderService.MISSING_ORDER);

        // then
        assertInstanceOf(Faulted.class, outcome);
        assertInstanceOf(OrderNotFound.class, ((Faulted) outcome).fault());
    }

    @Test
    void scenarioC_오류_없는_취소는_Cancelled() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, OrderService.CANCELLED_ORDER, 1);

        // then
        assertInstanceOf(Cancelled.class, outcome);
        assertEquals(InvocationStatus.CANCELLED, outcome.status());
        // 기본 정책(SUPPRESS)에서는 종료 이벤트가 없음
        assertEquals(List.of(TelemetryEvent.Kind.INVOKED), telemetry.kinds());
    }

    @Test
    void scenarioD_입력_개수_불일치는_대상_호출_없이_Failed() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, "ORDER-1");

        // then
        assertInstanceOf(Failed.class, outcome);
        assertEquals(FailureKind.ARGUMENT_MISMATCH, ((Failed) outcome).kind());
        assertEquals(0, service.getCalls(), "Target operation must never be called");
        assertTrue(telemetry.events().isEmpty(), "No telemetry for rejected invocations");
    }

    @Test
    void scenarioE_대상_인스턴스_null은_즉시_Failed() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        CompletableFuture<InvocationOutcome> stage =
            invoker.invoke(null, new Object[]{"ORDER-1", 2}, TOKEN).toCompletableFuture();

        // then
        assertTrue(stage.isDone());
        InvocationOutcome outcome = stage.join();
        assertInstanceOf(Failed.class, outcome);
        assertEquals(FailureKind.INVALID_STATE, ((Failed) outcome).kind());
        assertTrue(telemetry.events().isEmpty());
    }

    @Test
    void 인프라_실패는_원인을_보존한_Failed() {
        // given
        OperationInvoker invoker = createInvoker(OrderOperations.getOrderTotal(), telemetry);

        // when
        InvocationOutcome outcome = invokeImmediately(invoker, OrderService.BROKEN_ORDER, 1);

        // then
        assertInstanceOf(Failed.class, outcome);
        Failed failed = (Failed) outcome;
        assertEquals(FailureKind.INFRASTRUCTURE, failed.kind());
        assertInstanceOf(IllegalStateException.class, failed.failure().getCause());
        assertTrue(failed.failure().getMessage().startsWith("getOrderTotal: "));
        assertEquals(
            List.of(TelemetryEvent.Kind.INVOKED, TelemetryEvent.Kind.FAILED),
            telemetry.kinds()
        );
    }
}
