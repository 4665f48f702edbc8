/**
 * Contracts between the invoker and the bound target operations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.invoker.core.contract.OperationBinding} - Statically-typed call adapter, one per operation</li>
 *   <li>{@link com.ryuqq.invoker.core.contract.BusinessFault} - Caller-meaningful fault, never wrapped</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.contract;
