/**
 * Contract test support for {@link com.ryuqq.invoker.application.invoker.OperationInvoker} implementations.
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.testkit.contract;
