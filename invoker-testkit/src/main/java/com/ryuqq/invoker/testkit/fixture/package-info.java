/**
 * Sample target operations for invoker contract tests.
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.testkit.fixture;
