/**
 * Failure classification.
 *
 * <p>{@link com.ryuqq.invoker.core.classifier.FailureClassifier} is the single site that maps a settled
 * computation to an {@link com.ryuqq.invoker.core.outcome.InvocationOutcome}.</p>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.classifier;
