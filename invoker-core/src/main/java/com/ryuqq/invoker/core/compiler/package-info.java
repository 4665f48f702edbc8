/**
 * Binder/Compiler package.
 *
 * <p>Turns a {@link com.ryuqq.invoker.core.model.BoundOperation} into an immutable
 * {@link com.ryuqq.invoker.core.compiler.CompiledThunk}. Thunks are built lazily by the invoker,
 * published through a volatile reference and reused for the lifetime of the operation.</p>
 *
 * @since 1.0.0
 * @author Invoker Team
 */
package com.ryuqq.invoker.core.compiler;
