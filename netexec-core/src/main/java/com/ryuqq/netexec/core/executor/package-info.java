/**
 * Executor contract.
 *
 * <p>{@link com.ryuqq.netexec.core.executor.NetExecutor} implementations live in the
 * runner adapter: a worker-pool scheduler honoring the dependency graph, and a sequential
 * baseline that runs operators in declaration order.</p>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
package com.ryuqq.netexec.core.executor;
