/**
 * Reusable contract tests for {@link com.ryuqq.netexec.core.executor.NetExecutor} implementations.
 *
 * @author NetExec Team
 * @since 1.0.0
 */
package com.ryuqq.netexec.testkit.contract;
