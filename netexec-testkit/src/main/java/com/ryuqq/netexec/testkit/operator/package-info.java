/**
 * Operators for tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.netexec.testkit.operator.SleepOperator} - blocks for a fixed time, used by timing scenarios</li>
 *   <li>{@link com.ryuqq.netexec.testkit.operator.ComputeOperator} - deterministic output derived from its inputs</li>
 *   <li>{@link com.ryuqq.netexec.testkit.operator.FailingOperator} - returns false or throws</li>
 *   <li>{@link com.ryuqq.netexec.testkit.operator.ExecutionLog} - start/end intervals and peak concurrency</li>
 * </ul>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
package com.ryuqq.netexec.testkit.operator;
