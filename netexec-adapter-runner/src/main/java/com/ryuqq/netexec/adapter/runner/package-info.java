/**
 * Executor adapters.
 *
 * <p>{@link com.ryuqq.netexec.adapter.runner.ParallelNetExecutor} runs independent operators on a
 * fixed worker pool, {@link com.ryuqq.netexec.adapter.runner.SequentialNetExecutor} runs them in
 * declaration order. {@link com.ryuqq.netexec.adapter.runner.NetTypes} binds both to the
 * {@code "dag"} and {@code "simple"} net types.</p>
 */
package com.ryuqq.netexec.adapter.runner;
