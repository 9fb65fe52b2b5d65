/**
 * Run outcomes.
 *
 * <p>{@link com.ryuqq.netexec.core.outcome.Outcome} is a sealed interface with two cases:
 * {@link com.ryuqq.netexec.core.outcome.Ok} and {@link com.ryuqq.netexec.core.outcome.Fail}.
 * Any operator failure is fatal for the run; there is no retry outcome.</p>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.outcome;
