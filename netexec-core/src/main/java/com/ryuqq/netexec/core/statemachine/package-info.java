/**
 * Execution node state machine.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → READY   (last predecessor finished)
 * READY → RUNNING   (taken by a worker)
 * RUNNING → DONE    (run() returned true)
 * RUNNING → FAILED  (run() returned false or threw)
 *
 * Forbidden:
 * - DONE → *, FAILED → * (terminal)
 * - skipping states (e.g., PENDING → RUNNING)
 * </pre>
 *
 * @since 1.0.0
 * @author NetExec Team
 */
package com.ryuqq.netexec.core.statemachine;
