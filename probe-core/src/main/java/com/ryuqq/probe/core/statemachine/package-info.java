/**
 * Retry loop state machine package.
 *
 * <p>This package models the phases a single {@code execute} call goes through and
 * the call-local state threaded through the retry loop.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.statemachine.ExecutionPhase} - Phases of one execution (enum)</li>
 *   <li>{@link com.ryuqq.probe.core.statemachine.PhaseTransition} - Transition validation</li>
 *   <li>{@link com.ryuqq.probe.core.statemachine.ExecutionState} - Call-local attempts, waited time and last outcome</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * READY → ATTEMPTING
 * ATTEMPTING → SUCCESS | TERMINAL_FAILURE | EXHAUSTED | WAITING
 * WAITING → ATTEMPTING | ABORTED | EXHAUSTED
 *
 * Forbidden:
 * - SUCCESS, TERMINAL_FAILURE, EXHAUSTED, ABORTED → * (terminal)
 * </pre>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.core.statemachine;
