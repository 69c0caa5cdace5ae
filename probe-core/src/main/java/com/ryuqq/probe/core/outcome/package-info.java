/**
 * Probe attempt outcome package.
 *
 * <p>This package defines the sealed outcome hierarchy and the classifier that
 * maps one attempt's raw result (a status code or a thrown error) onto it.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.outcome.ProbeOutcome} - Sealed interface (permits Success, TerminalFailure, TransientFailure, Aborted)</li>
 * </ul>
 *
 * <h2>Classification</h2>
 * <pre>
 * 200          → Success
 * 5xx          → TransientFailure (retryable)
 * other status → TerminalFailure (never retried)
 * thrown error → TransientFailure (retryable)
 * </pre>
 *
 * <p>{@link com.ryuqq.probe.core.outcome.Aborted} is never produced by the classifier;
 * the executor creates it when the wait between attempts cannot complete.</p>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.core.outcome;
