/**
 * Runner adapter package.
 *
 * <p>This package provides the synchronous implementations of the probe contracts.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.adapter.runner.RetryingProbeExecutor} - Time-budgeted linear retry loop</li>
 *   <li>{@link com.ryuqq.probe.adapter.runner.ScopedProbeRunner} - Fresh session per check, released on every path</li>
 *   <li>{@link com.ryuqq.probe.adapter.runner.SequentialBatchRunner} - Non-short-circuiting batch over targets</li>
 *   <li>{@link com.ryuqq.probe.adapter.runner.RouteWarmupRunner} - Best-effort route warmup</li>
 *   <li>{@link com.ryuqq.probe.adapter.runner.ThreadSleeper} - Blocking wait primitive</li>
 * </ul>
 *
 * <h2>Control Flow</h2>
 * <pre>
 * SequentialBatchRunner
 *   └─ (for each target) ScopedProbeRunner
 *        └─ RetryingProbeExecutor
 *             ├─ OutcomeClassifier
 *             └─ LinearBackoffScheduler
 * </pre>
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>All work runs on the caller thread; attempts are strictly sequential</li>
 *   <li>Runners hold no mutable state and may be shared</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.adapter.runner;
