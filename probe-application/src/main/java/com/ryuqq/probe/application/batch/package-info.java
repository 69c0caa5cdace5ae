/**
 * Batch reachability contract.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.application.batch.BatchProbe} - Sequential, non-short-circuiting batch check</li>
 *   <li>{@link com.ryuqq.probe.application.batch.BatchReport} - Ordered {target, result} pairs</li>
 *   <li>{@link com.ryuqq.probe.application.batch.TargetResult} - One pair</li>
 * </ul>
 *
 * <p>The report is plain data. Turning failed entries into test failures is the caller's job.</p>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.application.batch;
