/**
 * Probe domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.model.ProbeTarget} - Path or absolute URL to probe</li>
 *   <li>{@link com.ryuqq.probe.core.model.ProbeResponse} - Status code of one attempt</li>
 *   <li>{@link com.ryuqq.probe.core.model.ProbeResult} - Terminal result of one execution</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.model.RetryPolicy} - Immutable retry policy with CI and local presets</li>
 *   <li>{@link com.ryuqq.probe.core.model.ProbeEnvironment} - Explicit environment-to-preset selection</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.core.model;
