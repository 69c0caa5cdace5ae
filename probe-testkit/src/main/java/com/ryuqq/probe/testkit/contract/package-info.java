/**
 * Contract test infrastructure.
 *
 * <p>Scripted fakes for the probe SPI and abstract contract suites. An adapter binds a
 * suite by extending it in its own test tree and implementing the factory hook.</p>
 *
 * <h2>Fakes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.testkit.contract.ScriptedProbeOperation} - Statuses or errors in script order</li>
 *   <li>{@link com.ryuqq.probe.testkit.contract.RecordingSleeper} - Records waits, optional abort</li>
 *   <li>{@link com.ryuqq.probe.testkit.contract.TrackingSessionFactory} - Counts opened and closed sessions</li>
 * </ul>
 *
 * <h2>Suites</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.testkit.contract.RetryExecutorContract}</li>
 *   <li>{@link com.ryuqq.probe.testkit.contract.ScopedProbeContract}</li>
 *   <li>{@link com.ryuqq.probe.testkit.contract.BatchProbeContract}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.testkit.contract;
