/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement to plug a
 * transport and an execution context into the retry loop.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.spi.ProbeOperation} - One attempt against a target</li>
 *   <li>{@link com.ryuqq.probe.core.spi.Sleeper} - Bounded wait between attempts</li>
 *   <li>{@link com.ryuqq.probe.core.spi.ProbeSession} - Isolated execution context (operation + sleeper)</li>
 *   <li>{@link com.ryuqq.probe.core.spi.ProbeSessionFactory} - Fresh session per check</li>
 * </ul>
 *
 * <h2>Failure Semantics</h2>
 * <ul>
 *   <li><strong>Operation exceptions:</strong> retryable, folded into the result</li>
 *   <li><strong>{@link com.ryuqq.probe.core.spi.WaitAbortedException}:</strong> stops the loop immediately</li>
 *   <li><strong>{@link com.ryuqq.probe.core.spi.ProbeSessionException}:</strong> harness fault, propagated</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Pluggability:</strong> HTTP adapter for real checks, scripted testkit fakes for tests</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.core.spi;
