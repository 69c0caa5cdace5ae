/**
 * Probe executor contract.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.probe.core.executor.ProbeExecutor} - 재시도 실행자</li>
 * </ul>
 *
 * @author Probe Team
 * @since 1.0.0
 */
package com.ryuqq.probe.core.executor;
