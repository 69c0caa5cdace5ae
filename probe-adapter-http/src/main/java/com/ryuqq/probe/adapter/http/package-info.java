/**
 * HTTP adapter package.
 *
 * <p>Probes targets with {@link java.net.http.HttpClient}. Each session owns its client,
 * cookie store and executor thread, and is torn down on close.</p>
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.adapter.http;
