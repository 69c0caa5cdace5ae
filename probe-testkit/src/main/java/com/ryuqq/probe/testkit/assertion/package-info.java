/**
 * Reachability assertions for probe results and batch reports.
 *
 * @since 1.0.0
 * @author Probe Team
 */
package com.ryuqq.probe.testkit.assertion;
