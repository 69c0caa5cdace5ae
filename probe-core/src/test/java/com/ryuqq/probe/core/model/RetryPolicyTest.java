package com.ryuqq.probe.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy 테스트.
 *
 * @author Probe Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    @Test
    void defaultConstructor_UsesDocumentedDefaults() {
        // When
        RetryPolicy policy = new RetryPolicy();

        // Then
        assertEquals(3, policy.maxAttempts());
        assertEquals(1000, policy.initialDelayMs());
        assertEquals(30000, policy.maxTotalWaitMs());
        assertEquals(15000, policy.perAttemptTimeoutMs());
        assertEquals(policy, RetryPolicy.defaults());
    }

    @Test
    void ci_MatchesCiProfile() {
        RetryPolicy policy = RetryPolicy.ci();

        assertEquals(new RetryPolicy(3, 2000, 25000, 15000), policy);
    }

    @Test
    void local_MatchesLocalProfile() {
        RetryPolicy policy = RetryPolicy.local();

        assertEquals(new RetryPolicy(2, 500, 10000, 10000), policy);
    }

    @Test
    void constructor_ZeroMaxAttempts_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy(0, 1000, 30000, 15000)
        );
        assertTrue(exception.getMessage().contains("maxAttempts must be positive"));
    }

    @Test
    void constructor_NegativeInitialDelay_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy(3, -1, 30000, 15000)
        );
        assertTrue(exception.getMessage().contains("initialDelayMs must be non-negative"));
    }

    @Test
    void constructor_NegativeMaxTotalWait_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy(3, 1000, -1, 15000)
        );
        assertTrue(exception.getMessage().contains("maxTotalWaitMs must be non-negative"));
    }

    @Test
    void constructor_NegativePerAttemptTimeout_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RetryPolicy(3, 1000, 30000, -5)
        );
        assertTrue(exception.getMessage().contains("perAttemptTimeoutMs must be non-negative"));
    }

    @Test
    void constructor_ZeroBudgets_AreAllowed() {
        RetryPolicy policy = new RetryPolicy(1, 0, 0, 0);

        assertEquals(0, policy.maxTotalWaitMs());
        assertEquals(0, policy.perAttemptTimeoutMs());
    }

    @Test
    void withMethods_ChangeOnlyOneField() {
        // Given
        RetryPolicy base = RetryPolicy.defaults();

        // When & Then
        assertEquals(new RetryPolicy(5, 1000, 30000, 15000), base.withMaxAttempts(5));
        assertEquals(new RetryPolicy(3, 100, 30000, 15000), base.withInitialDelayMs(100));
        assertEquals(new RetryPolicy(3, 1000, 1000, 15000), base.withMaxTotalWaitMs(1000));
        assertEquals(new RetryPolicy(3, 1000, 30000, 0), base.withPerAttemptTimeoutMs(0));
        assertEquals(RetryPolicy.defaults(), base);
    }

    @Test
    void withMaxAttempts_InvalidValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.ci().withMaxAttempts(0));
    }
}
