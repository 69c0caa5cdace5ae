package com.ryuqq.probe.core.outcome;

import com.ryuqq.probe.core.model.ProbeResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class AttemptResultTest {

    @Test
    void responded_HasStatusButNoError() {
        AttemptResult result = AttemptResult.responded(ProbeResponse.of(503));

        assertTrue(result.hasStatus());
        assertEquals(503, result.statusCode());
        assertThrows(IllegalStateException.class, result::error);
    }

    @Test
    void threw_HasErrorButNoStatus() {
        TimeoutException error = new TimeoutException("Timeout 15000ms exceeded");
        AttemptResult result = AttemptResult.threw(error);

        assertFalse(result.hasStatus());
        assertSame(error, result.error());
        assertThrows(IllegalStateException.class, result::statusCode);
    }

    @Test
    void factories_RejectNull() {
        assertThrows(IllegalArgumentException.class, () -> AttemptResult.responded(null));
        assertThrows(IllegalArgumentException.class, () -> AttemptResult.threw(null));
    }
}
