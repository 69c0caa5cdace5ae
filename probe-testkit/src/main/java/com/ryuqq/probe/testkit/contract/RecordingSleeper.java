package com.ryuqq.probe.testkit.contract;

import com.ryuqq.probe.core.spi.Sleeper;
import com.ryuqq.probe.core.spi.WaitAbortedException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested waits instead of blocking.
 *
 * <p>Can be told to abort at the N-th wait to simulate an execution context
 * being torn down while a retry is pending.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> waits = new CopyOnWriteArrayList<>();
    private volatile int abortAtWait = -1;

    /**
     * Aborts the given wait (1-based) and every wait after it.
     *
     * @param nthWait 1-based wait index
     * @return this sleeper
     */
    public RecordingSleeper abortAt(int nthWait) {
        if (nthWait <= 0) {
            throw new IllegalArgumentException("nthWait must be positive (current: " + nthWait + ")");
        }
        this.abortAtWait = nthWait;
        return this;
    }

    @Override
    public void pause(long millis) throws WaitAbortedException {
        int waitNumber = waits.size() + 1;
        if (abortAtWait > 0 && waitNumber >= abortAtWait) {
            throw new WaitAbortedException("Context closed during wait #" + waitNumber);
        }
        waits.add(millis);
    }

    /**
     * @return completed waits in order (aborted waits are not recorded)
     */
    public List<Long> waits() {
        return List.copyOf(waits);
    }

    public long totalWaitedMs() {
        return waits.stream().mapToLong(Long::longValue).sum();
    }

    public void clear() {
        waits.clear();
        abortAtWait = -1;
    }
}
