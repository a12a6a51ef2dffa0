package io.eventlog.budget;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caps the number of input handles one merge keeps open at a time and records the high-water mark.
 * Acquisition never blocks: running out of permits means the caller planned a batch larger than the budget.
 */
public class HandleBudget {
    public static final int MIN_HANDLES = 2;
    public static final int DEFAULT_HANDLES = 64;

    private final int limit;
    private final Semaphore permits;
    private final AtomicInteger open = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public HandleBudget(int limit) {
        this.limit = Math.max(MIN_HANDLES, limit);
        this.permits = new Semaphore(this.limit);
    }

    public void acquire() {
        if (!permits.tryAcquire()) {
            throw new IllegalStateException("handle budget exhausted: limit=" + limit);
        }
        int now = open.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
    }

    public void release() {
        open.decrementAndGet();
        permits.release();
    }

    public int limit() { return limit; }
    public int open() { return open.get(); }
    public int peak() { return peak.get(); }
}
