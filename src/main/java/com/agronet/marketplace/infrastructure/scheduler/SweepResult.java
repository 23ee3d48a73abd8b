package com.agronet.marketplace.infrastructure.scheduler;

import lombok.Value;

/**
 * Outcome of one expiry sweep.
 *
 * @author Agronet Marketplace Team
 */
@Value
public class SweepResult {

    /**
     * False when the sweep did not run because another sweep held the lock.
     */
    boolean executed;
    int found;
    int closed;
    int failed;
    long durationMs;

    public static SweepResult skipped() {
        return new SweepResult(false, 0, 0, 0, 0L);
    }
}
