package com.flagship.escrow_engine.escrow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caps one sweep run by contract count and wall-clock time.
 * Contracts left over when the budget runs out wait for the next tick.
 */
class SweepBudget {

    private final int maxContracts;
    private final Instant deadline;
    private final Clock clock;
    private int used;

    SweepBudget(int maxContracts, Duration maxDuration, Clock clock) {
        this.maxContracts = maxContracts;
        this.deadline = clock.instant().plus(maxDuration);
        this.clock = clock;
    }

    boolean tryAcquire() {
        if (used >= maxContracts || !clock.instant().isBefore(deadline)) {
            return false;
        }
        used++;
        return true;
    }

    int remaining() {
        return Math.max(0, maxContracts - used);
    }
}
