package com.hybridrag.corpus;

import java.util.function.LongConsumer;

/**
 * Orders committed units of work. Readers take a lock-free snapshot of the visible epoch and ignore
 * anything published under a later one.
 */
public final class PublicationClock {
    private final Object publishLock = new Object();
    private volatile long visibleEpoch;

    public long snapshot() {
        return visibleEpoch;
    }

    public long publish(LongConsumer publisher) {
        synchronized (publishLock) {
            long epoch = visibleEpoch + 1;
            publisher.accept(epoch);
            visibleEpoch = epoch;
            return epoch;
        }
    }

    public static boolean isVisible(long entryEpoch, long snapshot) {
        return entryEpoch <= snapshot;
    }
}
