package com.pocketca.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reentrant locks keyed by artifact name, striped over a fixed set.
 *
 * <p>Different names may share a stripe. Callers must not hold the lock of
 * one name while taking the lock of another name from the same instance.
 */
public class NamedLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public NamedLocks() {
        this(DEFAULT_STRIPES);
    }

    public NamedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public int getStripeCount() {
        return stripes.length;
    }

    /**
     * Run {@code action} while holding the lock for {@code name}.
     */
    public <T> T withLock(String name, Supplier<T> action) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String name) {
        return stripes[Math.floorMod(name.hashCode(), stripes.length)];
    }
}
