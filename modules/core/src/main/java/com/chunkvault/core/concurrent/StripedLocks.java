package com.chunkvault.core.concurrent;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks selected by key hash. Operations on the same key are
 * serialised; operations on different keys usually run in parallel.
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(Object key) {
        return stripes[stripeOf(key)];
    }

    private int stripeOf(Object key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return Math.floorMod(h, stripes.length);
    }

    public <T> T withLock(Object key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Object key, Runnable action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the stripes of every key. Stripes are taken in index order,
     * so two callers with overlapping key sets cannot deadlock.
     */
    public void runWithLocks(Collection<?> keys, Runnable action) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (Object key : keys) {
            indexes.add(stripeOf(key));
        }
        int locked = 0;
        try {
            for (int index : indexes) {
                stripes[index].lock();
                locked++;
            }
            action.run();
        } finally {
            for (int index : indexes) {
                if (locked-- == 0) {
                    break;
                }
                stripes[index].unlock();
            }
        }
    }
}
