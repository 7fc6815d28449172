package org.transitdisplay.store;

import org.transitdisplay.interfaces.SharedCell;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-value cell guarded by its own lock. Reads and writes hold the lock
 * only for the reference swap; callers never block or fetch under it.
 */
public final class LockedCell<T> implements SharedCell<T> {

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private T value;

    @Override
    public Optional<T> get() {
        lock.lock();
        try {
            return Optional.ofNullable(value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(T newValue) {
        if (newValue == null) {
            throw new IllegalArgumentException("cell value must not be null");
        }
        lock.lock();
        try {
            value = newValue;
        } finally {
            lock.unlock();
        }
    }
}
