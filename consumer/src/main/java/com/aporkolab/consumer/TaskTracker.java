package com.aporkolab.consumer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts running dispatcher and worker tasks so callers can wait for all of them.
 */
final class TaskTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private int active;

    void register() {
        lock.lock();
        try {
            active++;
        } finally {
            lock.unlock();
        }
    }

    void arrive() {
        lock.lock();
        try {
            if (active == 0) {
                throw new IllegalStateException("arrive() without matching register()");
            }
            if (--active == 0) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    void awaitIdle() throws InterruptedException {
        lock.lock();
        try {
            while (active > 0) {
                idle.await();
            }
        } finally {
            lock.unlock();
        }
    }

    boolean awaitIdle(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (active > 0) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = idle.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
