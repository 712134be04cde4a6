package com.skillbox.runtime.lifecycle;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot channel from an execution to its waiter.
 *
 * Only the first {@link #offer} is ever accepted, so an execution can report
 * at most one terminal result however many messages it emits.
 */
final class ResultChannel {

    private final BlockingQueue<TerminalResult> queue = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean delivered = new AtomicBoolean();
    private volatile boolean closed;

    /** @return false if a result was already delivered or the channel is closed */
    boolean offer(TerminalResult result) {
        if (closed || !delivered.compareAndSet(false, true)) {
            return false;
        }
        return queue.offer(result);
    }

    /** Blocks up to {@code timeout}; null when nothing arrived. */
    TerminalResult poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return null;
        }
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    TerminalResult pollNow() {
        return queue.poll();
    }

    boolean hasDelivered() {
        return delivered.get();
    }

    void close() {
        closed = true;
        queue.clear();
    }

    boolean isClosed() {
        return closed;
    }
}
