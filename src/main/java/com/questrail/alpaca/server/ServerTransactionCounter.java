package com.questrail.alpaca.server;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide {@code ServerTransactionID} source.
 *
 * <p>Values are strictly increasing across concurrent callers until
 * {@link Integer#MAX_VALUE}, after which the sequence restarts at 1. Zero is
 * never issued.</p>
 */
public final class ServerTransactionCounter {

    private final AtomicInteger last;

    public ServerTransactionCounter() {
        this(0);
    }

    ServerTransactionCounter(int start) {
        this.last = new AtomicInteger(start);
    }

    public int next() {
        while (true) {
            int current = last.get();
            int next = current == Integer.MAX_VALUE ? 1 : current + 1;
            if (last.compareAndSet(current, next)) {
                return next;
            }
        }
    }
}
