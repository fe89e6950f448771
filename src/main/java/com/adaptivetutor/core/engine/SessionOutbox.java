package com.adaptivetutor.core.engine;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered queue of pending outbound publications for one session.
 *
 * <p>The engine enqueues while it holds the session lock, so the queue order is the order in
 * which the session changed. {@link #drain()} is called after the lock is released. Only one
 * thread drains at a time; a thread that finds another draining returns immediately and leaves
 * its entries to that thread. A slow listener therefore delays later publications for the
 * session but never the engine's processing of it.
 */
public class SessionOutbox {

    private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public void enqueue(Runnable publication) {
        pending.add(publication);
    }

    /**
     * Runs pending publications on the calling thread unless another thread is already
     * draining this outbox.
     */
    public void drain() {
        // re-check after releasing: an entry may have arrived between the last poll and the reset
        while (!pending.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                Runnable publication;
                while ((publication = pending.poll()) != null) {
                    publication.run();
                }
            } finally {
                draining.set(false);
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }
}
