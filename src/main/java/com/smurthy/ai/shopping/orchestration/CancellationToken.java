package com.smurthy.ai.shopping.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Request-scoped cancellation flag shared by every handler call and tool invocation
 * spawned for one dispatched task.
 *
 * Listeners registered with {@link #onCancel(Runnable)} run exactly once, either on the thread
 * that cancels or on the registering thread when the token is already cancelled.
 */
public final class CancellationToken {

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel(String reason) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            // reason first: anyone who sees the flag also sees why
            this.reason = reason;
            this.cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    /**
     * Runs {@code listener} when the token is cancelled, or right away if it already is.
     */
    public void onCancel(Runnable listener) {
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException(reason != null ? reason : "cancelled");
        }
    }
}
