package com.contentforge.domain.execution.model.valobj;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag for one run. The executor checks it between steps and between
 * tracks; an invocation already in flight is never interrupted.
 */
public final class CancellationSignal {

    private static final String DEFAULT_REASON = "Run cancelled";

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancel(DEFAULT_REASON);
    }

    public void cancel(String cancelReason) {
        reason.compareAndSet(null, cancelReason == null || cancelReason.isBlank() ? DEFAULT_REASON : cancelReason);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        String value = reason.get();
        return value == null ? DEFAULT_REASON : value;
    }
}
