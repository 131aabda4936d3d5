package com.shlawgathon.drawcheck.backend.extraction;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancellation flag shared between the orchestrator and the
 * extractor for one request.
 */
public class ExtractionControl {

    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ExtractionControl(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static ExtractionControl withTimeout(Duration timeout) {
        return new ExtractionControl(System.nanoTime() + timeout.toNanos());
    }

    public static ExtractionControl unbounded() {
        return new ExtractionControl(Long.MAX_VALUE);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ExtractionCancelledException("Extraction cancelled");
        }
    }

    public boolean isExpired() {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    public long remainingMillis() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, Duration.ofNanos(deadlineNanos - System.nanoTime()).toMillis());
    }
}
