package com.github.collomatique.ilp.solvers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. A child token is cancelled when its parent is.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
