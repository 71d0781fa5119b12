package com.rangerewards.distributor;

import com.rangerewards.exception.OperationInProgressException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * In-flight flag for operations that hand control to external code through a token transfer.
 * A nested entry, typically from a token callback, fails instead of running against state
 * that is halfway through an update.
 */
public class OperationGuard {

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public <T> T run(String operation, Supplier<T> action) {
        if (!inFlight.compareAndSet(false, true)) {
            throw new OperationInProgressException(operation);
        }
        try {
            return action.get();
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isInFlight() {
        return inFlight.get();
    }
}
