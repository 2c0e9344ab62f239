package com.questrail.hil.instrument;

import com.questrail.hil.runtime.HilRuntime;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing: the runtime, and blocking on a driver future with the
 * driver's own failure rethrown instead of an {@link ExecutionException}.
 */
abstract class AbstractInstrument implements InstrumentDriver
{
    protected final HilRuntime runtime;

    protected AbstractInstrument(HilRuntime runtime)
    {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    protected static <T> T await(CompletableFuture<T> future)
            throws IOException, InterruptedException, TimeoutException
    {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw (TimeoutException) cause;
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("instrument operation failed", cause);
        }
    }
}
