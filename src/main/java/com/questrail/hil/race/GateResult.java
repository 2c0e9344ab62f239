package com.questrail.hil.race;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of {@link RaceCoordinator#gate}.
 *
 * @param result    the gate's (primary's) result
 * @param cancelled the secondaries that were still pending when the gate
 *                  completed and have been cancelled
 */
public record GateResult<T>(
    T result,
    List<CompletableFuture<?>> cancelled
) {
    public GateResult {
        Objects.requireNonNull(cancelled, "cancelled");
        cancelled = List.copyOf(cancelled);
    }
}
