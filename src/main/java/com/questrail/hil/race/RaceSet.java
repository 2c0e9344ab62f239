package com.questrail.hil.race;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * RaceSet
 * -----------------------------------------------------------------------------
 * Done/pending partition of one race: the primary plus its secondaries.
 *
 * <p>Tasks only ever move from pending to done, and the primary is in exactly
 * one of the two sets at any instant. Completion callbacks may arrive on any
 * thread, so every access is synchronized.</p>
 */
final class RaceSet<T>
{
    private final CompletableFuture<T> primary;
    private final List<CompletableFuture<?>> secondaries;
    private final Set<CompletableFuture<?>> done = new LinkedHashSet<>();
    private final Set<CompletableFuture<?>> pending = new LinkedHashSet<>();

    RaceSet(CompletableFuture<T> primary, List<CompletableFuture<?>> secondaries)
    {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondaries = List.copyOf(secondaries);
        pending.add(primary);
        pending.addAll(this.secondaries);
    }

    CompletableFuture<T> primary()
    {
        return primary;
    }

    List<CompletableFuture<?>> secondaries()
    {
        return secondaries;
    }

    synchronized void markDone(CompletableFuture<?> task)
    {
        if (pending.remove(task)) {
            done.add(task);
        }
    }

    synchronized boolean isPrimaryDone()
    {
        return done.contains(primary);
    }

    /**
     * Secondaries still running, in submission order.
     */
    synchronized Set<CompletableFuture<?>> pendingSecondaries()
    {
        Set<CompletableFuture<?>> result = new LinkedHashSet<>(pending);
        result.remove(primary);
        return Collections.unmodifiableSet(result);
    }

    synchronized Set<CompletableFuture<?>> pending()
    {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pending));
    }
}
