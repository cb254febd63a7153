package com.tazifor.datacube.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Runs independent tile (or tile-group) tasks on a shared executor.
 * <p>
 * Results come back in input order, but tasks run concurrently and must not
 * observe each other. The first failure cancels the tasks that have not
 * started yet and is rethrown unwrapped. Tasks are never retried.
 * </p>
 */
public class TileWorkerPool {

    private final ExecutorService executor;

    public TileWorkerPool(ExecutorService executor) {
        this.executor = executor;
    }

    public <T, R> List<R> map(Collection<? extends T> items, Function<? super T, ? extends R> task) {
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(item), executor));
        }

        List<R> results = new ArrayList<>(items.size());
        try {
            for (CompletableFuture<R> f : futures) {
                results.add(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(false));
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("tile task failed", cause);
        }
        return results;
    }

    public <T, R> List<R> flatMap(Collection<? extends T> items,
                                  Function<? super T, ? extends Collection<? extends R>> task) {
        List<R> out = new ArrayList<>();
        for (Collection<? extends R> part : map(items, task)) {
            out.addAll(part);
        }
        return out;
    }
}
