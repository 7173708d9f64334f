package com.sandkev.canvasio.resource;

import com.sandkev.canvasio.shared.Callbacks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

final class Cascade {

    private Cascade() {}

    /**
     * Waits for every future, successful or not, and returns the failures. Nested cascade
     * failures are flattened.
     */
    static CompletableFuture<List<Throwable>> failuresOf(List<? extends CompletableFuture<?>> futures) {
        List<CompletableFuture<Throwable>> outcomes = futures.stream()
                .map(f -> f.handle((v, err) -> err == null ? null : Callbacks.unwrap(err)))
                .toList();
        return CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
                .thenApply(v -> {
                    var failures = new ArrayList<Throwable>();
                    for (CompletableFuture<Throwable> o : outcomes) {
                        Throwable t = o.join();
                        if (t instanceof CascadeUpdateException c) failures.addAll(c.getFailures());
                        else if (t != null) failures.add(t);
                    }
                    return failures;
                });
    }

    static <T> CompletableFuture<T> settle(T value, List<Throwable> failures, String what) {
        if (failures.isEmpty()) return CompletableFuture.completedFuture(value);
        return CompletableFuture.failedFuture(new CascadeUpdateException(what, failures));
    }
}
