package com.sandkev.canvasio.shared;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;

/** Bridges the future-returning API to optional completion callbacks. */
@Slf4j
public final class Callbacks {

    private Callbacks() {}

    /**
     * Invokes {@code callback} with either the value or the unwrapped failure, and returns the
     * original future so the caller can still wait on it.
     */
    public static <T> CompletableFuture<T> attach(CompletableFuture<T> future, BiConsumer<? super T, ? super Throwable> callback) {
        if (callback == null) return future;
        future.whenComplete((value, err) -> {
            try {
                callback.accept(err == null ? value : null, err == null ? null : unwrap(err));
            } catch (RuntimeException e) {
                log.warn("Completion callback threw: {}", e.toString());
            }
        });
        return future;
    }

    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
