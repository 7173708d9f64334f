package com.sandkev.canvasio.resource;

import lombok.Getter;

import java.util.List;

/**
 * One or more writes of a cascade update failed. Nodes that were saved are clean; the failed
 * ones stay dirty, so calling {@code update()} again retries only those.
 */
@Getter
public class CascadeUpdateException extends RuntimeException {

    private final List<Throwable> failures;

    public CascadeUpdateException(String message, List<Throwable> failures) {
        super(message + ": " + failures.size() + " failure(s), first: " + failures.get(0).getMessage(), failures.get(0));
        this.failures = List.copyOf(failures);
        this.failures.stream().skip(1).forEach(this::addSuppressed);
    }
}
