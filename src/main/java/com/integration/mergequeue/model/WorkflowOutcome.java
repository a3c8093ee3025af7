package com.integration.mergequeue.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pending CI verdict for the commit currently tested on the staging branch.
 * Resolved at most once.
 */
@Getter
@RequiredArgsConstructor
public class WorkflowOutcome {

    private final String commitSha;

    private final int pullRequestNumber;

    @Getter(lombok.AccessLevel.NONE)
    private final CompletableFuture<Boolean> result = new CompletableFuture<>();

    /**
     * @return false if the outcome was already resolved
     */
    public boolean resolve(boolean success) {
        return result.complete(success);
    }

    public boolean isResolved() {
        return result.isDone();
    }

    /**
     * Block until resolved. A zero or negative timeout waits without bound.
     */
    public boolean await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return result.get();
            }
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // never completed exceptionally
            throw new IllegalStateException("Workflow outcome failed for " + commitSha, e.getCause());
        }
    }
}
