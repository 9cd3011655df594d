package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.model.MetricKey;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * A training run in progress. Concurrent requests for the same key share one handle, so
 * cancelling it cancels the run for every waiter. A cancelled run never replaces the cached model.
 */
public final class TrainingHandle {

    private final MetricKey key;
    private final CompletableFuture<AutoregressiveModel> future;
    private final CancellationToken token;
    private final Runnable onCancel;

    TrainingHandle(MetricKey key, CompletableFuture<AutoregressiveModel> future, CancellationToken token,
                   Runnable onCancel) {
        this.key = key;
        this.future = future;
        this.token = token;
        this.onCancel = onCancel;
    }

    public MetricKey key() {
        return key;
    }

    public CompletableFuture<AutoregressiveModel> future() {
        return future;
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * Cancels the run unless it already finished. A finished run keeps its result.
     */
    public void cancel() {
        onCancel.run();
    }

    /**
     * Blocks for the trained model, rethrowing the training failure unwrapped.
     */
    public AutoregressiveModel await() {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for training of " + key);
        } catch (ExecutionException ex) {
            throw unwrap(ex.getCause());
        }
    }

    static RuntimeException unwrap(Throwable cause) {
        Throwable current = cause;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        return new CompletionException(current);
    }
}
