package com.example.shotforge_backend.util;

import com.example.shotforge_backend.exception.GenerationException;
import com.example.shotforge_backend.exception.ProductionCancelledException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through one production run.
 * <p>
 * Callbacks registered with {@link #onCancel(Runnable)} fire once when the token is cancelled;
 * engines use them to dispose in-flight HTTP exchanges. {@link #await(CompletableFuture)} is the
 * suspension point used by the run loop: it never returns a value produced after cancellation.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            callbacks.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ProductionCancelledException("run cancelled");
        }
    }

    /**
     * Registers a callback; runs it immediately when the token is already cancelled.
     * Callbacks must be idempotent.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            callback.run();
        }
    }

    public void removeOnCancel(Runnable callback) {
        callbacks.remove(callback);
    }

    /**
     * Callbacks still waiting for cancellation.
     */
    public int registeredCallbacks() {
        return callbacks.size();
    }

    /**
     * Waits for the future, cancelling it when the token is cancelled.
     *
     * @throws ProductionCancelledException when cancelled before or while waiting
     * @throws GenerationException when the future failed with a checked exception
     */
    public <T> T await(CompletableFuture<T> future) {
        throwIfCancelled();
        Runnable cancelFuture = () -> future.cancel(true);
        onCancel(cancelFuture);
        try {
            T value = future.get();
            throwIfCancelled();
            return value;
        } catch (CancellationException e) {
            throwIfCancelled();
            throw new GenerationException("call cancelled outside the run", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ProductionCancelledException("run interrupted");
        } catch (ExecutionException e) {
            throwIfCancelled();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new GenerationException(String.valueOf(cause.getMessage()), cause);
        } finally {
            removeOnCancel(cancelFuture);
        }
    }
}
