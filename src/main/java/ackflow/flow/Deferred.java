package ackflow.flow;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

/**
 * A value that may not be known yet: it resolves synchronously or
 * asynchronously, either to a value or to a failure.
 * <p>
 * The contract favors the "run now if already resolved, else register a
 * callback" dual path: callers inspect {@link #isCompleted()} first and
 * only fall back to {@link #whenComplete(BiConsumer)} when the value is
 * still pending.
 *
 * @param <T> the value type
 */
public interface Deferred<T> {

    /**
     * Has this deferred resolved, successfully or not?
     * @return true if resolved
     */
    boolean isCompleted();

    /**
     * The resolved value.
     * @return the value if completed successfully, null otherwise
     */
    T value();

    /**
     * The failure cause.
     * @return the error if completed with a failure, null otherwise
     */
    Throwable error();

    /**
     * Registers a callback receiving either the value (and a null error)
     * or the error (and a null value).
     * <p>
     * If this deferred is already resolved, the callback runs immediately
     * on the caller's thread, otherwise it runs on the thread that
     * resolves it.
     *
     * @param callback the callback to invoke exactly once
     */
    void whenComplete(BiConsumer<? super T, ? super Throwable> callback);

    /**
     * Returns an already completed deferred holding the given value.
     * @param <T> the value type
     * @param value the value, not null
     * @return the completed deferred
     */
    static <T> Deferred<T> now(T value) {
        Objects.requireNonNull(value, "value");
        Promise<T> p = new Promise<>();
        p.complete(value);
        return p;
    }

    /**
     * Returns an already failed deferred.
     * @param <T> the value type
     * @param error the failure, not null
     * @return the failed deferred
     */
    static <T> Deferred<T> failed(Throwable error) {
        Objects.requireNonNull(error, "error");
        Promise<T> p = new Promise<>();
        p.fail(error);
        return p;
    }

    /**
     * Adapts a {@link CompletionStage}; a stage that is already done
     * yields an already completed deferred.
     * @param <T> the value type
     * @param stage the stage to adapt
     * @return the deferred view of the stage
     */
    static <T> Deferred<T> fromFuture(CompletionStage<? extends T> stage) {
        Objects.requireNonNull(stage, "stage");
        Promise<T> p = new Promise<>();
        stage.whenComplete((v, e) -> {
            if (e != null) {
                if (e instanceof CompletionException && e.getCause() != null) {
                    e = e.getCause();
                }
                p.fail(e);
            } else if (v == null) {
                p.fail(new NullPointerException("The CompletionStage completed with a null value"));
            } else {
                p.complete(v);
            }
        });
        return p;
    }
}
