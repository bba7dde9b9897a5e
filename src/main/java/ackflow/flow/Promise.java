package ackflow.flow;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.BiConsumer;

import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * A {@link Deferred} that is resolved explicitly, at most once, via
 * {@link #complete(Object)} or {@link #fail(Throwable)}.
 * <p>
 * The state moves from "pending, with a stack of callbacks" to a single
 * outcome through CAS, so completion and callback registration may race
 * freely. Callbacks run exactly once, in registration order, on the
 * thread that resolves the promise (or on the registering thread if the
 * promise is already resolved).
 *
 * @param <T> the value type
 */
public final class Promise<T> implements Deferred<T> {

    /** Either null, a {@link Waiter} stack or an {@link Outcome}. */
    volatile Object state;
    @SuppressWarnings("rawtypes")
    static final AtomicReferenceFieldUpdater<Promise, Object> STATE =
            AtomicReferenceFieldUpdater.newUpdater(Promise.class, Object.class, "state");

    /**
     * Resolves this promise with a value.
     * @param value the value, not null
     * @return true if this call resolved the promise, false if it was already resolved
     */
    public boolean complete(T value) {
        Objects.requireNonNull(value, "value");
        return resolve(new Outcome(value, null));
    }

    /**
     * Resolves this promise with a failure.
     * @param error the failure, not null
     * @return true if this call resolved the promise, false if it was already resolved
     */
    public boolean fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        return resolve(new Outcome(null, error));
    }

    boolean resolve(Outcome outcome) {
        for (;;) {
            Object s = state;
            if (s instanceof Outcome) {
                return false;
            }
            if (STATE.compareAndSet(this, s, outcome)) {
                if (s != null) {
                    drain(reverse((Waiter) s), outcome);
                }
                return true;
            }
        }
    }

    @Override
    public boolean isCompleted() {
        return state instanceof Outcome;
    }

    @SuppressWarnings("unchecked")
    @Override
    public T value() {
        Object s = state;
        if (s instanceof Outcome) {
            return (T) ((Outcome) s).value;
        }
        return null;
    }

    @Override
    public Throwable error() {
        Object s = state;
        if (s instanceof Outcome) {
            return ((Outcome) s).error;
        }
        return null;
    }

    @Override
    public void whenComplete(BiConsumer<? super T, ? super Throwable> callback) {
        Objects.requireNonNull(callback, "callback");
        for (;;) {
            Object s = state;
            if (s instanceof Outcome) {
                invoke(callback, (Outcome) s);
                return;
            }
            if (STATE.compareAndSet(this, s, new Waiter(callback, (Waiter) s))) {
                return;
            }
        }
    }

    static Waiter reverse(Waiter w) {
        Waiter r = null;
        while (w != null) {
            r = new Waiter(w.callback, r);
            w = w.next;
        }
        return r;
    }

    static void drain(Waiter w, Outcome outcome) {
        while (w != null) {
            invoke(w.callback, outcome);
            w = w.next;
        }
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    static void invoke(BiConsumer callback, Outcome outcome) {
        try {
            callback.accept(outcome.value, outcome.error);
        } catch (Throwable ex) {
            ExceptionHelper.throwIfFatal(ex);
            UnsignalledExceptions.onErrorDropped(ex);
        }
    }

    @Override
    public String toString() {
        Object s = state;
        if (s instanceof Outcome) {
            Outcome o = (Outcome) s;
            return o.error != null ? "Promise[failed=" + o.error + "]" : "Promise[value=" + o.value + "]";
        }
        return "Promise[pending]";
    }

    static final class Waiter {
        final BiConsumer<?, ?> callback;

        final Waiter next;

        Waiter(BiConsumer<?, ?> callback, Waiter next) {
            this.callback = callback;
            this.next = next;
        }
    }

    static final class Outcome {
        final Object value;

        final Throwable error;

        Outcome(Object value, Throwable error) {
            this.value = value;
            this.error = error;
        }
    }
}
