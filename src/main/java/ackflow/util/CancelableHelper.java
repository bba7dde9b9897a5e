package ackflow.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import ackflow.flow.Cancelable;

/**
 * Utility methods to work with {@link Cancelable} fields that may be
 * assigned and cancelled from different threads.
 */
public enum CancelableHelper {
    ;

    /**
     * The terminal marker stored in a field once it has been cancelled.
     */
    public static final Cancelable CANCELLED = new Cancelable() {
        @Override
        public void cancel() {
            // deliberately no-op
        }

        @Override
        public String toString() {
            return "Cancelled";
        }
    };

    /**
     * Wraps an action into a {@link Cancelable} that runs it at most once.
     *
     * @param action the action to run on the first cancel()
     * @return the idempotent cancelable
     */
    public static Cancelable once(Runnable action) {
        return new OnceCancelable(Objects.requireNonNull(action, "action"));
    }

    /**
     * Atomically swaps in {@link #CANCELLED} and cancels the previous content.
     *
     * @param <F> the type holding the field
     * @param field the field accessor
     * @param instance the parent instance
     * @return true if this call cancelled the field, false if it was cancelled already
     */
    public static <F> boolean terminate(AtomicReferenceFieldUpdater<F, Cancelable> field, F instance) {
        Cancelable a = field.get(instance);
        if (a != CANCELLED) {
            a = field.getAndSet(instance, CANCELLED);
            if (a != CANCELLED) {
                if (a != null) {
                    a.cancel();
                }
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the content of the field without cancelling the previous one;
     * if the field was cancelled, the new cancelable is cancelled instead.
     *
     * @param <F> the type holding the field
     * @param field the field accessor
     * @param instance the parent instance
     * @param c the new cancelable
     * @return true if the replacement happened
     */
    public static <F> boolean replace(AtomicReferenceFieldUpdater<F, Cancelable> field, F instance, Cancelable c) {
        for (;;) {
            Cancelable a = field.get(instance);
            if (a == CANCELLED) {
                c.cancel();
                return false;
            }
            if (field.compareAndSet(instance, a, c)) {
                return true;
            }
        }
    }

    /**
     * @param c the content of a cancelable field
     * @return true if it is the {@link #CANCELLED} marker
     */
    public static boolean isCancelled(Cancelable c) {
        return c == CANCELLED;
    }

    static final class OnceCancelable extends AtomicReference<Runnable> implements Cancelable {
        /** */
        private static final long serialVersionUID = -6313218764452358104L;

        OnceCancelable(Runnable action) {
            super(action);
        }

        @Override
        public void cancel() {
            Runnable r = get();
            if (r != null) {
                r = getAndSet(null);
                if (r != null) {
                    r.run();
                }
            }
        }

        @Override
        public String toString() {
            return get() == null ? "Cancelable[cancelled]" : "Cancelable[active]";
        }
    }
}
