package ackflow.util;

import java.util.function.Consumer;
import java.util.function.Function;

import ackflow.flow.Ack;
import ackflow.flow.Deferred;
import ackflow.flow.Promise;

/**
 * Chaining helpers for acknowledgments that stay on the caller's thread
 * whenever the acknowledgment is already resolved.
 */
public enum AckHelper {
    ;

    /**
     * Chains {@code next} after {@code source}.
     * <p>
     * If {@code source} is already resolved the function runs immediately and its
     * result is returned as is; otherwise a {@link Promise} is returned that mirrors
     * the result of {@code next} once {@code source} resolves. A failed
     * {@code source} short-circuits and {@code next} never runs.
     *
     * @param source the acknowledgment to wait for
     * @param next the function producing the follow-up acknowledgment
     * @return the chained acknowledgment
     */
    public static Deferred<Ack> syncFlatMap(Deferred<Ack> source, Function<Ack, ? extends Deferred<Ack>> next) {
        if (source == Ack.CONTINUE || source == Ack.STOP) {
            return apply(next, (Ack) source);
        }
        if (source.isCompleted()) {
            if (source.error() != null) {
                return source;
            }
            return apply(next, source.value());
        }

        Promise<Ack> p = new Promise<>();
        source.whenComplete((ack, e) -> {
            if (e != null) {
                p.fail(e);
                return;
            }
            apply(next, ack).whenComplete((ack2, e2) -> {
                if (e2 != null) {
                    p.fail(e2);
                } else {
                    p.complete(ack2);
                }
            });
        });
        return p;
    }

    static Deferred<Ack> apply(Function<Ack, ? extends Deferred<Ack>> next, Ack ack) {
        Deferred<Ack> result;
        try {
            result = next.apply(ack);
        } catch (Throwable ex) {
            ExceptionHelper.throwIfFatal(ex);
            return Deferred.failed(ex);
        }
        if (result == null) {
            return Deferred.failed(new NullPointerException("The chained function returned a null acknowledgment"));
        }
        return result;
    }

    /**
     * Runs {@code action} once {@code source} resolves to {@link Ack#CONTINUE},
     * immediately if it already did.
     *
     * @param source the acknowledgment to wait for
     * @param action the action to run
     * @return true if the action ran synchronously
     */
    public static boolean syncOnContinue(Deferred<Ack> source, Runnable action) {
        if (source == Ack.CONTINUE) {
            run(action);
            return true;
        }
        if (source.isCompleted()) {
            if (source.value() == Ack.CONTINUE) {
                run(action);
                return true;
            }
            return false;
        }
        source.whenComplete((ack, e) -> {
            if (e == null && ack == Ack.CONTINUE) {
                run(action);
            }
        });
        return false;
    }

    /**
     * Runs {@code action} once {@code source} resolves to {@link Ack#STOP} or
     * fails; the action receives the failure or null for a plain stop.
     *
     * @param source the acknowledgment to wait for
     * @param action the action to run
     */
    public static void syncOnStopOrFailure(Deferred<Ack> source, Consumer<Throwable> action) {
        if (source == Ack.CONTINUE) {
            return;
        }
        source.whenComplete((ack, e) -> {
            if (e != null || ack == Ack.STOP) {
                action.accept(e);
            }
        });
    }

    static void run(Runnable action) {
        try {
            action.run();
        } catch (Throwable ex) {
            ExceptionHelper.throwIfFatal(ex);
            UnsignalledExceptions.onErrorDropped(ex);
        }
    }
}
