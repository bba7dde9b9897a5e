package ackflow.flow;

import java.util.function.BiConsumer;

/**
 * The answer a {@link Subscriber} gives for each element it receives.
 * <p>
 * Both constants are already-resolved {@link Deferred} values so an
 * {@code onNext} implementation can answer synchronously by returning
 * one of them directly, or asynchronously by returning a pending
 * {@link Promise}.
 * <p>
 * Once a producer observes {@link #STOP} it must not send any further
 * element on that subscription.
 */
public enum Ack implements Deferred<Ack> {
    /** Keep sending. */
    CONTINUE,

    /** Cease sending; terminal for the subscription. */
    STOP;

    @Override
    public boolean isCompleted() {
        return true;
    }

    @Override
    public Ack value() {
        return this;
    }

    @Override
    public Throwable error() {
        return null;
    }

    @Override
    public void whenComplete(BiConsumer<? super Ack, ? super Throwable> callback) {
        callback.accept(this, null);
    }
}
