package ackflow.subscriber;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import ackflow.flow.Ack;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.scheduler.Scheduler;
import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * A subscriber that forwards onXXX calls to lambdas.
 * <p>
 * A failure thrown by the onNext lambda, or a null acknowledgment, terminates
 * the subscriber: the failure goes to the onError lambda and the producer is
 * answered with STOP. Terminal lambdas run at most once; anything arriving
 * afterwards is routed to {@link UnsignalledExceptions}.
 *
 * @param <T> the value type
 */
public final class LambdaSubscriber<T> implements Subscriber<T> {

    final Function<? super T, ? extends Deferred<Ack>> onNextCall;

    final Consumer<Throwable> onErrorCall;

    final Runnable onCompleteCall;

    final Scheduler scheduler;

    boolean done;

    public LambdaSubscriber(Function<? super T, ? extends Deferred<Ack>> onNextCall, Consumer<Throwable> onErrorCall,
            Runnable onCompleteCall, Scheduler scheduler) {
        this.onNextCall = Objects.requireNonNull(onNextCall, "onNextCall");
        this.onErrorCall = Objects.requireNonNull(onErrorCall, "onErrorCall");
        this.onCompleteCall = Objects.requireNonNull(onCompleteCall, "onCompleteCall");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public Deferred<Ack> onNext(T t) {
        if (done) {
            UnsignalledExceptions.onNextDropped(t);
            return Ack.STOP;
        }
        Deferred<Ack> ack;
        try {
            ack = Objects.requireNonNull(onNextCall.apply(t), "The onNext lambda returned a null acknowledgment");
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            onError(e);
            return Ack.STOP;
        }
        return ack;
    }

    @Override
    public void onError(Throwable t) {
        if (done) {
            UnsignalledExceptions.onErrorDropped(t);
            return;
        }
        done = true;
        try {
            onErrorCall.accept(t);
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            UnsignalledExceptions.onErrorDropped(ExceptionHelper.suppress(e, t));
        }
    }

    @Override
    public void onComplete() {
        if (done) {
            return;
        }
        done = true;
        try {
            onCompleteCall.run();
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            UnsignalledExceptions.onErrorDropped(e);
        }
    }
}
