package ackflow.observable;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

import org.reactivestreams.Publisher;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.flow.Transition;
import ackflow.scheduler.Scheduler;
import ackflow.subscriber.LambdaSubscriber;
import ackflow.test.TestSubscriber;
import ackflow.util.UnsignalledExceptions;

/**
 * Base class with fluent API for acknowledgment-driven sources.
 * <p>
 * A source pushes elements to a {@link Subscriber} one at a time and waits for
 * each {@link Ack} before sending the next one; subscribing returns the
 * {@link Cancelable} that stops it.
 *
 * @param <T> the output value type
 */
public abstract class Observable<T> {

    /**
     * Starts the flow towards the given subscriber.
     *
     * @param s the subscriber, not null
     * @return the handle that stops the flow, idempotent
     */
    public abstract Cancelable subscribe(Subscriber<? super T> s);

    /**
     * @param <T> the value type
     * @return a source that completes immediately
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static <T> Observable<T> empty() {
        return (Observable) ObservableEmpty.INSTANCE;
    }

    /**
     * @param <T> the value type
     * @param error the error to signal
     * @return a source that fails immediately
     */
    public static <T> Observable<T> error(Throwable error) {
        return new ObservableError<>(error);
    }

    @SafeVarargs
    public static <T> Observable<T> fromArray(T... array) {
        Objects.requireNonNull(array, "array");
        if (array.length == 0) {
            return empty();
        }
        return new ObservableIterable<>(Arrays.asList(array));
    }

    public static <T> Observable<T> fromIterable(Iterable<? extends T> iterable) {
        return new ObservableIterable<>(iterable);
    }

    /**
     * Generates an infinite sequence from a state machine whose every step
     * is a deferred computation.
     *
     * @param <A> the emitted value type
     * @param <S> the state type
     * @param step the state transition, invoked once per element
     * @param seed the initial state
     * @return the generated source
     */
    public static <A, S> Observable<A> fromAsyncStateAction(Function<S, Deferred<Transition<A, S>>> step, S seed) {
        return new ObservableAsyncStateAction<>(step, seed);
    }

    /**
     * Variant of {@link #fromAsyncStateAction(Function, Object)} whose steps are
     * {@link CompletionStage}s.
     *
     * @param <A> the emitted value type
     * @param <S> the state type
     * @param step the state transition, invoked once per element
     * @param seed the initial state
     * @return the generated source
     */
    public static <A, S> Observable<A> fromAsyncStateActionFuture(
            Function<S, ? extends CompletionStage<Transition<A, S>>> step, S seed) {
        Objects.requireNonNull(step, "step");
        return new ObservableAsyncStateAction<>(s -> Deferred.fromFuture(step.apply(s)), seed);
    }

    /**
     * Emits {@code separator} between consecutive elements of this source.
     *
     * @param separator the separator, not null
     * @return the new source
     */
    public final Observable<T> intersperse(T separator) {
        return new ObservableIntersperse<>(this, null, separator, null);
    }

    /**
     * Emits {@code start} before the first element, {@code separator} between
     * consecutive elements and {@code end} after the last one; nothing is
     * added if this source turns out to be empty.
     *
     * @param start the leading marker, null for none
     * @param separator the separator, not null
     * @param end the trailing marker, null for none
     * @return the new source
     */
    public final Observable<T> intersperse(T start, T separator, T end) {
        return new ObservableIntersperse<>(this, start, separator, end);
    }

    public final Observable<T> take(long n) {
        return new ObservableTake<>(this, n);
    }

    /**
     * Exposes this source as a Reactive Streams {@link Publisher}, translating
     * {@code request(n)} demand into acknowledgments.
     *
     * @param scheduler the scheduler the producers of this source run on
     * @return the publisher
     */
    public final Publisher<T> toReactivePublisher(Scheduler scheduler) {
        return new ObservableToPublisher<>(this, scheduler);
    }

    public final Cancelable subscribe(Function<? super T, ? extends Deferred<Ack>> onNext, Scheduler scheduler) {
        return subscribe(new LambdaSubscriber<T>(onNext, UnsignalledExceptions::onErrorDropped, () -> { }, scheduler));
    }

    public final Cancelable subscribe(Consumer<? super T> onNext, Consumer<Throwable> onError,
            Runnable onComplete, Scheduler scheduler) {
        Objects.requireNonNull(onNext, "onNext");
        return subscribe(new LambdaSubscriber<T>(v -> {
            onNext.accept(v);
            return Ack.CONTINUE;
        }, onError, onComplete, scheduler));
    }

    /**
     * Subscribes a fresh {@link TestSubscriber} acknowledging every element with CONTINUE.
     *
     * @param scheduler the scheduler of the test subscriber
     * @return the subscribed test subscriber
     */
    public final TestSubscriber<T> test(Scheduler scheduler) {
        TestSubscriber<T> ts = new TestSubscriber<>(scheduler);
        subscribe(ts);
        return ts;
    }
}
