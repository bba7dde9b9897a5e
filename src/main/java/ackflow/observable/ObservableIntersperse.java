package ackflow.observable;

import java.util.Objects;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.scheduler.Scheduler;
import ackflow.util.AckHelper;
import ackflow.util.CancelableHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * Injects an optional start marker before the first element, a separator
 * between consecutive elements and an optional end marker after the last one.
 * <p>
 * Markers are only emitted once at least one upstream element has been seen:
 * an empty source stays empty. Every element costs two downstream sends whose
 * acknowledgments are chained, and the chained acknowledgment is what the
 * upstream receives, so the upstream never runs ahead of the downstream.
 *
 * @param <T> the value type
 */
final class ObservableIntersperse<T> extends ObservableSource<T, T> {

    final T start;

    final T separator;

    final T end;

    ObservableIntersperse(Observable<? extends T> source, T start, T separator, T end) {
        super(source);
        this.start = start;
        this.separator = Objects.requireNonNull(separator, "separator");
        this.end = end;
    }

    @Override
    public Cancelable subscribe(Subscriber<? super T> s) {
        Cancelable upstream = source.subscribe(new IntersperseSubscriber<>(s, start, separator, end));
        return CancelableHelper.once(upstream::cancel);
    }

    static final class IntersperseSubscriber<T> implements Subscriber<T> {

        final Subscriber<? super T> actual;

        final T start;

        final T separator;

        final T end;

        /** Whether an upstream element has been forwarded already. */
        boolean atLeastOne;

        /** The chained acknowledgment of the last onNext, terminal signals wait for it. */
        Deferred<Ack> downstreamAck = Ack.CONTINUE;

        IntersperseSubscriber(Subscriber<? super T> actual, T start, T separator, T end) {
            this.actual = actual;
            this.start = start;
            this.separator = separator;
            this.end = end;
        }

        @Override
        public Scheduler scheduler() {
            return actual.scheduler();
        }

        @Override
        public Deferred<Ack> onNext(T t) {
            Deferred<Ack> first;
            if (!atLeastOne) {
                atLeastOne = true;
                first = start != null ? actual.onNext(start) : Ack.CONTINUE;
            } else {
                first = actual.onNext(separator);
            }

            Deferred<Ack> ack = AckHelper.syncFlatMap(first, r -> r == Ack.CONTINUE ? actual.onNext(t) : r);
            downstreamAck = ack;
            return ack;
        }

        @Override
        public void onError(Throwable t) {
            AckHelper.syncOnContinue(downstreamAck, () -> actual.onError(t));
            AckHelper.syncOnStopOrFailure(downstreamAck, e -> UnsignalledExceptions.onErrorDropped(t));
        }

        @Override
        public void onComplete() {
            AckHelper.syncOnContinue(downstreamAck, () -> {
                if (atLeastOne && end != null) {
                    AckHelper.syncOnContinue(actual.onNext(end), actual::onComplete);
                } else {
                    actual.onComplete();
                }
            });
            AckHelper.syncOnStopOrFailure(downstreamAck, e -> {
                if (e != null) {
                    UnsignalledExceptions.onErrorDropped(e);
                }
            });
        }
    }
}
