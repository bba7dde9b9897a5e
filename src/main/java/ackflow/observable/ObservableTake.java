package ackflow.observable;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.scheduler.Scheduler;
import ackflow.util.AckHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * Takes only the first N values from the source.
 * <p>
 * The N-th element is answered with STOP towards the upstream right away,
 * while the downstream completion waits for its own acknowledgment of that
 * element. If N is zero the source is not subscribed at all.
 *
 * @param <T> the value type
 */
final class ObservableTake<T> extends ObservableSource<T, T> {

    final long n;

    ObservableTake(Observable<? extends T> source, long n) {
        super(source);
        if (n < 0) {
            throw new IllegalArgumentException("n >= 0 required but it was " + n);
        }
        this.n = n;
    }

    @Override
    public Cancelable subscribe(Subscriber<? super T> s) {
        if (n == 0L) {
            s.onComplete();
            return Cancelable.EMPTY;
        }
        return source.subscribe(new TakeSubscriber<>(s, n));
    }

    static final class TakeSubscriber<T> implements Subscriber<T> {

        final Subscriber<? super T> actual;

        long remaining;

        boolean done;

        TakeSubscriber(Subscriber<? super T> actual, long n) {
            this.actual = actual;
            this.remaining = n;
        }

        @Override
        public Scheduler scheduler() {
            return actual.scheduler();
        }

        @Override
        public Deferred<Ack> onNext(T t) {
            if (done) {
                UnsignalledExceptions.onNextDropped(t);
                return Ack.STOP;
            }
            if (--remaining != 0L) {
                return actual.onNext(t);
            }
            done = true;
            AckHelper.syncOnContinue(actual.onNext(t), actual::onComplete);
            return Ack.STOP;
        }

        @Override
        public void onError(Throwable t) {
            if (done) {
                UnsignalledExceptions.onErrorDropped(t);
                return;
            }
            done = true;
            actual.onError(t);
        }

        @Override
        public void onComplete() {
            if (done) {
                return;
            }
            done = true;
            actual.onComplete();
        }
    }
}
