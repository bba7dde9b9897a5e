package ackflow.observable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Promise;
import ackflow.flow.Subscriber;
import ackflow.scheduler.Scheduler;
import ackflow.util.CancelableHelper;

/**
 * Exposes an acknowledgment-driven source as a Reactive Streams Publisher.
 * <p>
 * The source is subscribed on the first {@code request(n)}. Every element is
 * answered with a Promise that resolves to CONTINUE once the element has been
 * delivered against outstanding demand, or to STOP on cancel and after a
 * terminal signal; at most one element therefore waits for demand at any
 * time. Delivery and terminal signals, including the error of a
 * non-positive request, are serialized through a work-in-progress drain
 * loop. Requests after cancel or termination are ignored.
 *
 * @param <T> the value type
 */
final class ObservableToPublisher<T> implements Publisher<T> {

    final Observable<? extends T> source;

    final Scheduler scheduler;

    ObservableToPublisher(Observable<? extends T> source, Scheduler scheduler) {
        this.source = Objects.requireNonNull(source, "source");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public void subscribe(org.reactivestreams.Subscriber<? super T> s) {
        Objects.requireNonNull(s, "s");
        s.onSubscribe(new ToPublisherSubscriber<>(s, source, scheduler));
    }

    static final class ToPublisherSubscriber<T> implements Subscriber<T>, Subscription {

        final org.reactivestreams.Subscriber<? super T> actual;

        final Observable<? extends T> source;

        final Scheduler scheduler;

        volatile long requested;
        @SuppressWarnings("rawtypes")
        static final AtomicLongFieldUpdater<ToPublisherSubscriber> REQUESTED =
                AtomicLongFieldUpdater.newUpdater(ToPublisherSubscriber.class, "requested");

        volatile int wip;
        @SuppressWarnings("rawtypes")
        static final AtomicIntegerFieldUpdater<ToPublisherSubscriber> WIP =
                AtomicIntegerFieldUpdater.newUpdater(ToPublisherSubscriber.class, "wip");

        volatile int once;
        @SuppressWarnings("rawtypes")
        static final AtomicIntegerFieldUpdater<ToPublisherSubscriber> ONCE =
                AtomicIntegerFieldUpdater.newUpdater(ToPublisherSubscriber.class, "once");

        volatile Cancelable upstream;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<ToPublisherSubscriber, Cancelable> UPSTREAM =
                AtomicReferenceFieldUpdater.newUpdater(ToPublisherSubscriber.class, Cancelable.class, "upstream");

        /** The element waiting for demand. */
        volatile T item;

        /** The acknowledgment of {@link #item}, resolved once it is delivered. */
        volatile Promise<Ack> parked;

        volatile boolean done;

        Throwable error;

        volatile boolean cancelled;

        /** Set by a non-positive request, signalled by the drain loop. */
        volatile Throwable requestError;

        volatile boolean terminated;

        ToPublisherSubscriber(org.reactivestreams.Subscriber<? super T> actual, Observable<? extends T> source,
                Scheduler scheduler) {
            this.actual = actual;
            this.source = source;
            this.scheduler = scheduler;
        }

        @Override
        public Scheduler scheduler() {
            return scheduler;
        }

        @Override
        public Deferred<Ack> onNext(T t) {
            if (cancelled || terminated) {
                return Ack.STOP;
            }
            Promise<Ack> p = new Promise<>();
            parked = p;
            item = t;
            drain();
            return p;
        }

        @Override
        public void onError(Throwable t) {
            error = t;
            done = true;
            drain();
        }

        @Override
        public void onComplete() {
            done = true;
            drain();
        }

        @Override
        public void request(long n) {
            if (cancelled || terminated || requestError != null) {
                return;
            }
            if (n <= 0L) {
                requestError = new IllegalArgumentException(
                        "Rule 3.9 violated: positive request amount required but it was " + n);
                CancelableHelper.terminate(UPSTREAM, this);
                drain();
                return;
            }
            for (;;) {
                long r = requested;
                long u = r + n;
                if (u < 0L) {
                    u = Long.MAX_VALUE;
                }
                if (REQUESTED.compareAndSet(this, r, u)) {
                    break;
                }
            }
            if (once == 0 && ONCE.compareAndSet(this, 0, 1)) {
                CancelableHelper.replace(UPSTREAM, this, source.subscribe(this));
            } else {
                drain();
            }
        }

        @Override
        public void cancel() {
            if (!cancelled) {
                cancelled = true;
                CancelableHelper.terminate(UPSTREAM, this);
                drain();
            }
        }

        void drain() {
            if (WIP.getAndIncrement(this) != 0) {
                return;
            }
            int missed = 1;

            for (;;) {
                if (cancelled || terminated) {
                    item = null;
                    resolve(Ack.STOP);
                } else {
                    Throwable re = requestError;
                    if (re != null) {
                        item = null;
                        resolve(Ack.STOP);
                        terminated = true;
                        actual.onError(re);
                    } else {
                        drainItem();
                    }
                }

                missed = WIP.addAndGet(this, -missed);
                if (missed == 0) {
                    break;
                }
            }
        }

        void drainItem() {
            T v = item;
            if (v != null && requested != 0L) {
                item = null;
                actual.onNext(v);
                if (requested != Long.MAX_VALUE) {
                    REQUESTED.decrementAndGet(this);
                }
                resolve(cancelled ? Ack.STOP : Ack.CONTINUE);
            }
            if (done && item == null) {
                terminated = true;
                Throwable e = error;
                if (e != null) {
                    actual.onError(e);
                } else {
                    actual.onComplete();
                }
            }
        }

        void resolve(Ack ack) {
            Promise<Ack> p = parked;
            if (p != null) {
                parked = null;
                p.complete(ack);
            }
        }
    }
}
