package ackflow.observable;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.scheduler.ExecutionModel;
import ackflow.util.AckHelper;
import ackflow.util.CancelableHelper;
import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * Emits the contents of an Iterable source, one frame of the
 * subscriber's {@link ExecutionModel} per element.
 *
 * @param <T> the value type
 */
final class ObservableIterable<T> extends Observable<T> {

    final Iterable<? extends T> iterable;

    ObservableIterable(Iterable<? extends T> iterable) {
        this.iterable = Objects.requireNonNull(iterable, "iterable");
    }

    @Override
    public Cancelable subscribe(Subscriber<? super T> s) {
        Iterator<? extends T> it;
        boolean hasNext;
        try {
            it = iterable.iterator();
            hasNext = it.hasNext();
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            s.onError(e);
            return Cancelable.EMPTY;
        }
        if (!hasNext) {
            s.onComplete();
            return Cancelable.EMPTY;
        }

        IterableSubscription<T> parent = new IterableSubscription<>(s, it);
        parent.start();
        return parent;
    }

    static final class IterableSubscription<T> implements Cancelable, Runnable {

        final Subscriber<? super T> actual;

        final Iterator<? extends T> iterator;

        final ExecutionModel executionModel;

        volatile boolean cancelled;

        volatile Cancelable task;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<IterableSubscription, Cancelable> TASK =
                AtomicReferenceFieldUpdater.newUpdater(IterableSubscription.class, Cancelable.class, "task");

        IterableSubscription(Subscriber<? super T> actual, Iterator<? extends T> iterator) {
            this.actual = actual;
            this.iterator = iterator;
            this.executionModel = actual.scheduler().executionModel();
        }

        void start() {
            if (executionModel.canRunSynchronously(0)) {
                run();
            } else {
                scheduleNext();
            }
        }

        void scheduleNext() {
            if (!cancelled) {
                CancelableHelper.replace(TASK, this, actual.scheduler().schedule(this));
            }
        }

        @Override
        public void run() {
            final Subscriber<? super T> a = actual;
            final Iterator<? extends T> it = iterator;
            int frames = 0;

            for (;;) {
                if (cancelled) {
                    return;
                }

                T v;
                try {
                    v = Objects.requireNonNull(it.next(), "The iterator returned a null value");
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    cancelled = true;
                    a.onError(e);
                    return;
                }

                Deferred<Ack> ack;
                try {
                    ack = Objects.requireNonNull(a.onNext(v), "The subscriber returned a null acknowledgment");
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    cancelled = true;
                    UnsignalledExceptions.onErrorDropped(e);
                    return;
                }

                boolean hasNext;
                Throwable failure = null;
                try {
                    hasNext = it.hasNext();
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    hasNext = false;
                    failure = e;
                }

                if (!hasNext) {
                    Throwable f = failure;
                    AckHelper.syncOnContinue(ack, () -> {
                        if (!cancelled) {
                            cancelled = true;
                            if (f != null) {
                                a.onError(f);
                            } else {
                                a.onComplete();
                            }
                        }
                    });
                    return;
                }

                if (!ack.isCompleted()) {
                    ack.whenComplete((r, e) -> {
                        if (e != null) {
                            UnsignalledExceptions.onErrorDropped(e);
                        } else if (r == Ack.CONTINUE) {
                            scheduleNext();
                        }
                    });
                    return;
                }
                if (ack.value() != Ack.CONTINUE) {
                    if (ack.error() != null) {
                        UnsignalledExceptions.onErrorDropped(ack.error());
                    }
                    return;
                }

                if (!executionModel.canRunSynchronously(++frames)) {
                    scheduleNext();
                    return;
                }
            }
        }

        @Override
        public void cancel() {
            if (!cancelled) {
                cancelled = true;
                CancelableHelper.terminate(TASK, this);
            }
        }
    }
}
