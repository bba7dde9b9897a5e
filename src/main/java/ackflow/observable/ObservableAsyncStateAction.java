package ackflow.observable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Function;

import ackflow.flow.Ack;
import ackflow.flow.Cancelable;
import ackflow.flow.Deferred;
import ackflow.flow.Subscriber;
import ackflow.flow.Transition;
import ackflow.scheduler.ExecutionModel;
import ackflow.util.CancelableHelper;
import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * Generates an infinite sequence by repeatedly applying a state transition
 * that returns its {@code (value, nextState)} pair as a {@link Deferred}.
 * <p>
 * Steps whose deferred and acknowledgment are both already resolved run in a
 * loop on the current call stack, as long as the subscriber's
 * {@link ExecutionModel} permits; each step spends two frames, so a
 * {@code batched(n)} model allows {@code n / 2} synchronous steps. When the
 * model refuses, or when the deferred or the acknowledgment is still pending,
 * the loop is resubmitted to the subscriber's scheduler as a new task and the
 * frame count starts over.
 * <p>
 * A failed or throwing step terminates the sequence with onError. The
 * sequence never completes on its own.
 *
 * @param <A> the emitted value type
 * @param <S> the state type
 */
final class ObservableAsyncStateAction<A, S> extends Observable<A> {

    final Function<S, Deferred<Transition<A, S>>> step;

    final S seed;

    ObservableAsyncStateAction(Function<S, Deferred<Transition<A, S>>> step, S seed) {
        this.step = Objects.requireNonNull(step, "step");
        this.seed = seed;
    }

    @Override
    public Cancelable subscribe(Subscriber<? super A> s) {
        AsyncStateActionSubscription<A, S> parent = new AsyncStateActionSubscription<>(s, step);
        parent.start(seed);
        return parent;
    }

    static final class AsyncStateActionSubscription<A, S> implements Cancelable {

        /** Frames one generator step consumes: the deferred computation plus the delivery. */
        static final int FRAMES_PER_STEP = 2;

        final Subscriber<? super A> actual;

        final Function<S, Deferred<Transition<A, S>>> step;

        final ExecutionModel executionModel;

        /** Set on cancel() and after the terminal signal. */
        volatile boolean cancelled;

        volatile Cancelable task;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<AsyncStateActionSubscription, Cancelable> TASK =
                AtomicReferenceFieldUpdater.newUpdater(AsyncStateActionSubscription.class, Cancelable.class, "task");

        AsyncStateActionSubscription(Subscriber<? super A> actual, Function<S, Deferred<Transition<A, S>>> step) {
            this.actual = actual;
            this.step = step;
            this.executionModel = actual.scheduler().executionModel();
        }

        void start(S seed) {
            if (executionModel.canRunSynchronously(0)) {
                loop(seed);
            } else {
                scheduleLoop(seed);
            }
        }

        void scheduleLoop(S state) {
            if (!cancelled) {
                CancelableHelper.replace(TASK, this, actual.scheduler().schedule(() -> loop(state)));
            }
        }

        void loop(S state) {
            int steps = 0;

            for (;;) {
                if (cancelled) {
                    return;
                }

                Deferred<Transition<A, S>> d;
                try {
                    d = Objects.requireNonNull(step.apply(state), "The state transition returned a null Deferred");
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    signalError(e);
                    return;
                }

                if (!d.isCompleted()) {
                    d.whenComplete(this::onAsyncTransition);
                    return;
                }
                if (d.error() != null) {
                    signalError(d.error());
                    return;
                }

                Transition<A, S> t = d.value();
                Deferred<Ack> ack = send(t);
                if (ack == null) {
                    return;
                }
                state = t.nextState();
                steps++;

                if (!ack.isCompleted()) {
                    continueAfter(ack, state);
                    return;
                }
                if (ack.value() != Ack.CONTINUE) {
                    dropFailedAck(ack);
                    return;
                }
                if (!executionModel.canRunSynchronously(steps * FRAMES_PER_STEP)) {
                    scheduleLoop(state);
                    return;
                }
            }
        }

        void onAsyncTransition(Transition<A, S> t, Throwable e) {
            if (cancelled) {
                return;
            }
            if (e != null) {
                signalError(e);
                return;
            }
            Deferred<Ack> ack = send(t);
            if (ack != null) {
                continueAfter(ack, t.nextState());
            }
        }

        /**
         * Delivers the value of the transition.
         * @return the acknowledgment or null if the loop has to end
         */
        Deferred<Ack> send(Transition<A, S> t) {
            if (t == null) {
                signalError(new NullPointerException("The state transition resolved to a null Transition"));
                return null;
            }
            try {
                return Objects.requireNonNull(actual.onNext(t.value()), "The subscriber returned a null acknowledgment");
            } catch (Throwable e) {
                ExceptionHelper.throwIfFatal(e);
                cancelled = true;
                UnsignalledExceptions.onErrorDropped(e);
                return null;
            }
        }

        void continueAfter(Deferred<Ack> ack, S next) {
            ack.whenComplete((r, e) -> {
                if (e != null) {
                    UnsignalledExceptions.onErrorDropped(e);
                } else if (r == Ack.CONTINUE) {
                    scheduleLoop(next);
                }
            });
        }

        static void dropFailedAck(Deferred<Ack> ack) {
            Throwable e = ack.error();
            if (e != null) {
                UnsignalledExceptions.onErrorDropped(e);
            }
        }

        void signalError(Throwable e) {
            if (cancelled) {
                UnsignalledExceptions.onErrorDropped(e);
                return;
            }
            cancelled = true;
            actual.onError(e);
        }

        @Override
        public void cancel() {
            cancelled = true;
            CancelableHelper.terminate(TASK, this);
        }
    }
}
