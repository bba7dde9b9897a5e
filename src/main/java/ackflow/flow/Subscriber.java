package ackflow.flow;

import ackflow.scheduler.Scheduler;

/**
 * The consumer side of the acknowledgment protocol.
 * <p>
 * Elements arrive one at a time and each one must be answered with an
 * {@link Ack}, synchronously or through a pending {@link Deferred}. The
 * producer never sends the next element before the previous answer
 * resolved to {@link Ack#CONTINUE}, so the methods of a subscriber are
 * never invoked concurrently even if they run on different threads.
 * <p>
 * At most one of {@link #onComplete()} and {@link #onError(Throwable)} is
 * called, at most once, and never while an answer is outstanding.
 *
 * @param <T> the value type
 */
public interface Subscriber<T> {

    /**
     * The scheduler the producers feeding this subscriber run their
     * asynchronous boundaries on; its {@link ackflow.scheduler.ExecutionModel}
     * decides how much work may happen synchronously.
     * @return the scheduler, never null
     */
    Scheduler scheduler();

    /**
     * Receives the next element.
     * @param t the element, never null
     * @return the acknowledgment, possibly still pending
     */
    Deferred<Ack> onNext(T t);

    /**
     * Terminal failure of the sequence.
     * @param t the cause
     */
    void onError(Throwable t);

    /**
     * Terminal normal completion of the sequence.
     */
    void onComplete();
}
