package ackflow.scheduler;

import java.util.ArrayDeque;
import java.util.Objects;

import ackflow.flow.Cancelable;
import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * Executes tasks on the caller's thread, but never recursively: a task
 * scheduled while another one is running on the same thread is queued and
 * runs once the current one returns.
 * <p>
 * This turns the forced yields of an {@link ExecutionModel} into a loop over
 * a thread-local work queue, so a whole stream can be consumed on the
 * subscribing thread with bounded stack depth.
 */
public final class TrampolineScheduler implements Scheduler {

    static final ThreadLocal<ArrayDeque<TrampolineTask>> QUEUE = new ThreadLocal<>();

    private static final TrampolineScheduler INSTANCE = new TrampolineScheduler(ExecutionModel.DEFAULT);

    /**
     * @return the shared instance using {@link ExecutionModel#DEFAULT}
     */
    public static TrampolineScheduler instance() {
        return INSTANCE;
    }

    final ExecutionModel executionModel;

    TrampolineScheduler(ExecutionModel executionModel) {
        this.executionModel = executionModel;
    }

    @Override
    public Cancelable schedule(Runnable task) {
        TrampolineTask t = new TrampolineTask(Objects.requireNonNull(task, "task"));

        ArrayDeque<TrampolineTask> q = QUEUE.get();
        if (q != null) {
            q.offer(t);
            return t;
        }

        q = new ArrayDeque<>();
        QUEUE.set(q);
        try {
            t.run();
            while ((t = q.poll()) != null) {
                t.run();
            }
        } finally {
            QUEUE.remove();
        }
        return Cancelable.EMPTY;
    }

    @Override
    public ExecutionModel executionModel() {
        return executionModel;
    }

    @Override
    public Scheduler withExecutionModel(ExecutionModel executionModel) {
        if (this.executionModel.equals(executionModel)) {
            return this;
        }
        return new TrampolineScheduler(Objects.requireNonNull(executionModel, "executionModel"));
    }

    @Override
    public String toString() {
        return "TrampolineScheduler[" + executionModel + "]";
    }

    static final class TrampolineTask implements Runnable, Cancelable {

        final Runnable task;

        volatile boolean cancelled;

        TrampolineTask(Runnable task) {
            this.task = task;
        }

        @Override
        public void run() {
            if (cancelled) {
                return;
            }
            try {
                task.run();
            } catch (Throwable ex) {
                ExceptionHelper.throwIfFatal(ex);
                UnsignalledExceptions.onErrorDropped(ex);
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
        }
    }
}
