package ackflow.scheduler;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import ackflow.flow.Cancelable;
import ackflow.util.ExceptionHelper;
import ackflow.util.UnsignalledExceptions;

/**
 * A scheduler which uses a backing ExecutorService to run the asynchronous
 * continuations of producers.
 * <p>
 * Failures escaping a task are routed to {@link UnsignalledExceptions}
 * instead of being captured by the executor's {@link Future}.
 */
public final class ExecutorServiceScheduler implements Scheduler {

    final ExecutorService executor;

    final ExecutionModel executionModel;

    public ExecutorServiceScheduler(ExecutorService executor) {
        this(executor, ExecutionModel.DEFAULT);
    }

    public ExecutorServiceScheduler(ExecutorService executor, ExecutionModel executionModel) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.executionModel = Objects.requireNonNull(executionModel, "executionModel");
    }

    @Override
    public Cancelable schedule(Runnable task) {
        Objects.requireNonNull(task, "task");
        Future<?> f;
        try {
            f = executor.submit(() -> {
                try {
                    task.run();
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    UnsignalledExceptions.onErrorDropped(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            return REJECTED;
        }
        return () -> f.cancel(false);
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
        return new ExecutorServiceScheduler(executor, executionModel);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    @Override
    public String toString() {
        return "ExecutorServiceScheduler[" + executor + ", " + executionModel + "]";
    }
}
