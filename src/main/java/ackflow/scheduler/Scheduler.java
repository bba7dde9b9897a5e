package ackflow.scheduler;

import ackflow.flow.Cancelable;

/**
 * Provides an abstract asynchronous boundary to producers, together with
 * the {@link ExecutionModel} that tells them when to use it.
 */
public interface Scheduler {
    /**
     * Schedules the given task for non-delayed execution.
     *
     * <p>
     * This method is safe to be called from multiple threads but there are no
     * ordering guarantees between tasks submitted from different threads.
     *
     * @param task the task to execute
     *
     * @return the Cancelable instance that let's one cancel this particular task.
     * If the Scheduler has been shut down, the {@link #REJECTED} Cancelable instance is returned.
     */
    Cancelable schedule(Runnable task);

    /**
     * The fairness policy producers should follow on this scheduler.
     * @return the execution model, never null
     */
    ExecutionModel executionModel();

    /**
     * Returns a scheduler that submits to the same underlying resources but
     * reports a different execution model.
     *
     * @param executionModel the execution model to report
     * @return the scheduler view
     */
    Scheduler withExecutionModel(ExecutionModel executionModel);

    /**
     * Instructs this Scheduler to release all resources and reject
     * any new tasks to be executed.
     */
    default void shutdown() {

    }

    /**
     * Returned by schedule() if the Scheduler has been shut down.
     */
    Cancelable REJECTED = new Cancelable() {
        @Override
        public void cancel() {
            // deliberately no-op
        }

        @Override
        public String toString() {
            return "Rejected task";
        }
    };
}
