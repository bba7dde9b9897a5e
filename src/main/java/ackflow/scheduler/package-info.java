
/**
 * Asynchronous boundaries and the {@link ackflow.scheduler.ExecutionModel} that decides when
 * producers have to use them.
 */
package ackflow.scheduler;
