
/**
 * The acknowledgment protocol: {@link ackflow.flow.Subscriber subscribers} answer each element
 * with an {@link ackflow.flow.Ack}, possibly {@link ackflow.flow.Deferred deferred}, and every
 * subscription hands back a {@link ackflow.flow.Cancelable}.
 */
package ackflow.flow;
