
/**
 * Acknowledgment-driven sources and operators, assembled through the fluent
 * {@link ackflow.observable.Observable} base class.
 */
package ackflow.observable;
