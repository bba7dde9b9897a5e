package ackflow.flow;

/**
 * A handle that stops the upstream producer of a subscription.
 * <p>Call to the cancel method is/should be idempotent.
 */
@FunctionalInterface
public interface Cancelable {
    /**
     * Cancel the underlying subscription or task in a best-effort manner.
     * <p>Call to this method is/should be idempotent.
     */
    void cancel();

    /**
     * A no-op instance for sources that have nothing left to cancel.
     */
    Cancelable EMPTY = new Cancelable() {
        @Override
        public void cancel() {
            // deliberately no-op
        }

        @Override
        public String toString() {
            return "Cancelable.EMPTY";
        }
    };
}
