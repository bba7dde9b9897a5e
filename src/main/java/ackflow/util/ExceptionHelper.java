package ackflow.util;

/**
 * Classifies throwables caught around user callbacks.
 */
public enum ExceptionHelper {
    ;

    /**
     * Rethrows the throwable if it is one the JVM cannot recover from:
     * {@code VirtualMachineError} (stack overflow, out of memory),
     * {@code ThreadDeath} or {@code LinkageError}.
     * Anything else is left for the caller to route.
     *
     * @param t the throwable caught
     */
    @SuppressWarnings("deprecation")
    public static void throwIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        } else if (t instanceof ThreadDeath) {
            throw (ThreadDeath) t;
        } else if (t instanceof LinkageError) {
            throw (LinkageError) t;
        }
    }

    /**
     * Combines a primary failure with a secondary one that happened while
     * reacting to it.
     *
     * @param primary the failure that should be reported
     * @param secondary the failure that occurred while handling it, may be null
     * @return the primary failure
     */
    public static Throwable suppress(Throwable primary, Throwable secondary) {
        if (secondary != null && secondary != primary) {
            primary.addSuppressed(secondary);
        }
        return primary;
    }
}
