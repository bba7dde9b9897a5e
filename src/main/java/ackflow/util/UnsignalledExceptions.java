package ackflow.util;

import java.util.function.Consumer;

/**
 * Global sink for failures and values that cannot travel through a
 * stream anymore, typically because the subscriber already answered
 * {@link ackflow.flow.Ack#STOP} or the sequence already terminated.
 * <p>
 * By default dropped errors are printed to the standard error stream;
 * applications can install their own consumer, e.g. to hand them to a
 * logger.
 */
public final class UnsignalledExceptions {

    private UnsignalledExceptions() {
        throw new IllegalStateException("No instances!");
    }

    private static volatile Consumer<Throwable> errorConsumer;

    /**
     * @return the installed error consumer or null if the default applies
     */
    public static Consumer<Throwable> getErrorConsumer() {
        return errorConsumer;
    }

    /**
     * Installs the consumer of dropped errors. Null restores the default.
     *
     * @param newConsumer the new consumer, may be null
     */
    public static void setErrorConsumer(Consumer<Throwable> newConsumer) {
        errorConsumer = newConsumer;
    }

    /**
     * Hook for a value that was produced but could not be delivered.
     *
     * @param <T> the value type
     * @param t the dropped value
     */
    public static <T> void onNextDropped(T t) {
    }

    /**
     * Routes an error that could not be signalled to a subscriber.
     *
     * @param e the error, a NullPointerException is reported in its place if null
     */
    public static void onErrorDropped(Throwable e) {
        ExceptionHelper.throwIfFatal(e);
        if (e == null) {
            e = new NullPointerException("onErrorDropped called with a null Throwable");
        }

        Consumer<Throwable> h = errorConsumer;
        if (h == null) {
            e.printStackTrace();
            return;
        }
        try {
            h.accept(e);
        } catch (Throwable ex) {
            ExceptionHelper.throwIfFatal(ex);
            ex.addSuppressed(e);
            ex.printStackTrace();
        }
    }
}
