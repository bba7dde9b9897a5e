package ackflow.observable;

import java.util.Objects;

/**
 * An operator that wraps a single upstream source.
 *
 * @param <T> the upstream value type
 * @param <R> the output value type
 */
public abstract class ObservableSource<T, R> extends Observable<R> {

    protected final Observable<? extends T> source;

    protected ObservableSource(Observable<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public final Observable<? extends T> source() {
        return source;
    }
}
