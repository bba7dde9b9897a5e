package ackflow.observable;

import java.util.Objects;

import ackflow.flow.Cancelable;
import ackflow.flow.Subscriber;

/**
 * Emits a constant Throwable to every subscriber.
 *
 * @param <T> the value type
 */
final class ObservableError<T> extends Observable<T> {

    final Throwable error;

    ObservableError(Throwable error) {
        this.error = Objects.requireNonNull(error, "error");
    }

    @Override
    public Cancelable subscribe(Subscriber<? super T> s) {
        s.onError(error);
        return Cancelable.EMPTY;
    }
}
