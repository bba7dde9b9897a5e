package ackflow.observable;

import ackflow.flow.Cancelable;
import ackflow.flow.Subscriber;

/**
 * Represents an empty source which only calls onComplete.
 */
final class ObservableEmpty extends Observable<Object> {

    static final ObservableEmpty INSTANCE = new ObservableEmpty();

    private ObservableEmpty() {
        // deliberately no op
    }

    @Override
    public Cancelable subscribe(Subscriber<? super Object> s) {
        s.onComplete();
        return Cancelable.EMPTY;
    }
}
