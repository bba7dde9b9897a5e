package ackflow.flow;

import java.util.Objects;

/**
 * One step of a state machine: the value to emit and the state to
 * continue from.
 *
 * @param <A> the emitted value type
 * @param <S> the state type
 */
public final class Transition<A, S> {

    final A value;

    final S nextState;

    Transition(A value, S nextState) {
        this.value = value;
        this.nextState = nextState;
    }

    public static <A, S> Transition<A, S> of(A value, S nextState) {
        return new Transition<>(Objects.requireNonNull(value, "value"), nextState);
    }

    public A value() {
        return value;
    }

    public S nextState() {
        return nextState;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transition)) {
            return false;
        }
        Transition<?, ?> other = (Transition<?, ?>) o;
        return value.equals(other.value) && Objects.equals(nextState, other.nextState);
    }

    @Override
    public int hashCode() {
        return 31 * value.hashCode() + Objects.hashCode(nextState);
    }

    @Override
    public String toString() {
        return "Transition[value=" + value + ", nextState=" + nextState + "]";
    }
}
