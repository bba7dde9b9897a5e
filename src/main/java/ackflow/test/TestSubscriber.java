package ackflow.test;

import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import ackflow.flow.Ack;
import ackflow.flow.Deferred;
import ackflow.flow.Promise;
import ackflow.flow.Subscriber;
import ackflow.scheduler.Scheduler;

/**
 * A Subscriber implementation that records every signal, hosts assertions on
 * them and lets the test decide how each element is acknowledged.
 * <p>
 * Acknowledgment modes:
 * <ul>
 * <li>{@link #ackWith(Ack)}: answer every element synchronously (CONTINUE by default)</li>
 * <li>{@link #stopAfter(int)}: answer CONTINUE until the given count, then STOP</li>
 * <li>{@link #ackAsync()}: answer through a Promise resolved by a task on the scheduler</li>
 * <li>{@link #manualAck()}: answer through a Promise the test resolves via {@link #ack(Ack)}</li>
 * </ul>
 * <p>
 * The subscriber also checks the producer side of the protocol: an element
 * arriving while the previous acknowledgment is pending or after STOP, or a
 * terminal signal arriving while an acknowledgment is pending, after STOP or
 * after another terminal signal, is recorded as an {@link IllegalStateException}
 * among the errors.
 * <p>
 * You should avoid calling the assertXXX methods asynchronously.
 *
 * @param <T> the value type.
 */
public class TestSubscriber<T> implements Subscriber<T> {

    enum AckMode {
        FIXED,
        STOP_AFTER,
        ASYNC,
        MANUAL
    }

    final Scheduler scheduler;

    final List<T> values;

    final List<Throwable> errors;

    final CountDownLatch cdl;

    int completions;

    /** Incremented once a value has been added to values. */
    volatile int volatileSize;

    AckMode mode = AckMode.FIXED;

    Ack fixedAck = Ack.CONTINUE;

    int stopAfter;

    /** The last acknowledgment handed to the producer. */
    volatile Deferred<Ack> lastAck = Ack.CONTINUE;

    /** The acknowledgment the test still has to resolve in manual mode. */
    volatile Promise<Ack> pending;

    public TestSubscriber(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.values = Collections.synchronizedList(new ArrayList<>());
        this.errors = Collections.synchronizedList(new ArrayList<>());
        this.cdl = new CountDownLatch(1);
    }

    /**
     * Answers every element with the given acknowledgment.
     * @param ack the acknowledgment
     * @return this
     */
    public final TestSubscriber<T> ackWith(Ack ack) {
        this.mode = AckMode.FIXED;
        this.fixedAck = Objects.requireNonNull(ack, "ack");
        return this;
    }

    /**
     * Answers CONTINUE to the first {@code n - 1} elements and STOP to the n-th one.
     * @param n the number of elements to accept, positive
     * @return this
     */
    public final TestSubscriber<T> stopAfter(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n > 0 required but it was " + n);
        }
        this.mode = AckMode.STOP_AFTER;
        this.stopAfter = n;
        return this;
    }

    /**
     * Answers CONTINUE asynchronously through a task scheduled on the scheduler.
     * @return this
     */
    public final TestSubscriber<T> ackAsync() {
        this.mode = AckMode.ASYNC;
        return this;
    }

    /**
     * Answers every element with a pending Promise the test resolves with {@link #ack(Ack)}.
     * @return this
     */
    public final TestSubscriber<T> manualAck() {
        this.mode = AckMode.MANUAL;
        return this;
    }

    /**
     * Resolves the pending acknowledgment in manual mode.
     * @param ack the answer
     */
    public final void ack(Ack ack) {
        Promise<Ack> p = pending;
        if (p == null) {
            throw new IllegalStateException("No acknowledgment pending");
        }
        pending = null;
        p.complete(ack);
    }

    public final boolean hasPendingAck() {
        return pending != null;
    }

    @Override
    public final Scheduler scheduler() {
        return scheduler;
    }

    @Override
    public Deferred<Ack> onNext(T t) {
        verifyCanSend("onNext(" + t + ")");
        values.add(t);
        volatileSize++;

        Deferred<Ack> ack;
        switch (mode) {
            case STOP_AFTER:
                ack = values.size() >= stopAfter ? Ack.STOP : Ack.CONTINUE;
                break;
            case ASYNC: {
                Promise<Ack> p = new Promise<>();
                scheduler.schedule(() -> p.complete(Ack.CONTINUE));
                ack = p;
                break;
            }
            case MANUAL: {
                Promise<Ack> p = new Promise<>();
                pending = p;
                ack = p;
                break;
            }
            default:
                ack = fixedAck;
        }
        lastAck = ack;
        return ack;
    }

    @Override
    public void onError(Throwable t) {
        verifyCanSend("onError(" + t + ")");
        errors.add(t);
        cdl.countDown();
    }

    @Override
    public void onComplete() {
        verifyCanSend("onComplete()");
        completions++;
        cdl.countDown();
    }

    void verifyCanSend(String signal) {
        if (cdl.getCount() == 0) {
            errors.add(new IllegalStateException(signal + " after a terminal signal"));
            return;
        }
        Deferred<Ack> a = lastAck;
        if (!a.isCompleted()) {
            errors.add(new IllegalStateException(signal + " while the previous acknowledgment is pending"));
        } else if (a.value() != Ack.CONTINUE) {
            errors.add(new IllegalStateException(signal + " after the subscriber answered STOP"));
        }
    }

    /**
     * Prepares and throws an AssertionError exception based on the message, the active state and the potential
     * errors so far.
     *
     * @param message the message
     * @throws AssertionError as expected
     */
    final void assertionError(String message) {
        StringBuilder b = new StringBuilder();

        if (cdl.getCount() != 0) {
            b.append("(active) ");
        }
        b.append(message);

        List<Throwable> err = errors();
        if (!err.isEmpty()) {
            b.append(" (+ ")
              .append(err.size())
              .append(" errors)");
        }

        b.append("; values = ").append(volatileSize);

        AssertionError e = new AssertionError(b.toString());

        for (Throwable t : err) {
            e.addSuppressed(t);
        }

        throw e;
    }

    final String valueAndClass(Object o) {
        if (o == null) {
            return null;
        }
        return o + " (" + o.getClass().getSimpleName() + ")";
    }

    public final TestSubscriber<T> assertNoValues() {
        if (!values.isEmpty()) {
            assertionError("No values expected but received: [length = " + values.size() + "] " + values);
        }
        return this;
    }

    public final TestSubscriber<T> assertValueCount(int n) {
        int s = values.size();
        if (s != n) {
            assertionError("Different value count: expected = " + n + ", actual = " + s);
        }
        return this;
    }

    @SafeVarargs
    public final TestSubscriber<T> assertValues(T... expected) {
        List<T> actual = values();
        if (actual.size() != expected.length) {
            assertionError("Different value count: expected = [length = " + expected.length + "] "
                    + Arrays.toString(expected) + ", actual = [length = " + actual.size() + "] " + actual);
        }
        for (int i = 0; i < expected.length; i++) {
            if (!Objects.equals(expected[i], actual.get(i))) {
                assertionError("Values at " + i + " differ: expected = " + valueAndClass(expected[i])
                        + ", actual = " + valueAndClass(actual.get(i)));
            }
        }
        return this;
    }

    /**
     * Asserts that the TestSubscriber holds the specified values and has completed
     * without any error.
     * @param values the values to assert
     * @return this
     */
    @SafeVarargs
    public final TestSubscriber<T> assertResult(T... values) {
        return assertValues(values).assertComplete().assertNoError();
    }

    @SafeVarargs
    public final TestSubscriber<T> assertIncomplete(T... values) {
        return assertValues(values).assertNotComplete().assertNoError();
    }

    @SafeVarargs
    public final TestSubscriber<T> assertFailure(Throwable ex, T... values) {
        return assertValues(values).assertNotComplete().assertError(ex);
    }

    public final TestSubscriber<T> assertNoEvents() {
        return assertNoValues().assertNoError().assertNotComplete();
    }

    public final TestSubscriber<T> assertComplete() {
        int c = completions;
        if (c == 0) {
            assertionError("Not completed");
        }
        if (c > 1) {
            assertionError("Multiple completions: " + c);
        }
        return this;
    }

    public final TestSubscriber<T> assertNotComplete() {
        int c = completions;
        if (c == 1) {
            assertionError("Completed");
        }
        if (c > 1) {
            assertionError("Multiple completions: " + c);
        }
        return this;
    }

    public final TestSubscriber<T> assertNotTerminated() {
        if (cdl.getCount() == 0) {
            assertionError("Terminated");
        }
        return this;
    }

    public final TestSubscriber<T> assertNoError() {
        int s = errors.size();
        if (s == 1) {
            assertionError("Error present: " + valueAndClass(errors.get(0)));
        }
        if (s > 1) {
            assertionError("Multiple errors: " + s);
        }
        return this;
    }

    public final TestSubscriber<T> assertError(Throwable e) {
        int s = errors.size();
        if (s == 0) {
            assertionError("No error");
        }
        if (s == 1 && !Objects.equals(e, errors.get(0))) {
            assertionError("Errors differ: expected = " + valueAndClass(e) + ", actual = " + valueAndClass(errors.get(0)));
        }
        if (s > 1) {
            assertionError("Multiple errors: " + s);
        }
        return this;
    }

    public final TestSubscriber<T> assertError(Class<? extends Throwable> clazz) {
        int s = errors.size();
        if (s == 0) {
            assertionError("No error");
        }
        if (s == 1 && !clazz.isInstance(errors.get(0))) {
            assertionError("Error class incompatible: expected = " + clazz.getSimpleName() + ", actual = "
                    + valueAndClass(errors.get(0)));
        }
        if (s > 1) {
            assertionError("Multiple errors: " + s);
        }
        return this;
    }

    public final TestSubscriber<T> assertErrorMessage(String message) {
        int s = errors.size();
        if (s == 0) {
            assertionError("No error");
        }
        if (s == 1 && !Objects.equals(message, errors.get(0).getMessage())) {
            assertionError("Error messages differ: expected = \"" + message + "\", actual = \""
                    + errors.get(0).getMessage() + "\"");
        }
        if (s > 1) {
            assertionError("Multiple errors: " + s);
        }
        return this;
    }

    public final boolean await(long timeout, TimeUnit unit) {
        if (cdl.getCount() == 0) {
            return true;
        }
        try {
            return cdl.await(timeout, unit);
        } catch (InterruptedException ex) {
            assertionError("Wait interrupted");
            return false;
        }
    }

    public final List<T> values() {
        synchronized (values) {
            return new ArrayList<>(values);
        }
    }

    public final List<Throwable> errors() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }

    public final int completions() {
        return completions;
    }
}
