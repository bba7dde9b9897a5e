package ackflow.flow;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.Assert;
import org.junit.Test;

public class PromiseTest {

    @Test
    public void pendingUntilCompleted() {
        Promise<Integer> p = new Promise<>();

        Assert.assertFalse(p.isCompleted());
        Assert.assertNull(p.value());
        Assert.assertNull(p.error());

        Assert.assertTrue(p.complete(1));

        Assert.assertTrue(p.isCompleted());
        Assert.assertEquals(1, p.value().intValue());
        Assert.assertNull(p.error());
    }

    @Test
    public void completesOnlyOnce() {
        Promise<Integer> p = new Promise<>();

        Assert.assertTrue(p.complete(1));
        Assert.assertFalse(p.complete(2));
        Assert.assertFalse(p.fail(new IOException()));

        Assert.assertEquals(1, p.value().intValue());
    }

    @Test
    public void failure() {
        Promise<Integer> p = new Promise<>();
        IOException ex = new IOException("forced failure");

        Assert.assertTrue(p.fail(ex));

        Assert.assertTrue(p.isCompleted());
        Assert.assertNull(p.value());
        Assert.assertSame(ex, p.error());
    }

    @Test
    public void callbacksRunInRegistrationOrder() {
        Promise<String> p = new Promise<>();
        List<String> calls = new ArrayList<>();

        p.whenComplete((v, e) -> calls.add("first:" + v));
        p.whenComplete((v, e) -> calls.add("second:" + v));
        p.whenComplete((v, e) -> calls.add("third:" + v));

        Assert.assertTrue(calls.isEmpty());

        p.complete("x");

        Assert.assertEquals(List.of("first:x", "second:x", "third:x"), calls);
    }

    @Test
    public void callbackAfterCompletionRunsImmediately() {
        Promise<String> p = new Promise<>();
        p.complete("x");

        List<String> calls = new ArrayList<>();
        p.whenComplete((v, e) -> calls.add(v));

        Assert.assertEquals(List.of("x"), calls);
    }

    @Test
    public void callbackReceivesError() {
        Promise<String> p = new Promise<>();
        IOException ex = new IOException();
        List<Throwable> errors = new ArrayList<>();

        p.whenComplete((v, e) -> {
            Assert.assertNull(v);
            errors.add(e);
        });
        p.fail(ex);

        Assert.assertEquals(List.of(ex), errors);
    }

    @Test
    public void failingCallbackDoesNotPreventOthers() {
        Promise<String> p = new Promise<>();
        List<String> calls = new ArrayList<>();

        p.whenComplete((v, e) -> {
            throw new IllegalStateException("forced failure");
        });
        p.whenComplete((v, e) -> calls.add(v));

        p.complete("x");

        Assert.assertEquals(List.of("x"), calls);
    }

    @Test(expected = NullPointerException.class)
    public void nullValueRejected() {
        new Promise<String>().complete(null);
    }

    @Test
    public void now() {
        Deferred<String> d = Deferred.now("x");

        Assert.assertTrue(d.isCompleted());
        Assert.assertEquals("x", d.value());
    }

    @Test
    public void failed() {
        IOException ex = new IOException();
        Deferred<String> d = Deferred.failed(ex);

        Assert.assertTrue(d.isCompleted());
        Assert.assertSame(ex, d.error());
    }

    @Test
    public void fromCompletedFuture() {
        Deferred<String> d = Deferred.fromFuture(CompletableFuture.completedFuture("x"));

        Assert.assertTrue(d.isCompleted());
        Assert.assertEquals("x", d.value());
    }

    @Test
    public void fromPendingFuture() {
        CompletableFuture<String> f = new CompletableFuture<>();
        Deferred<String> d = Deferred.fromFuture(f);

        Assert.assertFalse(d.isCompleted());

        f.complete("x");

        Assert.assertTrue(d.isCompleted());
        Assert.assertEquals("x", d.value());
    }

    @Test
    public void fromFutureUnwrapsCompletionException() {
        IOException ex = new IOException();
        CompletableFuture<String> f = new CompletableFuture<>();
        Deferred<String> d = Deferred.fromFuture(f.thenApply(v -> v));

        f.completeExceptionally(ex);

        Assert.assertSame(ex, d.error());
    }

    @Test
    public void fromFutureWithNullValueFails() {
        Deferred<String> d = Deferred.fromFuture(CompletableFuture.completedFuture(null));

        Assert.assertTrue(d.error() instanceof NullPointerException);
    }

    @Test
    public void ackIsCompleted() {
        Assert.assertTrue(Ack.CONTINUE.isCompleted());
        Assert.assertSame(Ack.STOP, Ack.STOP.value());
        Assert.assertNull(Ack.CONTINUE.error());

        List<Ack> calls = new ArrayList<>();
        Ack.STOP.whenComplete((v, e) -> calls.add(v));
        Assert.assertEquals(List.of(Ack.STOP), calls);
    }

    @Test
    public void fromFutureUnwrapsExplicitCompletionException() {
        IOException ex = new IOException();
        CompletableFuture<String> f = new CompletableFuture<>();
        f.completeExceptionally(new CompletionException(ex));

        Assert.assertSame(ex, Deferred.fromFuture(f).error());
    }
}
