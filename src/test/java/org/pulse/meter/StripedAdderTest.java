package org.pulse.meter;

import org.junit.Test;
import org.pulse.meter.concurrency.StripedAdder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

public class StripedAdderTest {

    @Test
    public void testConcurrentAddsAreNotLost() throws Exception {
        StripedAdder adder = new StripedAdder(4);
        ExecutorService pool = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < 10; p++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    adder.add(1);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertEquals(1000, adder.getValue());
    }

    @Test
    public void testGetAndResetDrainsEverything() {
        StripedAdder adder = new StripedAdder(4);
        adder.add(7);
        adder.add(5);
        assertEquals(12, adder.getValue());
        assertEquals(12, adder.getAndReset());
        assertEquals(0, adder.getValue());
        assertEquals(0, adder.getAndReset());
    }

    @Test
    public void testDrainingWhileAddingLosesNothing() throws Exception {
        StripedAdder adder = new StripedAdder(8);
        AtomicBoolean done = new AtomicBoolean();
        AtomicLong drained = new AtomicLong();
        Thread drainer = new Thread(() -> {
            while (!done.get()) {
                drained.addAndGet(adder.getAndReset());
            }
        });
        drainer.start();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < 4; p++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 50_000; i++) {
                    adder.add(1);
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();
        done.set(true);
        drainer.join();

        assertEquals(200_000, drained.get() + adder.getAndReset());
    }

    @Test
    public void testReset() {
        StripedAdder adder = new StripedAdder();
        adder.add(42);
        adder.reset();
        assertEquals(0, adder.getValue());
    }

    @Test
    public void testStripeCountIsRoundedToPowerOfTwo() {
        assertEquals(1, new StripedAdder(1).getStripes());
        assertEquals(2, new StripedAdder(2).getStripes());
        assertEquals(4, new StripedAdder(3).getStripes());
        assertEquals(16, new StripedAdder(16).getStripes());
        assertEquals(32, new StripedAdder(17).getStripes());
        assertTrue(new StripedAdder().getStripes() >= StripedAdder.DEFAULT_STRIPES);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveStripes() {
        new StripedAdder(0);
    }
}
