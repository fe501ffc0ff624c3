package org.pulse.meter.concurrency;

import java.util.concurrent.atomic.AtomicLongArray;
/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * The {@code StripedAdder} class is a write-optimized counter for the hot path of a {@code Meter}.
 * Producers add into one of several independent cells (stripes), chosen from the calling thread's id, so
 * that concurrent writers rarely touch the same cache line. Reads sum every stripe, and
 * {@link #getAndReset()} exchanges each stripe with zero and returns the sum of the exchanged values.
 * <p>
 * Stripes are laid out {@value #PADDING} slots apart in a single {@link AtomicLongArray} so that two
 * stripes never share a 64-byte cache line.
 * <p>
 * An add racing with {@link #getAndReset()} lands either in the drained sum or in the stripe left behind
 * for the next drain; it is never lost. A concurrent {@link #getValue()} may however miss it or see it
 * twice across two read windows.
 *
 * @author Hamdi Ghassen
 */
public class StripedAdder {
    public static final int DEFAULT_STRIPES = 16;
    // 8 longs = 64 bytes
    private static final int PADDING = 8;

    private final AtomicLongArray cells;
    private final int stripes;

    /**
     * Constructs an adder with one stripe per available processor, rounded up to a power of two and at
     * least {@link #DEFAULT_STRIPES}.
     */
    public StripedAdder() {
        this(Math.max(DEFAULT_STRIPES, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Constructs an adder with the given number of stripes, rounded up to a power of two.
     *
     * @param stripes the requested number of stripes
     * @throws IllegalArgumentException if {@code stripes} is not positive
     */
    public StripedAdder(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive: " + stripes);
        }
        this.stripes = stripes == 1 ? 1 : Integer.highestOneBit(stripes - 1) << 1;
        this.cells = new AtomicLongArray(this.stripes * PADDING);
    }

    /**
     * Adds the given delta to the stripe owned by the calling thread.
     *
     * @param delta the amount to add
     */
    public void add(long delta) {
        cells.getAndAdd(indexFor(Thread.currentThread()), delta);
    }

    /**
     * Sums all stripes. Safe to call concurrently with {@link #add(long)}.
     *
     * @return the current sum
     */
    public long getValue() {
        long sum = 0L;
        for (int i = 0; i < stripes; i++) {
            sum += cells.get(i * PADDING);
        }
        return sum;
    }

    /**
     * Atomically exchanges every stripe with zero and returns the sum of the exchanged values.
     *
     * @return the sum drained from all stripes
     */
    public long getAndReset() {
        long sum = 0L;
        for (int i = 0; i < stripes; i++) {
            sum += cells.getAndSet(i * PADDING, 0L);
        }
        return sum;
    }

    /**
     * Zeroes every stripe.
     */
    public void reset() {
        for (int i = 0; i < stripes; i++) {
            cells.set(i * PADDING, 0L);
        }
    }

    /**
     * @return the number of stripes, always a power of two
     */
    public int getStripes() {
        return stripes;
    }

    private int indexFor(Thread thread) {
        long id = thread.getId();
        // spread sequential thread ids before masking
        int h = (int) (id ^ (id >>> 32)) * 0x9E3779B9;
        return ((h ^ (h >>> 16)) & (stripes - 1)) * PADDING;
    }
}
