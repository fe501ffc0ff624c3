package org.pulse.meter.metric;

import org.pulse.meter.concurrency.AtomicCounter;
import org.pulse.meter.concurrency.AtomicRate;
import org.pulse.meter.concurrency.StripedAdder;

import java.util.concurrent.TimeUnit;
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
 * The {@code Meter} class counts events and tracks how fast they arrive. Producers call {@link #mark(long)}
 * from any number of threads; the owning {@link Ticker} calls {@link #tick()} once per tick interval to
 * fold the pending events into the total and advance the one, five and fifteen minute exponentially
 * weighted moving averages.
 * <p>
 * Every field is an independent atomic, so {@link #getValue(double)} may combine a total and rates read
 * at slightly different instants. Events marked since the last tick are included in the count but not
 * yet in the rates.
 * <p>
 * Rates are stored per nanosecond and converted to per second when read.
 *
 * @author Hamdi Ghassen
 */
public class Meter {
    public static final long DEFAULT_TICK_INTERVAL_SECONDS = 5L;

    private static final long NANOS_IN_SECOND = TimeUnit.SECONDS.toNanos(1);
    private static final double SECONDS_PER_MINUTE = 60.0;
    private static final int ONE_MINUTE = 1;
    private static final int FIVE_MINUTES = 5;
    private static final int FIFTEEN_MINUTES = 15;

    private static final double M1_ALPHA = alpha(DEFAULT_TICK_INTERVAL_SECONDS, ONE_MINUTE);
    private static final double M5_ALPHA = alpha(DEFAULT_TICK_INTERVAL_SECONDS, FIVE_MINUTES);
    private static final double M15_ALPHA = alpha(DEFAULT_TICK_INTERVAL_SECONDS, FIFTEEN_MINUTES);

    private final StripedAdder uncounted = new StripedAdder();
    private final AtomicCounter total = new AtomicCounter();
    private final AtomicRate m1Rate = new AtomicRate();
    private final AtomicRate m5Rate = new AtomicRate();
    private final AtomicRate m15Rate = new AtomicRate();
    // never cleared by reset()
    private volatile boolean initialized;

    private final long tickIntervalNanos;
    private final double interval;
    private final double m1Alpha;
    private final double m5Alpha;
    private final double m15Alpha;
    /**
     * Constructs a meter ticked every {@value #DEFAULT_TICK_INTERVAL_SECONDS} seconds.
     */
    public Meter() {
        this.tickIntervalNanos = TimeUnit.SECONDS.toNanos(DEFAULT_TICK_INTERVAL_SECONDS);
        this.interval = tickIntervalNanos;
        this.m1Alpha = M1_ALPHA;
        this.m5Alpha = M5_ALPHA;
        this.m15Alpha = M15_ALPHA;
    }
    /**
     * Constructs a meter ticked on a custom interval. The decay constants are derived from it with the same
     * formula used for the default interval.
     *
     * @param tickInterval the tick interval
     * @param unit         the unit of {@code tickInterval}
     * @throws IllegalArgumentException if the interval is not positive
     */
    public Meter(long tickInterval, TimeUnit unit) {
        long nanos = unit.toNanos(tickInterval);
        if (nanos <= 0) {
            throw new IllegalArgumentException("tick interval must be positive: " + tickInterval + " " + unit);
        }
        double seconds = nanos / (double) NANOS_IN_SECOND;
        this.tickIntervalNanos = nanos;
        this.interval = nanos;
        this.m1Alpha = alpha(seconds, ONE_MINUTE);
        this.m5Alpha = alpha(seconds, FIVE_MINUTES);
        this.m15Alpha = alpha(seconds, FIFTEEN_MINUTES);
    }
    /**
     * Computes the smoothing constant for a window of {@code minutes} sampled every {@code intervalSeconds}.
     *
     * @param intervalSeconds the tick interval in seconds
     * @param minutes         the averaging window in minutes
     * @return {@code 1 - exp(-intervalSeconds / 60 / minutes)}
     */
    static double alpha(double intervalSeconds, int minutes) {
        return 1 - Math.exp(-intervalSeconds / SECONDS_PER_MINUTE / minutes);
    }

    public static double oneMinuteAlpha() {
        return M1_ALPHA;
    }

    public static double fiveMinuteAlpha() {
        return M5_ALPHA;
    }

    public static double fifteenMinuteAlpha() {
        return M15_ALPHA;
    }
    /**
     * Marks a single occurrence of an event.
     */
    public void mark() {
        mark(1L);
    }
    /**
     * Marks multiple occurrences of an event. Never blocks.
     *
     * @param count the number of occurrences to mark
     */
    public void mark(long count) {
        uncounted.add(count);
    }
    /**
     * Drains the events marked since the previous tick into the total and updates the three rates.
     * The first tick seeds every rate with the instant rate; later ticks blend it in with each window's
     * smoothing constant. Must not be called concurrently with itself.
     */
    public void tick() {
        long count = uncounted.getAndReset();
        total.add(count);
        double instantRate = count / interval;
        if (initialized) {
            double rate = m1Rate.getValue();
            m1Rate.setValue(rate + m1Alpha * (instantRate - rate));

            rate = m5Rate.getValue();
            m5Rate.setValue(rate + m5Alpha * (instantRate - rate));

            rate = m15Rate.getValue();
            m15Rate.setValue(rate + m15Alpha * (instantRate - rate));
        } else {
            m1Rate.setValue(instantRate);
            m5Rate.setValue(instantRate);
            m15Rate.setValue(instantRate);
            initialized = true;
        }
    }
    /**
     * Takes a snapshot of the meter.
     *
     * @param elapsedSeconds the wall-clock seconds since this meter was created, used for the mean rate
     * @return the current value with rates per second
     */
    public MeterValue getValue(double elapsedSeconds) {
        long count = total.getValue() + uncounted.getValue();
        return new MeterValue(count, getMeanRate(count, elapsedSeconds), getOneMinuteRate(),
                getFiveMinuteRate(), getFifteenMinuteRate(), TimeUnit.SECONDS);
    }
    /**
     * Zeroes the pending count, the total and all three rates. The meter stays initialized, so the next
     * tick blends against a zero rate instead of seeding.
     */
    public void reset() {
        uncounted.reset();
        total.setValue(0L);
        m1Rate.setValue(0.0);
        m5Rate.setValue(0.0);
        m15Rate.setValue(0.0);
    }
    /**
     * @return the total plus any events not yet folded in by a tick
     */
    public long getCount() {
        return total.getValue() + uncounted.getValue();
    }

    public double getOneMinuteRate() {
        return m1Rate.getValue() * NANOS_IN_SECOND;
    }

    public double getFiveMinuteRate() {
        return m5Rate.getValue() * NANOS_IN_SECOND;
    }

    public double getFifteenMinuteRate() {
        return m15Rate.getValue() * NANOS_IN_SECOND;
    }

    public long getTickIntervalNanos() {
        return tickIntervalNanos;
    }

    private static double getMeanRate(long count, double elapsedSeconds) {
        if (count == 0) {
            return 0.0;
        }
        return count / elapsedSeconds;
    }
}
