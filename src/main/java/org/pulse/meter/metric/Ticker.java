package org.pulse.meter.metric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
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
 * The {@code Ticker} class drives every registered {@link Meter} forward in real time. A single scheduled
 * task fires once per interval and calls {@link Meter#tick()} on each meter, whatever producers are doing.
 * Meters are held by identity in a concurrent set, so two meters that callers happen to name alike are both
 * ticked. Registering or unregistering while a cycle runs is safe, and that cycle may or may not include the
 * meter concerned. The ticker does not own the meters it ticks.
 * <p>
 * Cycles are serialized, so a meter is never ticked by two threads at once even when {@link #tick()} is
 * also called by hand. After {@link #stop()} rates stop updating but meters keep counting.
 *
 * @author Hamdi Ghassen
 */
public class Ticker {
    private static final Logger logger = LoggerFactory.getLogger(Ticker.class);

    public static final String DEFAULT_THREAD_NAME = "pulse-meter-ticker";

    private static volatile Ticker defaultTicker;

    private final Set<Meter> meters = ConcurrentHashMap.newKeySet();
    private final Object tickLock = new Object();
    private final long intervalNanos;
    private final String threadName;
    private final boolean shared;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private boolean stopped;
    /**
     * Private constructor to enforce use of Builder pattern.
     */
    private Ticker(long intervalNanos, String threadName, boolean shared) {
        this.intervalNanos = intervalNanos;
        this.threadName = threadName;
        this.shared = shared;
    }
    /**
     * Returns the process-wide ticker, creating and starting it with the default interval on first use.
     * Every {@link MetricRegistry} built without an explicit ticker depends on it, so {@link #stop()} has no
     * effect on this instance; it runs until the JVM exits.
     *
     * @return the shared ticker
     */
    public static Ticker defaultTicker() {
        Ticker ticker = defaultTicker;
        if (ticker == null) {
            synchronized (Ticker.class) {
                ticker = defaultTicker;
                if (ticker == null) {
                    ticker = new Ticker(new Builder().intervalNanos, DEFAULT_THREAD_NAME, true);
                    ticker.start();
                    defaultTicker = ticker;
                }
            }
        }
        return ticker;
    }
    /**
     * Starts the schedule. Does nothing if already running.
     *
     * @throws IllegalStateException if the ticker has been stopped
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Ticker has been stopped and cannot be restarted");
        }
        if (running) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        running = true;
        logger.debug("Ticker started with interval {} ns", intervalNanos);
    }
    /**
     * Stops the schedule and waits for a cycle in progress to finish. Registered meters are kept but no
     * longer ticked. Does nothing if not running, or if this is the process-wide {@link #defaultTicker()}.
     */
    public synchronized void stop() {
        if (shared) {
            logger.warn("Ignoring stop() on the default ticker");
            return;
        }
        if (!running) {
            stopped = true;
            return;
        }
        scheduler.shutdownNow();
        try {
            // let an in-flight cycle finish so no rate changes after stop() returns
            if (!scheduler.awaitTermination(intervalNanos, TimeUnit.NANOSECONDS)) {
                logger.warn("Tick cycle still running after stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = false;
        stopped = true;
        logger.debug("Ticker stopped");
    }

    public boolean isRunning() {
        return running;
    }
    /**
     * Registers a meter for ticking. Registering the same meter twice has no further effect.
     *
     * @param meter the meter to tick
     * @throws IllegalArgumentException if the meter's tick interval differs from this ticker's interval
     */
    public void register(Meter meter) {
        Objects.requireNonNull(meter, "meter");
        if (meter.getTickIntervalNanos() != intervalNanos) {
            throw new IllegalArgumentException("Meter expects a tick every " + meter.getTickIntervalNanos()
                    + " ns but this ticker fires every " + intervalNanos + " ns");
        }
        if (meters.add(meter)) {
            logger.debug("Registered meter {}", meter);
        }
    }
    /**
     * Stops ticking the given meter.
     *
     * @param meter the meter to remove
     * @return true if the meter was registered
     */
    public boolean unregister(Meter meter) {
        boolean removed = meters.remove(meter);
        if (removed) {
            logger.debug("Unregistered meter {}", meter);
        }
        return removed;
    }

    public int size() {
        return meters.size();
    }

    public long getIntervalNanos() {
        return intervalNanos;
    }
    /**
     * Runs one tick cycle over every registered meter. A meter that throws is logged and skipped so the
     * rest of the cycle and later cycles still run.
     */
    public void tick() {
        synchronized (tickLock) {
            for (Meter meter : meters) {
                try {
                    meter.tick();
                } catch (RuntimeException e) {
                    logger.error("Cannot tick meter {}", meter, e);
                }
            }
        }
    }
    /**
     * Builder class for constructing a {@code Ticker} instance with configurable options.
     */
    public static class Builder {
        private long intervalNanos = TimeUnit.SECONDS.toNanos(Meter.DEFAULT_TICK_INTERVAL_SECONDS);
        private String threadName = DEFAULT_THREAD_NAME;
        /**
         * Sets the tick period. Meters registered with the ticker must use the same interval.
         *
         * @param interval the period
         * @param unit     the unit of {@code interval}
         * @return this builder
         * @throws IllegalArgumentException if the interval is not positive
         */
        public Builder interval(long interval, TimeUnit unit) {
            long nanos = unit.toNanos(interval);
            if (nanos <= 0) {
                throw new IllegalArgumentException("interval must be positive: " + interval + " " + unit);
            }
            this.intervalNanos = nanos;
            return this;
        }
        /**
         * Sets the name of the scheduling thread.
         *
         * @param name the thread name
         * @return this builder
         */
        public Builder threadName(String name) {
            this.threadName = Objects.requireNonNull(name, "name");
            return this;
        }
        /**
         * Builds the {@code Ticker}. The returned instance is not started.
         *
         * @return the constructed ticker
         */
        public Ticker build() {
            return new Ticker(intervalNanos, threadName, false);
        }
    }
}
