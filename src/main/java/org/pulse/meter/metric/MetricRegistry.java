package org.pulse.meter.metric;

import org.pulse.meter.utils.Clock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
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
 * The {@code MetricRegistry} class names meters and wires them to a {@link Ticker}. Meters are created on
 * first lookup with the ticker's interval, registered for ticking, and remembered together with their
 * creation time so that snapshots can supply the elapsed time the mean rate needs.
 *
 * @author Hamdi Ghassen
 */
public class MetricRegistry {
    private final Map<String, Registration> metrics = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final Clock clock;
    /**
     * Constructs a registry ticked by the process-wide {@link Ticker#defaultTicker()}.
     */
    public MetricRegistry() {
        this(Ticker.defaultTicker(), Clock.SYSTEM);
    }
    /**
     * Constructs a registry ticked by the given ticker and timed by the given clock.
     *
     * @param ticker the ticker meters are registered with
     * @param clock  the time source for creation and snapshot times
     */
    public MetricRegistry(Ticker ticker, Clock clock) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.clock = Objects.requireNonNull(clock, "clock");
    }
    /**
     * Retrieves or creates a meter with the specified name.
     *
     * @param name the name of the meter
     * @return the meter instance
     */
    public Meter meter(String name) {
        Objects.requireNonNull(name, "name");
        return metrics.computeIfAbsent(name, k -> {
            Meter meter = new Meter(ticker.getIntervalNanos(), TimeUnit.NANOSECONDS);
            ticker.register(meter);
            return new Registration(meter, clock.nanoTime());
        }).meter;
    }
    /**
     * Removes the meter with the specified name and stops ticking it.
     *
     * @param name the name of the meter
     * @return true if a meter was removed
     */
    public boolean remove(String name) {
        Registration removed = metrics.remove(name);
        if (removed == null) {
            return false;
        }
        ticker.unregister(removed.meter);
        return true;
    }
    /**
     * Takes a snapshot of the named meter using the time elapsed since it was created.
     *
     * @param name the name of the meter
     * @return the meter's value, or null if no meter has that name
     */
    public MeterValue getValue(String name) {
        Registration registration = metrics.get(name);
        return registration == null ? null : registration.value(clock.nanoTime());
    }
    /**
     * Retrieves a snapshot of every registered meter.
     *
     * @return an unmodifiable map of meter names to their values
     */
    public Map<String, MeterValue> getMetricsSnapshot() {
        long now = clock.nanoTime();
        Map<String, MeterValue> snapshot = new LinkedHashMap<>();
        metrics.forEach((name, registration) -> snapshot.put(name, registration.value(now)));
        return Collections.unmodifiableMap(snapshot);
    }
    /**
     * Retrieves the map of all registered meters.
     *
     * @return an unmodifiable view of meter names to their instances
     */
    public Map<String, Meter> getMetrics() {
        Map<String, Meter> view = new LinkedHashMap<>();
        metrics.forEach((name, registration) -> view.put(name, registration.meter));
        return Collections.unmodifiableMap(view);
    }

    private static final class Registration {
        private final Meter meter;
        private final long createdNanos;

        private Registration(Meter meter, long createdNanos) {
            this.meter = meter;
            this.createdNanos = createdNanos;
        }

        private MeterValue value(long nowNanos) {
            return meter.getValue((nowNanos - createdNanos) / 1e9);
        }
    }
}
