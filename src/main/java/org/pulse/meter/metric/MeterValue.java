package org.pulse.meter.metric;

import java.util.Objects;
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
 * The {@code MeterValue} class is the immutable snapshot a {@link Meter} hands to reporters: the total
 * event count, the mean rate over the meter's lifetime and the one, five and fifteen minute decayed rates,
 * all expressed per {@link #getRateUnit()}.
 *
 * @author Hamdi Ghassen
 */
public final class MeterValue {
    private final long count;
    private final double meanRate;
    private final double oneMinuteRate;
    private final double fiveMinuteRate;
    private final double fifteenMinuteRate;
    private final TimeUnit rateUnit;

    /**
     * Constructs a new {@code MeterValue}.
     *
     * @param count             the total number of events
     * @param meanRate          the mean rate since the meter was created
     * @param oneMinuteRate     the one minute decayed rate
     * @param fiveMinuteRate    the five minute decayed rate
     * @param fifteenMinuteRate the fifteen minute decayed rate
     * @param rateUnit          the time unit the rates are expressed per
     */
    public MeterValue(long count, double meanRate, double oneMinuteRate, double fiveMinuteRate,
                      double fifteenMinuteRate, TimeUnit rateUnit) {
        this.count = count;
        this.meanRate = meanRate;
        this.oneMinuteRate = oneMinuteRate;
        this.fiveMinuteRate = fiveMinuteRate;
        this.fifteenMinuteRate = fifteenMinuteRate;
        this.rateUnit = Objects.requireNonNull(rateUnit, "rateUnit");
    }

    public long getCount() {
        return count;
    }

    public double getMeanRate() {
        return meanRate;
    }

    public double getOneMinuteRate() {
        return oneMinuteRate;
    }

    public double getFiveMinuteRate() {
        return fiveMinuteRate;
    }

    public double getFifteenMinuteRate() {
        return fifteenMinuteRate;
    }

    public TimeUnit getRateUnit() {
        return rateUnit;
    }

    /**
     * Re-expresses every rate per the given unit, for example events per minute instead of per second.
     * The count is unchanged.
     *
     * @param unit the target rate unit
     * @return the scaled value, or this instance if the unit is already {@code unit}
     */
    public MeterValue scale(TimeUnit unit) {
        if (unit == rateUnit) {
            return this;
        }
        double factor = (double) unit.toNanos(1) / rateUnit.toNanos(1);
        return new MeterValue(count, meanRate * factor, oneMinuteRate * factor, fiveMinuteRate * factor,
                fifteenMinuteRate * factor, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeterValue)) return false;
        MeterValue that = (MeterValue) o;
        return count == that.count
                && Double.compare(that.meanRate, meanRate) == 0
                && Double.compare(that.oneMinuteRate, oneMinuteRate) == 0
                && Double.compare(that.fiveMinuteRate, fiveMinuteRate) == 0
                && Double.compare(that.fifteenMinuteRate, fifteenMinuteRate) == 0
                && rateUnit == that.rateUnit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, meanRate, oneMinuteRate, fiveMinuteRate, fifteenMinuteRate, rateUnit);
    }

    @Override
    public String toString() {
        return "MeterValue{count=" + count
                + ", mean=" + meanRate
                + ", m1=" + oneMinuteRate
                + ", m5=" + fiveMinuteRate
                + ", m15=" + fifteenMinuteRate
                + ", unit=" + rateUnit + '}';
    }
}
