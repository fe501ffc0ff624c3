package org.pulse.meter;

import org.junit.Test;
import org.pulse.meter.metric.MeterValue;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class MeterValueTest {

    @Test
    public void testScaleToMinutes() {
        MeterValue perSecond = new MeterValue(120, 2.0, 1.0, 0.5, 0.25, TimeUnit.SECONDS);
        MeterValue perMinute = perSecond.scale(TimeUnit.MINUTES);
        assertEquals(120, perMinute.getCount());
        assertEquals(120.0, perMinute.getMeanRate(), 1e-9);
        assertEquals(60.0, perMinute.getOneMinuteRate(), 1e-9);
        assertEquals(30.0, perMinute.getFiveMinuteRate(), 1e-9);
        assertEquals(15.0, perMinute.getFifteenMinuteRate(), 1e-9);
        assertEquals(TimeUnit.MINUTES, perMinute.getRateUnit());
    }

    @Test
    public void testScaleToMilliseconds() {
        MeterValue perSecond = new MeterValue(1, 1000.0, 1000.0, 1000.0, 1000.0, TimeUnit.SECONDS);
        MeterValue perMilli = perSecond.scale(TimeUnit.MILLISECONDS);
        assertEquals(1.0, perMilli.getMeanRate(), 1e-12);
        assertEquals(1.0, perMilli.getFifteenMinuteRate(), 1e-12);
    }

    @Test
    public void testScaleToSameUnitReturnsSameInstance() {
        MeterValue value = new MeterValue(5, 1.0, 1.0, 1.0, 1.0, TimeUnit.SECONDS);
        assertSame(value, value.scale(TimeUnit.SECONDS));
    }

    @Test
    public void testEquality() {
        MeterValue a = new MeterValue(5, 1.0, 2.0, 3.0, 4.0, TimeUnit.SECONDS);
        MeterValue b = new MeterValue(5, 1.0, 2.0, 3.0, 4.0, TimeUnit.SECONDS);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new MeterValue(6, 1.0, 2.0, 3.0, 4.0, TimeUnit.SECONDS));
        assertNotEquals(a, a.scale(TimeUnit.MINUTES));
        assertTrue(a.toString().contains("count=5"));
    }
}
