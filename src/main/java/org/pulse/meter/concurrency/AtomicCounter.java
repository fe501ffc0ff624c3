package org.pulse.meter.concurrency;

import java.util.concurrent.atomic.AtomicLong;
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
 * The {@code AtomicCounter} class holds a single 64-bit running total that can be added to, read and
 * overwritten atomically from any thread. It backs the durable total of a {@code Meter}.
 *
 * @author Hamdi Ghassen
 */
public class AtomicCounter {
    private final AtomicLong value = new AtomicLong();

    /**
     * Atomically adds the given delta.
     *
     * @param delta the amount to add
     */
    public void add(long delta) {
        value.addAndGet(delta);
    }

    /**
     * Reads the current value.
     *
     * @return the current value
     */
    public long getValue() {
        return value.get();
    }

    /**
     * Atomically overwrites the current value.
     *
     * @param newValue the value to store
     */
    public void setValue(long newValue) {
        value.set(newValue);
    }
}
