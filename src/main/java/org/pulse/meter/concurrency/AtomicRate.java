package org.pulse.meter.concurrency;
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
 * The {@code AtomicRate} class publishes a single decayed rate estimate. Reads and writes of a volatile
 * {@code double} are atomic, so a concurrent reader sees either the previous or the new rate and never
 * a torn value.
 *
 * @author Hamdi Ghassen
 */
public class AtomicRate {
    private volatile double value;

    public double getValue() {
        return value;
    }

    public void setValue(double newValue) {
        this.value = newValue;
    }
}
