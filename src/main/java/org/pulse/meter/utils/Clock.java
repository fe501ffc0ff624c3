package org.pulse.meter.utils;
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
 * A nanosecond time source. Meters never read the clock themselves; the registry uses one to work out
 * how long a meter has existed when a value is requested.
 *
 * @author Hamdi Ghassen
 */
public interface Clock {
    /**
     * Clock backed by {@link System#nanoTime()}.
     */
    Clock SYSTEM = System::nanoTime;

    /**
     * @return the current time in nanoseconds from an arbitrary origin
     */
    long nanoTime();
}
