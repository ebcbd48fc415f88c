/*
 * Copyright 2022-2025 Crown Copyright
 *
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
package strata.core.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Wraps the time taken by a step of request processing for a log message. The text is only built if the logger
 * actually writes the message. Durations under a second are shown in milliseconds, longer ones in seconds.
 */
public class LoggedDuration {
    private final Duration duration;

    private LoggedDuration(Duration duration) {
        this.duration = duration;
    }

    /**
     * Measures the time between two instants.
     *
     * @param  start when the step started
     * @param  end   when the step finished
     * @return       the duration to log
     */
    public static LoggedDuration between(Instant start, Instant end) {
        return of(Duration.between(start, end));
    }

    /**
     * Wraps a duration.
     *
     * @param  duration the duration
     * @return          the duration to log
     */
    public static LoggedDuration of(Duration duration) {
        return new LoggedDuration(duration);
    }

    public Duration getDuration() {
        return duration;
    }

    public long getMillis() {
        return duration.toMillis();
    }

    @Override
    public String toString() {
        long millis = duration.toMillis();
        if (Math.abs(millis) < 1000) {
            return millis + "ms";
        }
        DecimalFormat format = new DecimalFormat("0.###", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(millis / 1000.0) + "s";
    }
}
