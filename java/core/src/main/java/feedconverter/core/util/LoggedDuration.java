/*
 * Copyright 2022-2024 Crown Copyright
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
package feedconverter.core.util;

import java.text.DecimalFormat;
import java.time.Duration;
import java.time.Instant;

/**
 * A duration for inclusion in log messages. The string is only built if the message is logged, e.g.
 * "1 hour 2 minutes 3.5 seconds".
 */
public class LoggedDuration {
    private static final DecimalFormat FORMATTER = new DecimalFormat("0.###");
    private final Duration duration;

    private LoggedDuration(Duration duration) {
        this.duration = duration;
    }

    /**
     * Wraps the duration between two times for logging.
     *
     * @param  start the start time
     * @param  end   the end time
     * @return       the duration for logging
     */
    public static LoggedDuration between(Instant start, Instant end) {
        return new LoggedDuration(Duration.between(start, end));
    }

    public static LoggedDuration of(Duration duration) {
        return new LoggedDuration(duration);
    }

    public long getSeconds() {
        return duration.getSeconds();
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        Duration remaining = duration;
        if (remaining.isNegative()) {
            output.append('-');
            remaining = remaining.negated();
        }
        long hours = remaining.toHours();
        if (hours > 0) {
            output.append(hours).append(hours > 1 ? " hours " : " hour ");
        }
        long minutes = remaining.toMinutesPart();
        if (minutes > 0) {
            output.append(minutes).append(minutes > 1 ? " minutes " : " minute ");
        }
        double seconds = remaining.toSecondsPart() + remaining.toNanosPart() / 1_000_000_000.0;
        output.append(FORMATTER.format(seconds)).append(seconds == 1 ? " second" : " seconds");
        return output.toString();
    }
}
