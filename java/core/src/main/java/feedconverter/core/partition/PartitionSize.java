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
package feedconverter.core.partition;

import feedconverter.core.job.InvalidPartitionSizeException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * The width of a time bucket that source files are grouped into. Buckets are half-open intervals starting at a
 * calendar boundary in UTC.
 */
public enum PartitionSize {
    HOUR(ChronoUnit.HOURS, "yyyy-MM-dd-HH-mm-ss"),
    DAY(ChronoUnit.DAYS, "yyyy-MM-dd"),
    MONTH(ChronoUnit.MONTHS, "yyyy-MM-dd"),
    YEAR(ChronoUnit.YEARS, "yyyy-MM-dd");

    private final ChronoUnit unit;
    private final String projectionFormat;
    private final DateTimeFormatter projectionFormatter;

    PartitionSize(ChronoUnit unit, String projectionFormat) {
        this.unit = unit;
        this.projectionFormat = projectionFormat;
        this.projectionFormatter = DateTimeFormatter.ofPattern(projectionFormat, Locale.ROOT).withZone(ZoneOffset.UTC);
    }

    /**
     * Reads a partition size from the name used in job payloads, e.g. "day".
     *
     * @param  name                          the name
     * @return                               the partition size
     * @throws InvalidPartitionSizeException if the name is not a known partition size
     */
    public static PartitionSize fromName(String name) {
        if (name == null) {
            throw new InvalidPartitionSizeException(null);
        }
        for (PartitionSize size : values()) {
            if (size.getName().equals(name)) {
                return size;
            }
        }
        throw new InvalidPartitionSizeException(name);
    }

    /**
     * Truncates a point in time to the start of the bucket containing it.
     *
     * @param  time the time
     * @return      the start of the bucket
     */
    public Instant floor(Instant time) {
        ZonedDateTime utc = time.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return utc.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY:
                return utc.truncatedTo(ChronoUnit.DAYS).toInstant();
            case MONTH:
                return utc.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).toInstant();
            case YEAR:
                return utc.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1).toInstant();
            default:
                throw new IllegalStateException("Unexpected partition size: " + this);
        }
    }

    /**
     * Computes the exclusive end of the bucket starting at the given time.
     *
     * @param  bucketStart the start of a bucket, as returned by {@link #floor}
     * @return             the start of the next bucket
     */
    public Instant bucketEnd(Instant bucketStart) {
        return bucketStart.atZone(ZoneOffset.UTC).plus(1, unit).toInstant();
    }

    /**
     * Formats the start of a bucket as it is embedded in a partition-projected path. Hourly buckets include the time,
     * all others are date only.
     *
     * @param  bucketStart the start of the bucket
     * @return             the formatted partition value
     */
    public String formatPartitionValue(Instant bucketStart) {
        return projectionFormatter.format(bucketStart);
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getPartitionKeyName() {
        return getName() + "_partition";
    }

    public String getProjectionFormat() {
        return projectionFormat;
    }
}
