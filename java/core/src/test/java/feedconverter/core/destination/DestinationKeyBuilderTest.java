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
package feedconverter.core.destination;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.format.DestinationStore;
import feedconverter.core.format.FileFormat;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.partition.PartitionSize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static org.assertj.core.api.Assertions.assertThat;

public class DestinationKeyBuilderTest {

    private static final Instant HOUR_START = Instant.parse("2020-01-02T03:00:00Z");

    @Nested
    class DataClientStore {

        @Test
        void shouldBuildKeyPartitionedByYear() {
            // Given
            DestinationKeyBuilder builder = new DestinationKeyBuilder(target(
                    DestinationStore.DATACLIENT, FileFormat.ARROW, CompressionCodec.ZSTD, PartitionSize.DAY));

            // When
            String key = builder.buildKey("ercot", "rt_lmp", Instant.parse("2020-01-02T00:00:00Z"));

            // Then
            assertThat(key).isEqualTo("version5/aurora/arrow/ercot/rt_lmp/year=2020/1577923200.arrow.zst");
        }

        @Test
        void shouldIncludeFormatAndCompressionInParquetKey() {
            DestinationKeyBuilder builder = new DestinationKeyBuilder(target(
                    DestinationStore.DATACLIENT, FileFormat.PARQUET, CompressionCodec.SNAPPY, PartitionSize.HOUR));

            assertThat(builder.buildKey("ercot", "rt_lmp", HOUR_START))
                    .isEqualTo("version5/aurora/arrow/ercot/rt_lmp/year=2020/1577934000.parquet.sz");
        }
    }

    @Nested
    class AthenaStore {

        @Test
        void shouldEmbedDateTimeForHourlyPartition() {
            // Given
            DestinationKeyBuilder builder = new DestinationKeyBuilder(target(
                    DestinationStore.ATHENA, FileFormat.PARQUET, CompressionCodec.ZSTD, PartitionSize.HOUR));

            // When
            String key = builder.buildKey("ercot", "rt_lmp", HOUR_START);

            // Then
            assertThat(key).isEqualTo(
                    "version5/aurora/arrow/ercot/rt_lmp/hour_partition=2020-01-02-03-00-00/1577934000.parquet");
            assertThat(LocalDateTime.parse(partitionValue(key, "hour_partition"),
                    DateTimeFormatter.ofPattern(PartitionSize.HOUR.getProjectionFormat()))
                    .toInstant(ZoneOffset.UTC))
                    .isEqualTo(HOUR_START);
        }

        @Test
        void shouldEmbedDateOnlyForDailyPartition() {
            // Given
            Instant dayStart = Instant.parse("2020-01-02T00:00:00Z");
            DestinationKeyBuilder builder = new DestinationKeyBuilder(target(
                    DestinationStore.ATHENA, FileFormat.PARQUET, CompressionCodec.GZIP, PartitionSize.DAY));

            // When
            String key = builder.buildKey("ercot", "rt_lmp", dayStart);

            // Then
            assertThat(key).isEqualTo(
                    "version5/aurora/arrow/ercot/rt_lmp/day_partition=2020-01-02/1577923200.parquet");
            assertThat(LocalDate.parse(partitionValue(key, "day_partition"),
                    DateTimeFormatter.ofPattern(PartitionSize.DAY.getProjectionFormat()))
                    .atStartOfDay(ZoneOffset.UTC).toInstant())
                    .isEqualTo(dayStart);
        }

        @Test
        void shouldEmbedFirstOfMonthForMonthlyPartition() {
            DestinationKeyBuilder builder = new DestinationKeyBuilder(target(
                    DestinationStore.ATHENA, FileFormat.PARQUET, CompressionCodec.GZIP, PartitionSize.MONTH));

            assertThat(builder.buildKey("ercot", "rt_lmp", Instant.parse("2020-02-01T00:00:00Z")))
                    .contains("/month_partition=2020-02-01/");
        }
    }

    private static ConversionTarget target(
            DestinationStore store, FileFormat format, CompressionCodec compression, PartitionSize size) {
        return ConversionTarget.builder()
                .destinationPrefix("version5/aurora/arrow/")
                .destinationStore(store)
                .fileFormat(format)
                .compression(compression)
                .partitionSize(size)
                .build();
    }

    private static String partitionValue(String key, String partitionKeyName) {
        String afterName = key.substring(key.indexOf(partitionKeyName + "=") + partitionKeyName.length() + 1);
        return afterName.substring(0, afterName.indexOf('/'));
    }
}
