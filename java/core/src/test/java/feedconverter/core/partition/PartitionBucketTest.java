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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class PartitionBucketTest {

    @Test
    void shouldContainTimesInHalfOpenInterval() {
        // Given
        PartitionBucket bucket = new PartitionBucket("caiso", "prices", Instant.parse("2020-01-01T01:00:00Z"), PartitionSize.HOUR);

        // When / Then
        assertThat(bucket.end()).isEqualTo(Instant.parse("2020-01-01T02:00:00Z"));
        assertThat(bucket.contains(Instant.parse("2020-01-01T01:00:00Z"))).isTrue();
        assertThat(bucket.contains(Instant.parse("2020-01-01T01:59:59Z"))).isTrue();
        assertThat(bucket.contains(Instant.parse("2020-01-01T02:00:00Z"))).isFalse();
        assertThat(bucket.contains(Instant.parse("2020-01-01T00:59:59Z"))).isFalse();
    }

    @Test
    void shouldEndMonthBucketAtStartOfNextMonth() {
        PartitionBucket bucket = new PartitionBucket("caiso", "prices", Instant.parse("2020-02-01T00:00:00Z"), PartitionSize.MONTH);

        assertThat(bucket.end()).isEqualTo(Instant.parse("2020-03-01T00:00:00Z"));
    }
}
