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
package feedconverter.core.source;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SourceKeyTest {

    private static final String PREFIX = "version5/aurora/gz/";

    @Test
    void shouldParseKey() {
        // When
        SourceKey key = SourceKey.parse(PREFIX + "ercot/rt_lmp/year=2020/1577934000.csv.gz", PREFIX);

        // Then
        assertThat(key.getCollection()).isEqualTo("ercot");
        assertThat(key.getDataset()).isEqualTo("rt_lmp");
        assertThat(key.getTimestamp()).isEqualTo(Instant.parse("2020-01-02T03:00:00Z"));
    }

    @Test
    void shouldExtractTimestampWithoutExtension() {
        assertThat(SourceKey.extractTimestamp("a/b/1577934000"))
                .isEqualTo(Instant.ofEpochSecond(1577934000L));
    }

    @Test
    void shouldFailWhenFilenameIsNotATimestamp() {
        assertThatThrownBy(() -> SourceKey.extractTimestamp("a/b/2020-01-02.csv.gz"))
                .isInstanceOf(MalformedKeyException.class)
                .hasMessage("Malformed source key \"a/b/2020-01-02.csv.gz\": filename does not start with a unix timestamp")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void shouldFailWhenKeyIsNotUnderPrefix() {
        assertThatThrownBy(() -> SourceKey.parse("other/ercot/rt_lmp/1577934000.csv.gz", PREFIX))
                .isInstanceOf(MalformedKeyException.class);
    }

    @Test
    void shouldFailWhenDatasetIsMissing() {
        assertThatThrownBy(() -> SourceKey.parse(PREFIX + "ercot/1577934000.csv.gz", PREFIX))
                .isInstanceOf(MalformedKeyException.class);
    }
}
