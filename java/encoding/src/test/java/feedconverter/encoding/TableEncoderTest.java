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
package feedconverter.encoding;

import org.junit.jupiter.api.Test;

import feedconverter.core.format.FileFormat;
import feedconverter.encoding.parquet.ParquetTableEncoder;

import static org.assertj.core.api.Assertions.assertThat;

public class TableEncoderTest {

    @Test
    void shouldCreateEncoderForEachFormat() {
        assertThat(TableEncoder.forFormat(FileFormat.ARROW)).isInstanceOf(ArrowStreamTableEncoder.class);
        assertThat(TableEncoder.forFormat(FileFormat.PARQUET)).isInstanceOf(ParquetTableEncoder.class);
    }
}
