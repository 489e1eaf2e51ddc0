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
package feedconverter.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ColumnTypeInferenceTest {

    @Test
    void shouldInferIntegers() {
        assertThat(ColumnTypeInference.infer(List.of("1", "-2", "+30"))).isEqualTo(ColumnType.INT64);
    }

    @Test
    void shouldInferFloatingPointWhenAnyValueHasAFraction() {
        assertThat(ColumnTypeInference.infer(List.of("1", "8.9", "1e3"))).isEqualTo(ColumnType.FLOAT64);
    }

    @Test
    void shouldInferBooleans() {
        assertThat(ColumnTypeInference.infer(List.of("true", "False", "TRUE"))).isEqualTo(ColumnType.BOOLEAN);
    }

    @Test
    void shouldInferIntegersForZeroAndOne() {
        assertThat(ColumnTypeInference.infer(List.of("0", "1"))).isEqualTo(ColumnType.INT64);
    }

    @Test
    void shouldFallBackToString() {
        assertThat(ColumnTypeInference.infer(List.of("1", "abc"))).isEqualTo(ColumnType.STRING);
        assertThat(ColumnTypeInference.infer(List.of("true", "1"))).isEqualTo(ColumnType.STRING);
    }

    @Test
    void shouldIgnoreNullTokens() {
        assertThat(ColumnTypeInference.infer(List.of("", "1", "NA", "null"))).isEqualTo(ColumnType.INT64);
    }

    @Test
    void shouldInferNullWhenNoValues() {
        assertThat(ColumnTypeInference.infer(Arrays.asList("", null, "N/A"))).isEqualTo(ColumnType.NULL);
        assertThat(ColumnTypeInference.infer(List.of())).isEqualTo(ColumnType.NULL);
    }

    @Test
    void shouldNotReadJavaNumberSuffixesAsNumbers() {
        assertThat(ColumnTypeInference.infer(List.of("1d", "2f"))).isEqualTo(ColumnType.STRING);
    }

    @Test
    void shouldParseInfinity() {
        assertThat(ColumnTypeInference.infer(List.of("1.5", "-inf"))).isEqualTo(ColumnType.FLOAT64);
        assertThat(ColumnTypeInference.parseDouble("-inf")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void shouldTreatIntegerOverflowAsFloatingPoint() {
        assertThat(ColumnTypeInference.infer(List.of("99999999999999999999"))).isEqualTo(ColumnType.FLOAT64);
    }
}
