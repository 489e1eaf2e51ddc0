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
package feedconverter.core.job;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.format.DestinationStore;
import feedconverter.core.format.FileFormat;
import feedconverter.core.partition.PartitionSize;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConversionJobSerDeTest {

    private final ConversionJobSerDe serDe = new ConversionJobSerDe();

    @Nested
    class ReadPayload {

        @Test
        void shouldReadSingleFileJob() {
            // Given
            String json = "{" +
                    "\"s3_key\": \"version5/aurora/gz/coll/ds/year=2020/1577836800.csv.gz\"," +
                    "\"dest_prefix\": \"version5/aurora/parquet/\"," +
                    "\"dest_store\": \"athena\"," +
                    "\"partition_size\": \"hour\"," +
                    "\"file_format\": \"parquet\"," +
                    "\"compression\": \"zst\"," +
                    "\"compression_level\": 12" +
                    "}";

            // When
            ConversionJob job = serDe.fromJson(json);

            // Then
            assertThat(job).isEqualTo(new SingleFileConversionJob(
                    "version5/aurora/gz/coll/ds/year=2020/1577836800.csv.gz",
                    ConversionTarget.builder()
                            .destinationPrefix("version5/aurora/parquet/")
                            .destinationStore(DestinationStore.ATHENA)
                            .partitionSize(PartitionSize.HOUR)
                            .fileFormat(FileFormat.PARQUET)
                            .compression(CompressionCodec.ZSTD)
                            .compressionLevel(12)
                            .build()));
        }

        @Test
        void shouldReadBackfillJobWithDefaults() {
            // Given
            String json = "{" +
                    "\"s3key_prefix\": \"version5/aurora/gz/coll/ds/year=2020/\"," +
                    "\"s3key_suffixes\": [\"1577836800.csv.gz\", \"1577840400.csv.gz\"]," +
                    "\"dest_prefix\": \"version5/aurora/arrow/\"," +
                    "\"compression\": \"lz4\"" +
                    "}";

            // When
            ConversionJob job = serDe.fromJson(json);

            // Then
            assertThat(job.isBackfill()).isTrue();
            assertThat(job.getSourceKeys()).containsExactly(
                    "version5/aurora/gz/coll/ds/year=2020/1577836800.csv.gz",
                    "version5/aurora/gz/coll/ds/year=2020/1577840400.csv.gz");
            assertThat(job.getTarget().getDestinationStore()).isEqualTo(DestinationStore.DATACLIENT);
            assertThat(job.getTarget().getPartitionSize()).isEqualTo(PartitionSize.DAY);
            assertThat(job.getTarget().getFileFormat()).isEqualTo(FileFormat.ARROW);
        }

        @Test
        void shouldRefuseCompressionLevelOutOfRange() {
            String json = "{\"s3_key\": \"a/b/c/1.csv.gz\", \"dest_prefix\": \"out/\", " +
                    "\"compression\": \"zst\", \"compression_level\": 23}";

            assertThatThrownBy(() -> serDe.fromJson(json))
                    .isInstanceOf(InvalidCompressionLevelException.class);
        }

        @Test
        void shouldRefuseUnknownPartitionSize() {
            String json = "{\"s3_key\": \"a/b/c/1.csv.gz\", \"dest_prefix\": \"out/\", " +
                    "\"compression\": \"zst\", \"partition_size\": \"week\"}";

            assertThatThrownBy(() -> serDe.fromJson(json))
                    .isInstanceOf(InvalidPartitionSizeException.class);
        }

        @Test
        void shouldRefuseJobWithNoSourceFiles() {
            String json = "{\"dest_prefix\": \"out/\", \"compression\": \"zst\"}";

            assertThatThrownBy(() -> serDe.fromJson(json))
                    .isInstanceOf(ConversionJobValidationException.class)
                    .hasMessageContaining("Missing s3_key");
        }

        @Test
        void shouldRefuseJobWithBothShapes() {
            String json = "{\"s3_key\": \"a/b/c/1.csv.gz\", \"s3key_prefix\": \"a/b/c/\", " +
                    "\"s3key_suffixes\": [\"1.csv.gz\"], \"dest_prefix\": \"out/\", \"compression\": \"zst\"}";

            assertThatThrownBy(() -> serDe.fromJson(json))
                    .isInstanceOf(ConversionJobValidationException.class)
                    .hasMessageContaining("Found both");
        }

        @Test
        void shouldRefuseInvalidJson() {
            assertThatThrownBy(() -> serDe.fromJson("{not json"))
                    .isInstanceOf(ConversionJobValidationException.class)
                    .hasMessageContaining("Could not parse JSON");
        }
    }

    @Test
    void shouldWriteAndReadBackfillJob() {
        // Given
        BackfillConversionJob job = BackfillConversionJob.fromKeys(List.of(
                "version5/aurora/gz/coll/ds/year=2019/1577833200.csv.gz",
                "version5/aurora/gz/coll/ds/year=2020/1577836800.csv.gz"),
                ConversionTarget.builder()
                        .destinationPrefix("out/")
                        .compression(CompressionCodec.GZIP)
                        .compressionLevel(6)
                        .build());

        // When
        String json = serDe.toJson(job);

        // Then
        assertThat(job.getKeyPrefix()).isEqualTo("version5/aurora/gz/coll/ds/");
        assertThat(json).contains("\"s3key_prefix\":\"version5/aurora/gz/coll/ds/\"")
                .contains("\"compression_level\":6")
                .doesNotContain("s3_key");
        assertThat(serDe.fromJson(json)).isEqualTo(job);
    }

    @Test
    void shouldWriteSingleFileJobWithSnakeCaseFields() {
        // Given
        SingleFileConversionJob job = new SingleFileConversionJob("a/b/c/1.csv.gz",
                ConversionTarget.builder()
                        .destinationPrefix("out/")
                        .compression(CompressionCodec.SNAPPY)
                        .build());

        // When
        String json = serDe.toJson(job);

        // Then
        assertThat(json).isEqualTo("{\"s3_key\":\"a/b/c/1.csv.gz\",\"dest_prefix\":\"out/\"," +
                "\"dest_store\":\"dataclient\",\"partition_size\":\"day\",\"file_format\":\"arrow\"," +
                "\"compression\":\"sz\"}");
    }
}
