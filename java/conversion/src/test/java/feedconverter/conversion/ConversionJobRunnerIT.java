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
package feedconverter.conversion;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.Test;

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.job.SingleFileConversionJob;
import feedconverter.core.partition.PartitionSize;
import feedconverter.core.properties.ConverterProperties;
import feedconverter.encoding.ArrowStreamDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static feedconverter.conversion.ConversionTestData.METADATA;
import static feedconverter.conversion.ConversionTestData.sourceKey;
import static feedconverter.core.properties.ConverterProperty.DESTINATION_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.table.TableTestHelper.dailyPriceLines;
import static feedconverter.table.TableTestHelper.gzipCsv;
import static org.assertj.core.api.Assertions.assertThat;

public class ConversionJobRunnerIT extends LocalStackTestBase {

    private final String sourceBucket = createBucket();
    private final String destinationBucket = createBucket();

    @Test
    void shouldConvertFileInS3() {
        // Given
        ConverterProperties properties = new ConverterProperties();
        properties.set(SOURCE_BUCKET, sourceBucket);
        properties.set(DESTINATION_BUCKET, destinationBucket);
        String key = sourceKey("caiso", "prices", 1577836800L);
        putObject(sourceBucket, key, gzipCsv(dailyPriceLines(1577836800L)));
        putObject(sourceBucket, "version5/aurora/gz/caiso/prices/METADATA.json", METADATA.getBytes(StandardCharsets.UTF_8));
        ConversionTarget target = ConversionTarget.builder()
                .destinationPrefix("version5/aurora/arrow/")
                .partitionSize(PartitionSize.DAY)
                .compression(CompressionCodec.LZ4)
                .build();

        // When
        List<String> written = new ConversionJobRunner(properties, objectStore).run(new SingleFileConversionJob(key, target));

        // Then
        assertThat(listObjectKeys(destinationBucket)).containsExactly(
                "version5/aurora/arrow/caiso/prices/METADATA.json",
                "version5/aurora/arrow/caiso/prices/year=2020/1577836800.arrow.lz4");
        assertThat(written).containsExactly("version5/aurora/arrow/caiso/prices/year=2020/1577836800.arrow.lz4");
        try (BufferAllocator allocator = new RootAllocator()) {
            assertThat(ArrowStreamDecoder.decode(getObject(destinationBucket, written.get(0)), CompressionCodec.LZ4, allocator)
                    .rows()).hasSize(24);
        }
    }
}
