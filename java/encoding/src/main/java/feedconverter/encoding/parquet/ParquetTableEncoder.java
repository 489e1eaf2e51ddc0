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
package feedconverter.encoding.parquet;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.schema.MessageType;

import feedconverter.core.format.CompressionCodec;
import feedconverter.encoding.TableEncoder;

import java.io.IOException;

/**
 * Writes a table as a Parquet file held in memory. The codec is applied to each page by the Parquet writer, so
 * compression always happens as the file is written.
 */
public class ParquetTableEncoder implements TableEncoder {

    static final String ZSTD_LEVEL_PROPERTY = "parquet.compression.codec.zstd.level";

    private final Configuration conf;

    public ParquetTableEncoder() {
        this(new Configuration());
    }

    public ParquetTableEncoder(Configuration conf) {
        this.conf = conf;
    }

    @Override
    public byte[] encode(VectorSchemaRoot table, CompressionCodec codec, Integer compressionLevel) throws IOException {
        Configuration writeConf = new Configuration(conf);
        if (codec == CompressionCodec.ZSTD) {
            writeConf.setInt(ZSTD_LEVEL_PROPERTY, codec.levelOrDefault(compressionLevel));
        }
        ByteArrayOutputFile file = new ByteArrayOutputFile();
        try (ParquetWriter<Integer> writer = new Builder(file, table)
                .withConf(writeConf)
                .withCompressionCodec(parquetCodec(codec))
                .build()) {
            for (int row = 0; row < table.getRowCount(); row++) {
                writer.write(row);
            }
        }
        return file.toByteArray();
    }

    /**
     * Finds the Parquet page codec for a compression codec.
     *
     * @param  codec the codec
     * @return       the Parquet codec
     */
    public static CompressionCodecName parquetCodec(CompressionCodec codec) {
        switch (codec) {
            case GZIP:
                return CompressionCodecName.GZIP;
            case ZSTD:
                return CompressionCodecName.ZSTD;
            case LZ4:
                return CompressionCodecName.LZ4_RAW;
            case SNAPPY:
                return CompressionCodecName.SNAPPY;
            default:
                throw new IllegalArgumentException("Unrecognised codec: " + codec);
        }
    }

    /**
     * Builds a writer which takes row numbers of a table.
     */
    private static class Builder extends ParquetWriter.Builder<Integer, Builder> {
        private final MessageType messageType;
        private final VectorSchemaRoot table;

        private Builder(OutputFile file, VectorSchemaRoot table) {
            super(file);
            this.messageType = ParquetSchemaConverter.getSchema(table.getSchema());
            this.table = table;
        }

        @Override
        protected WriteSupport<Integer> getWriteSupport(Configuration conf) {
            return new TableWriteSupport(messageType, table);
        }

        @Override
        protected Builder self() {
            return this;
        }
    }
}
