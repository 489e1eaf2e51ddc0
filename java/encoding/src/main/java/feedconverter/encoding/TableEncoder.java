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

import org.apache.arrow.vector.VectorSchemaRoot;

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.format.FileFormat;
import feedconverter.encoding.parquet.ParquetTableEncoder;

import java.io.IOException;

/**
 * Serialises a table into the bytes of a converted file.
 */
@FunctionalInterface
public interface TableEncoder {

    /**
     * Encodes a table. The table is not closed.
     *
     * @param  table            the table
     * @param  codec            the compression codec
     * @param  compressionLevel the compression level, or null to use the default for the codec. Must already have
     *                          been validated against the codec.
     * @return                  the encoded bytes
     * @throws IOException      if the table could not be serialised or compressed
     */
    byte[] encode(VectorSchemaRoot table, CompressionCodec codec, Integer compressionLevel) throws IOException;

    /**
     * Creates an encoder for a file format.
     *
     * @param  format the format
     * @return        the encoder
     */
    static TableEncoder forFormat(FileFormat format) {
        switch (format) {
            case ARROW:
                return new ArrowStreamTableEncoder();
            case PARQUET:
                return new ParquetTableEncoder();
            default:
                throw new IllegalArgumentException("Unrecognised file format: " + format);
        }
    }
}
