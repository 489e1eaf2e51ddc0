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
import org.apache.arrow.vector.dictionary.DictionaryProvider.MapDictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.util.NumberFormatUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a table as an Arrow IPC stream, with the whole stream compressed. Streaming codecs compress as the stream is
 * written. Other codecs are applied to the uncompressed stream once it is complete, which holds roughly two copies
 * of the serialised table in memory.
 */
public class ArrowStreamTableEncoder implements TableEncoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArrowStreamTableEncoder.class);

    @Override
    public byte[] encode(VectorSchemaRoot table, CompressionCodec codec, Integer compressionLevel) throws IOException {
        int level = codec.levelOrDefault(compressionLevel);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        if (CompressionStreams.isStreaming(codec)) {
            try (OutputStream out = CompressionStreams.compressing(bytes, codec, level)) {
                writeStream(table, out);
            }
            return bytes.toByteArray();
        } else {
            writeStream(table, bytes);
            LOGGER.debug("Buffered {} uncompressed stream before compressing with {}",
                    NumberFormatUtils.formatBytes(bytes.size()), codec.getCode());
            return CompressionStreams.compress(bytes.toByteArray(), codec, level);
        }
    }

    private static void writeStream(VectorSchemaRoot table, OutputStream out) throws IOException {
        try (ArrowStreamWriter writer = new ArrowStreamWriter(table, new MapDictionaryProvider(), out)) {
            writer.start();
            writer.writeBatch();
            writer.end();
        }
    }
}
