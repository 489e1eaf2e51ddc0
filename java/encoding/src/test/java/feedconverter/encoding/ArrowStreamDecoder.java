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

import com.github.luben.zstd.ZstdInputStream;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorInputStream;
import org.xerial.snappy.Snappy;

import feedconverter.core.format.CompressionCodec;
import feedconverter.table.TableTestHelper;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads back files written by {@link ArrowStreamTableEncoder} in tests.
 */
public class ArrowStreamDecoder {

    private ArrowStreamDecoder() {
    }

    /**
     * Decompresses and reads an Arrow IPC stream.
     *
     * @param  bytes     the compressed stream
     * @param  codec     the codec the stream was compressed with
     * @param  allocator the allocator to read into
     * @return           the schema and rows of the stream
     */
    public static DecodedTable decode(byte[] bytes, CompressionCodec codec, BufferAllocator allocator) {
        try (InputStream in = decompressing(bytes, codec);
                ArrowStreamReader reader = new ArrowStreamReader(in, allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            Schema schema = root.getSchema();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (reader.loadNextBatch()) {
                rows.addAll(TableTestHelper.rows(root));
            }
            return new DecodedTable(schema, rows);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InputStream decompressing(byte[] bytes, CompressionCodec codec) throws IOException {
        switch (codec) {
            case GZIP:
                return new GZIPInputStream(new ByteArrayInputStream(bytes));
            case ZSTD:
                return new ZstdInputStream(new ByteArrayInputStream(bytes));
            case LZ4:
                return new FramedLZ4CompressorInputStream(new ByteArrayInputStream(bytes));
            case SNAPPY:
                return new ByteArrayInputStream(Snappy.uncompress(bytes));
            default:
                throw new IllegalArgumentException("Unrecognised codec: " + codec);
        }
    }

    /**
     * The contents of a decoded stream.
     *
     * @param schema the schema
     * @param rows   the rows, in the order they were written
     */
    public record DecodedTable(Schema schema, List<Map<String, Object>> rows) {
    }
}
