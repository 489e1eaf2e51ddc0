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

import com.github.luben.zstd.ZstdOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream;
import org.xerial.snappy.Snappy;

import feedconverter.core.format.CompressionCodec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Applies compression codecs to whole serialised files. Codecs with a streaming implementation compress as the data
 * is written. Snappy is applied in one call to the whole buffer, using the raw block format.
 */
public class CompressionStreams {

    private CompressionStreams() {
    }

    /**
     * Checks whether a codec can compress while the data is written.
     *
     * @param  codec the codec
     * @return       true if {@link #compressing} supports the codec
     */
    public static boolean isStreaming(CompressionCodec codec) {
        return codec != CompressionCodec.SNAPPY;
    }

    /**
     * Wraps a stream to compress everything written to it. Closing the returned stream finishes the compressed data
     * and closes the underlying stream.
     *
     * @param  out         the stream to write compressed data to
     * @param  codec       the codec
     * @param  level       the compression level, ignored for codecs without levels
     * @return             the compressing stream
     * @throws IOException if the compressor could not be created
     */
    public static OutputStream compressing(OutputStream out, CompressionCodec codec, int level) throws IOException {
        switch (codec) {
            case GZIP:
                GzipParameters parameters = new GzipParameters();
                parameters.setCompressionLevel(level);
                return new GzipCompressorOutputStream(out, parameters);
            case ZSTD:
                return new ZstdOutputStream(out, level);
            case LZ4:
                return new FramedLZ4CompressorOutputStream(out);
            default:
                throw new IllegalArgumentException("Codec does not support streaming compression: " + codec.getCode());
        }
    }

    /**
     * Compresses a complete buffer.
     *
     * @param  data        the uncompressed data
     * @param  codec       the codec
     * @param  level       the compression level, ignored for codecs without levels
     * @return             the compressed data
     * @throws IOException if compression failed
     */
    public static byte[] compress(byte[] data, CompressionCodec codec, int level) throws IOException {
        if (codec == CompressionCodec.SNAPPY) {
            return Snappy.compress(data);
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = compressing(bytes, codec, level)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }
}
