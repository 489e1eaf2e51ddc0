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
package feedconverter.core.format;

import feedconverter.core.job.ConversionJobValidationException;
import feedconverter.core.job.InvalidCompressionLevelException;

/**
 * A compression codec for converted files. The code is used in job payloads and as the file extension in the generic
 * store.
 */
public enum CompressionCodec {
    // Higher levels use more memory and compress further
    GZIP("gz", 1, 9, 9),
    // Higher levels are slower and compress further. Negative levels trade ratio for speed.
    ZSTD("zst", -131072, 22, 1),
    LZ4("lz4"),
    SNAPPY("sz");

    private final String code;
    private final boolean levelSupported;
    private final int minLevel;
    private final int maxLevel;
    private final int defaultLevel;

    CompressionCodec(String code) {
        this.code = code;
        this.levelSupported = false;
        this.minLevel = 0;
        this.maxLevel = 0;
        this.defaultLevel = 0;
    }

    CompressionCodec(String code, int minLevel, int maxLevel, int defaultLevel) {
        this.code = code;
        this.levelSupported = true;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.defaultLevel = defaultLevel;
    }

    /**
     * Reads a codec from its code, e.g. "zst".
     *
     * @param  code the code
     * @return      the codec
     */
    public static CompressionCodec fromCode(String code) {
        for (CompressionCodec codec : values()) {
            if (codec.code.equals(code)) {
                return codec;
            }
        }
        throw new ConversionJobValidationException("Invalid compression: " + code);
    }

    /**
     * Checks a requested compression level is within the valid range for this codec. A null level is always valid,
     * and means the default level will be used.
     *
     * @param  level                            the requested level, or null
     * @throws InvalidCompressionLevelException if the level is out of range or the codec does not take a level
     */
    public void validateLevel(Integer level) {
        if (level == null) {
            return;
        }
        if (!levelSupported) {
            throw new InvalidCompressionLevelException(code + " does not support compression levels, found " + level);
        }
        if (level < minLevel || level > maxLevel) {
            throw new InvalidCompressionLevelException(
                    level + " is outside the range " + minLevel + " to " + maxLevel + " for " + code);
        }
    }

    /**
     * Picks the level to compress at.
     *
     * @param  requested the level requested in the job, or null
     * @return           the requested level, or the codec default
     */
    public int levelOrDefault(Integer requested) {
        return requested != null ? requested : defaultLevel;
    }

    public String getCode() {
        return code;
    }
}
