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

import feedconverter.core.format.CompressionCodec;
import feedconverter.core.format.DestinationStore;
import feedconverter.core.format.FileFormat;
import feedconverter.core.partition.PartitionSize;

import java.util.Objects;

/**
 * Where and how the output of a conversion job is written. This is validated on construction, so a target that exists
 * is always a supported combination of parameters.
 */
public class ConversionTarget {

    private final String destinationPrefix;
    private final DestinationStore destinationStore;
    private final PartitionSize partitionSize;
    private final FileFormat fileFormat;
    private final CompressionCodec compression;
    private final Integer compressionLevel;

    private ConversionTarget(Builder builder) {
        destinationPrefix = requireField(builder.destinationPrefix, "dest_prefix");
        destinationStore = requireField(builder.destinationStore, "dest_store");
        partitionSize = requireField(builder.partitionSize, "partition_size");
        fileFormat = requireField(builder.fileFormat, "file_format");
        compression = requireField(builder.compression, "compression");
        compressionLevel = builder.compressionLevel;
        if (!destinationPrefix.endsWith("/")) {
            throw new ConversionJobValidationException("Invalid dest prefix, must end with /: " + destinationPrefix);
        }
        compression.validateLevel(compressionLevel);
        if (!destinationStore.supports(fileFormat)) {
            throw new UnsupportedCombinationException(
                    "dest_store " + destinationStore.getName() + " does not accept file_format " + fileFormat.getName());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks that output will not be written among the source files.
     *
     * @param  sourcePrefix                      the prefix source files are held under
     * @throws ConversionJobValidationException if the destination prefix is under the source prefix
     */
    public void validateDestinationPrefix(String sourcePrefix) {
        if (destinationPrefix.startsWith(sourcePrefix)) {
            throw new ConversionJobValidationException(
                    "Invalid dest prefix, must not be under the source prefix " + sourcePrefix + ": " + destinationPrefix);
        }
    }

    private static <T> T requireField(T value, String field) {
        if (value == null) {
            throw new ConversionJobValidationException("Missing " + field);
        }
        return value;
    }

    public String getDestinationPrefix() {
        return destinationPrefix;
    }

    public DestinationStore getDestinationStore() {
        return destinationStore;
    }

    public PartitionSize getPartitionSize() {
        return partitionSize;
    }

    public FileFormat getFileFormat() {
        return fileFormat;
    }

    public CompressionCodec getCompression() {
        return compression;
    }

    public Integer getCompressionLevel() {
        return compressionLevel;
    }

    public Builder toBuilder() {
        return builder()
                .destinationPrefix(destinationPrefix)
                .destinationStore(destinationStore)
                .partitionSize(partitionSize)
                .fileFormat(fileFormat)
                .compression(compression)
                .compressionLevel(compressionLevel);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        ConversionTarget that = (ConversionTarget) object;
        return Objects.equals(destinationPrefix, that.destinationPrefix)
                && destinationStore == that.destinationStore
                && partitionSize == that.partitionSize
                && fileFormat == that.fileFormat
                && compression == that.compression
                && Objects.equals(compressionLevel, that.compressionLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destinationPrefix, destinationStore, partitionSize, fileFormat, compression, compressionLevel);
    }

    @Override
    public String toString() {
        return "ConversionTarget{" +
                "destinationPrefix='" + destinationPrefix + '\'' +
                ", destinationStore=" + destinationStore +
                ", partitionSize=" + partitionSize +
                ", fileFormat=" + fileFormat +
                ", compression=" + compression +
                ", compressionLevel=" + compressionLevel +
                '}';
    }

    /**
     * Builds conversion targets.
     */
    public static final class Builder {
        private String destinationPrefix;
        private DestinationStore destinationStore = DestinationStore.DATACLIENT;
        private PartitionSize partitionSize = PartitionSize.DAY;
        private FileFormat fileFormat = FileFormat.ARROW;
        private CompressionCodec compression;
        private Integer compressionLevel;

        private Builder() {
        }

        public Builder destinationPrefix(String destinationPrefix) {
            this.destinationPrefix = destinationPrefix;
            return this;
        }

        public Builder destinationStore(DestinationStore destinationStore) {
            this.destinationStore = destinationStore;
            return this;
        }

        public Builder partitionSize(PartitionSize partitionSize) {
            this.partitionSize = partitionSize;
            return this;
        }

        public Builder fileFormat(FileFormat fileFormat) {
            this.fileFormat = fileFormat;
            return this;
        }

        public Builder compression(CompressionCodec compression) {
            this.compression = compression;
            return this;
        }

        public Builder compressionLevel(Integer compressionLevel) {
            this.compressionLevel = compressionLevel;
            return this;
        }

        public ConversionTarget build() {
            return new ConversionTarget(this);
        }
    }
}
