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

import java.util.List;

class ConversionJobJson {
    private final String s3Key;
    private final String s3keyPrefix;
    private final List<String> s3keySuffixes;
    private final String destPrefix;
    private final String destStore;
    private final String partitionSize;
    private final String fileFormat;
    private final String compression;
    private final Integer compressionLevel;

    private ConversionJobJson(Builder builder) {
        s3Key = builder.s3Key;
        s3keyPrefix = builder.s3keyPrefix;
        s3keySuffixes = builder.s3keySuffixes;
        destPrefix = builder.destPrefix;
        destStore = builder.destStore;
        partitionSize = builder.partitionSize;
        fileFormat = builder.fileFormat;
        compression = builder.compression;
        compressionLevel = builder.compressionLevel;
    }

    static ConversionJobJson from(ConversionJob job) {
        ConversionTarget target = job.getTarget();
        Builder builder = new Builder()
                .destPrefix(target.getDestinationPrefix())
                .destStore(target.getDestinationStore().getName())
                .partitionSize(target.getPartitionSize().getName())
                .fileFormat(target.getFileFormat().getName())
                .compression(target.getCompression().getCode())
                .compressionLevel(target.getCompressionLevel());
        if (job.isBackfill()) {
            BackfillConversionJob backfill = (BackfillConversionJob) job;
            builder.s3keyPrefix(backfill.getKeyPrefix())
                    .s3keySuffixes(backfill.getKeySuffixes());
        } else {
            builder.s3Key(((SingleFileConversionJob) job).getSourceKey());
        }
        return builder.build();
    }

    ConversionJob to() {
        ConversionTarget target = ConversionTarget.builder()
                .destinationPrefix(destPrefix)
                .destinationStore(destStore == null ? DestinationStore.DATACLIENT : DestinationStore.fromName(destStore))
                .partitionSize(partitionSize == null ? PartitionSize.DAY : PartitionSize.fromName(partitionSize))
                .fileFormat(fileFormat == null ? FileFormat.ARROW : FileFormat.fromName(fileFormat))
                .compression(compression == null ? null : CompressionCodec.fromCode(compression))
                .compressionLevel(compressionLevel)
                .build();
        if (s3Key != null && (s3keyPrefix != null || s3keySuffixes != null)) {
            throw new ConversionJobValidationException("Found both s3_key and s3key_prefix/s3key_suffixes");
        }
        if (s3Key != null) {
            return new SingleFileConversionJob(s3Key, target);
        } else if (s3keyPrefix != null || s3keySuffixes != null) {
            return new BackfillConversionJob(s3keyPrefix, s3keySuffixes, target);
        } else {
            throw new ConversionJobValidationException("Missing s3_key or s3key_prefix with s3key_suffixes");
        }
    }

    private static final class Builder {
        private String s3Key;
        private String s3keyPrefix;
        private List<String> s3keySuffixes;
        private String destPrefix;
        private String destStore;
        private String partitionSize;
        private String fileFormat;
        private String compression;
        private Integer compressionLevel;

        private Builder() {
        }

        Builder s3Key(String s3Key) {
            this.s3Key = s3Key;
            return this;
        }

        Builder s3keyPrefix(String s3keyPrefix) {
            this.s3keyPrefix = s3keyPrefix;
            return this;
        }

        Builder s3keySuffixes(List<String> s3keySuffixes) {
            this.s3keySuffixes = s3keySuffixes;
            return this;
        }

        Builder destPrefix(String destPrefix) {
            this.destPrefix = destPrefix;
            return this;
        }

        Builder destStore(String destStore) {
            this.destStore = destStore;
            return this;
        }

        Builder partitionSize(String partitionSize) {
            this.partitionSize = partitionSize;
            return this;
        }

        Builder fileFormat(String fileFormat) {
            this.fileFormat = fileFormat;
            return this;
        }

        Builder compression(String compression) {
            this.compression = compression;
            return this;
        }

        Builder compressionLevel(Integer compressionLevel) {
            this.compressionLevel = compressionLevel;
            return this;
        }

        ConversionJobJson build() {
            return new ConversionJobJson(this);
        }
    }
}
