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
package feedconverter.core.destination;

import feedconverter.core.format.DestinationStore;
import feedconverter.core.format.FileFormat;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.job.UnsupportedCombinationException;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Derives the object key a converted file is written to. The key depends only on the target and the bucket, so
 * re-running a job overwrites its previous output.
 */
public class DestinationKeyBuilder {

    private final ConversionTarget target;

    public DestinationKeyBuilder(ConversionTarget target) {
        this.target = target;
    }

    /**
     * Builds the object key for a converted file.
     *
     * @param  collection  the collection the data came from
     * @param  dataset     the dataset the data came from
     * @param  bucketStart the start of the partition bucket the file holds
     * @return             the object key
     */
    public String buildKey(String collection, String dataset, Instant bucketStart) {
        String prefix = datasetPrefix(collection, dataset);
        long timestamp = bucketStart.getEpochSecond();
        DestinationStore store = target.getDestinationStore();
        switch (store) {
            case DATACLIENT:
                return prefix + "year=" + bucketStart.atZone(ZoneOffset.UTC).getYear() + "/"
                        + timestamp + "." + target.getFileFormat().getName() + "." + target.getCompression().getCode();
            case ATHENA:
                if (target.getFileFormat() != FileFormat.PARQUET) {
                    throw new UnsupportedCombinationException("athena requires parquet");
                }
                return prefix + target.getPartitionSize().getPartitionKeyName() + "="
                        + target.getPartitionSize().formatPartitionValue(bucketStart) + "/"
                        + timestamp + ".parquet";
            default:
                throw new IllegalStateException("Unexpected destination store: " + store);
        }
    }

    /**
     * Builds the prefix all converted files for a dataset are written under.
     *
     * @param  collection the collection
     * @param  dataset    the dataset
     * @return            the prefix, ending with a path separator
     */
    public String datasetPrefix(String collection, String dataset) {
        return normalisePrefix(target.getDestinationPrefix()) + collection + "/" + dataset + "/";
    }

    private static String normalisePrefix(String prefix) {
        if (prefix.isEmpty() || prefix.endsWith("/")) {
            return prefix;
        }
        return prefix + "/";
    }
}
