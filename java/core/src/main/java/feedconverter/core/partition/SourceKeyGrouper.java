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
package feedconverter.core.partition;

import feedconverter.core.source.SourceKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Groups source object keys into partition buckets.
 */
public class SourceKeyGrouper {

    private final String sourcePrefix;

    public SourceKeyGrouper(String sourcePrefix) {
        this.sourcePrefix = Objects.requireNonNull(sourcePrefix, "sourcePrefix must not be null");
    }

    /**
     * Groups source keys by the bucket they fall into. The keys are sorted first, which puts them in time order as
     * the filenames hold fixed width timestamps. Consecutive keys in the same bucket are then merged into one group.
     *
     * @param  keys the source object keys, in any order
     * @param  size the bucket width
     * @return      one group per bucket, in time order
     */
    public List<PartitionGroup> group(List<String> keys, PartitionSize size) {
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        List<PartitionGroup> groups = new ArrayList<>();
        PartitionBucket currentBucket = null;
        List<String> currentKeys = new ArrayList<>();
        for (String key : sorted) {
            PartitionBucket bucket = bucketFor(key, size);
            if (!bucket.equals(currentBucket)) {
                if (currentBucket != null) {
                    groups.add(new PartitionGroup(currentBucket, List.copyOf(currentKeys)));
                }
                currentBucket = bucket;
                currentKeys.clear();
            }
            currentKeys.add(key);
        }
        if (currentBucket != null) {
            groups.add(new PartitionGroup(currentBucket, List.copyOf(currentKeys)));
        }
        return groups;
    }

    /**
     * Finds the bucket a source key falls into.
     *
     * @param  key  the source object key
     * @param  size the bucket width
     * @return      the bucket
     */
    public PartitionBucket bucketFor(String key, PartitionSize size) {
        SourceKey sourceKey = SourceKey.parse(key, sourcePrefix);
        return new PartitionBucket(sourceKey.getCollection(), sourceKey.getDataset(),
                size.floor(sourceKey.getTimestamp()), size);
    }
}
