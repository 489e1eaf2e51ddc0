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

import java.time.Instant;

/**
 * A time bucket of source files for one dataset. Covers the half-open interval from the start to the start of the next
 * bucket of the same size.
 *
 * @param collection the collection the dataset belongs to
 * @param dataset    the dataset
 * @param start      the start of the bucket, inclusive
 * @param size       the width of the bucket
 */
public record PartitionBucket(String collection, String dataset, Instant start, PartitionSize size) {

    public Instant end() {
        return size.bucketEnd(start);
    }

    public boolean contains(Instant time) {
        return !time.isBefore(start) && time.isBefore(end());
    }
}
