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

import java.util.List;

/**
 * The source files that fall into one partition bucket. Each group becomes one conversion job.
 *
 * @param bucket the bucket
 * @param keys   the source object keys in the bucket, in sorted order
 */
public record PartitionGroup(PartitionBucket bucket, List<String> keys) {
}
