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
package feedconverter.conversion.store;

import java.util.List;

/**
 * Reads and writes objects in buckets of an object store.
 */
public interface ObjectStore {

    /**
     * Reads the whole contents of an object.
     *
     * @param  bucket                  the bucket
     * @param  key                     the object key
     * @return                         the contents
     * @throws ObjectNotFoundException if the object does not exist
     */
    byte[] get(String bucket, String key);

    /**
     * Writes an object, replacing any existing object with the same key.
     *
     * @param bucket the bucket
     * @param key    the object key
     * @param data   the contents
     */
    void put(String bucket, String key, byte[] data);

    /**
     * Copies an object, replacing any existing object at the destination.
     *
     * @param  sourceBucket            the bucket to copy from
     * @param  sourceKey               the key to copy from
     * @param  destinationBucket       the bucket to copy to
     * @param  destinationKey          the key to copy to
     * @throws ObjectNotFoundException if the source object does not exist
     */
    void copy(String sourceBucket, String sourceKey, String destinationBucket, String destinationKey);

    /**
     * Lists keys of objects under a prefix, at any depth.
     *
     * @param  bucket the bucket
     * @param  prefix the prefix
     * @param  suffix only keys ending with this are returned
     * @return        the keys, sorted
     */
    List<String> listKeys(String bucket, String prefix, String suffix);

    /**
     * Lists the directories directly under a prefix. A directory is any key prefix followed by a path separator.
     *
     * @param  bucket the bucket
     * @param  prefix the prefix, ending with a path separator
     * @return        the full prefixes of the directories, each ending with a path separator, sorted
     */
    List<String> listDirectories(String bucket, String prefix);
}
