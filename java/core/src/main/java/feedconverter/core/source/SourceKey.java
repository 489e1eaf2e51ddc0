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
package feedconverter.core.source;

import java.time.Instant;
import java.util.Objects;

/**
 * A reference to a source file in the object store. The key has the shape
 * {@code <prefix><collection>/<dataset>/.../<unix timestamp>.<extension>}, where the timestamp is the start of the
 * data held in the file, in seconds since the epoch.
 */
public class SourceKey {

    private final String key;
    private final String collection;
    private final String dataset;
    private final Instant timestamp;

    private SourceKey(String key, String collection, String dataset, Instant timestamp) {
        this.key = key;
        this.collection = collection;
        this.dataset = dataset;
        this.timestamp = timestamp;
    }

    /**
     * Parses a source object key.
     *
     * @param  key                   the full object key
     * @param  sourcePrefix          the prefix that all source keys are held under
     * @return                       the parsed reference
     * @throws MalformedKeyException if the key does not have the expected shape
     */
    public static SourceKey parse(String key, String sourcePrefix) {
        if (!key.startsWith(sourcePrefix)) {
            throw new MalformedKeyException(key, "not under source prefix " + sourcePrefix);
        }
        String[] segments = key.substring(sourcePrefix.length()).split("/");
        if (segments.length < 3 || segments[0].isEmpty() || segments[1].isEmpty()) {
            throw new MalformedKeyException(key, "expected <collection>/<dataset>/.../<timestamp>.<extension>");
        }
        return new SourceKey(key, segments[0], segments[1], extractTimestamp(key));
    }

    /**
     * Reads the timestamp embedded in the filename of a source object key.
     *
     * @param  key                   the object key
     * @return                       the timestamp
     * @throws MalformedKeyException if the filename does not start with an integer
     */
    public static Instant extractTimestamp(String key) {
        String filename = key.substring(key.lastIndexOf('/') + 1);
        int dot = filename.indexOf('.');
        String leading = dot < 0 ? filename : filename.substring(0, dot);
        try {
            return Instant.ofEpochSecond(Long.parseLong(leading));
        } catch (NumberFormatException e) {
            throw new MalformedKeyException(key, "filename does not start with a unix timestamp", e);
        }
    }

    public String getKey() {
        return key;
    }

    public String getCollection() {
        return collection;
    }

    public String getDataset() {
        return dataset;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        SourceKey that = (SourceKey) object;
        return Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
