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

import java.util.List;
import java.util.Objects;

/**
 * Converts a batch of historical source files. The files are given as a common key prefix and a list of suffixes, to
 * keep queue messages small.
 */
public class BackfillConversionJob implements ConversionJob {

    private final String keyPrefix;
    private final List<String> keySuffixes;
    private final ConversionTarget target;

    public BackfillConversionJob(String keyPrefix, List<String> keySuffixes, ConversionTarget target) {
        if (keyPrefix == null) {
            throw new ConversionJobValidationException("Missing s3key_prefix");
        }
        if (keySuffixes == null || keySuffixes.isEmpty()) {
            throw new ConversionJobValidationException("Missing s3key_suffixes");
        }
        this.keyPrefix = keyPrefix;
        this.keySuffixes = List.copyOf(keySuffixes);
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Creates a job from full source keys, extracting their longest common prefix ending in a path separator.
     *
     * @param  sourceKeys the source keys
     * @param  target     the output target
     * @return            the job
     */
    public static BackfillConversionJob fromKeys(List<String> sourceKeys, ConversionTarget target) {
        if (sourceKeys.isEmpty()) {
            throw new ConversionJobValidationException("Missing s3key_suffixes");
        }
        String prefix = commonDirectoryPrefix(sourceKeys);
        List<String> suffixes = sourceKeys.stream()
                .map(key -> key.substring(prefix.length()))
                .toList();
        return new BackfillConversionJob(prefix, suffixes, target);
    }

    private static String commonDirectoryPrefix(List<String> keys) {
        String prefix = keys.get(0).substring(0, keys.get(0).lastIndexOf('/') + 1);
        for (String key : keys) {
            while (!key.startsWith(prefix)) {
                prefix = prefix.substring(0, prefix.lastIndexOf('/', prefix.length() - 2) + 1);
            }
        }
        return prefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public List<String> getKeySuffixes() {
        return keySuffixes;
    }

    @Override
    public ConversionTarget getTarget() {
        return target;
    }

    @Override
    public List<String> getSourceKeys() {
        return keySuffixes.stream()
                .map(suffix -> keyPrefix + suffix)
                .toList();
    }

    @Override
    public boolean isBackfill() {
        return true;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        BackfillConversionJob that = (BackfillConversionJob) object;
        return Objects.equals(keyPrefix, that.keyPrefix)
                && Objects.equals(keySuffixes, that.keySuffixes)
                && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyPrefix, keySuffixes, target);
    }

    @Override
    public String toString() {
        return "BackfillConversionJob{" +
                "keyPrefix='" + keyPrefix + '\'' +
                ", keySuffixes=" + keySuffixes +
                ", target=" + target +
                '}';
    }
}
