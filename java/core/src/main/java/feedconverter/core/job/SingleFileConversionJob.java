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
 * Converts one source file, triggered when it is written.
 */
public class SingleFileConversionJob implements ConversionJob {

    private final String sourceKey;
    private final ConversionTarget target;

    public SingleFileConversionJob(String sourceKey, ConversionTarget target) {
        if (sourceKey == null || sourceKey.isEmpty()) {
            throw new ConversionJobValidationException("Missing s3_key");
        }
        this.sourceKey = sourceKey;
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public String getSourceKey() {
        return sourceKey;
    }

    @Override
    public ConversionTarget getTarget() {
        return target;
    }

    @Override
    public List<String> getSourceKeys() {
        return List.of(sourceKey);
    }

    @Override
    public boolean isBackfill() {
        return false;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        SingleFileConversionJob that = (SingleFileConversionJob) object;
        return Objects.equals(sourceKey, that.sourceKey) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceKey, target);
    }

    @Override
    public String toString() {
        return "SingleFileConversionJob{sourceKey='" + sourceKey + "', target=" + target + '}';
    }
}
