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
package feedconverter.conversion.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.conversion.store.ObjectStore;
import feedconverter.core.destination.DestinationKeyBuilder;
import feedconverter.core.format.DestinationStore;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.job.SingleFileConversionJob;
import feedconverter.core.properties.ConverterProperties;
import feedconverter.core.source.SourceKey;

import java.util.List;
import java.util.stream.Collectors;

import static feedconverter.core.properties.ConverterProperty.DESTINATION_BUCKET;
import static feedconverter.core.properties.ConverterProperty.METADATA_FILENAME;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_FILE_SUFFIX;
import static feedconverter.core.properties.ConverterProperty.SOURCE_PREFIX;

/**
 * Reacts to new or updated objects in the source bucket. A new source file creates one job for each live target. A
 * new dataset metadata file is copied straight to each live target in the data client store.
 */
public class LiveJobCreator {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiveJobCreator.class);

    private final ObjectStore objectStore;
    private final List<ConversionTarget> targets;
    private final String sourceBucket;
    private final String sourcePrefix;
    private final String destinationBucket;
    private final String sourceFileSuffix;
    private final String metadataFilename;

    public LiveJobCreator(ConverterProperties properties, ObjectStore objectStore, List<ConversionTarget> targets) {
        this.objectStore = objectStore;
        this.targets = List.copyOf(targets);
        this.sourceBucket = properties.get(SOURCE_BUCKET);
        this.sourcePrefix = properties.get(SOURCE_PREFIX);
        this.destinationBucket = properties.get(DESTINATION_BUCKET);
        this.sourceFileSuffix = properties.get(SOURCE_FILE_SUFFIX);
        this.metadataFilename = properties.get(METADATA_FILENAME);
        this.targets.forEach(target -> target.validateDestinationPrefix(sourcePrefix));
    }

    /**
     * Handles a new or updated object in the source bucket.
     *
     * @param  key the object key
     * @return     the jobs to convert the object, or an empty list if it is not a source file
     */
    public List<SingleFileConversionJob> onObjectWritten(String key) {
        if (key.endsWith("/" + metadataFilename)) {
            copyMetadata(key);
            return List.of();
        }
        if (!key.endsWith(sourceFileSuffix)) {
            LOGGER.info("Ignoring object that is not a source file: {}", key);
            return List.of();
        }
        SourceKey.parse(key, sourcePrefix);
        return targets.stream()
                .map(target -> new SingleFileConversionJob(key, target))
                .collect(Collectors.toList());
    }

    private void copyMetadata(String key) {
        String[] segments = key.startsWith(sourcePrefix)
                ? key.substring(sourcePrefix.length()).split("/")
                : new String[0];
        if (segments.length != 3) {
            LOGGER.info("Ignoring metadata file outside of a dataset directory: {}", key);
            return;
        }
        for (ConversionTarget target : targets) {
            if (target.getDestinationStore() == DestinationStore.DATACLIENT) {
                String destinationKey = new DestinationKeyBuilder(target).datasetPrefix(segments[0], segments[1]) + metadataFilename;
                objectStore.copy(sourceBucket, key, destinationBucket, destinationKey);
            }
        }
    }
}
