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
import feedconverter.core.job.BackfillConversionJob;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.partition.PartitionGroup;
import feedconverter.core.partition.SourceKeyGrouper;
import feedconverter.core.properties.ConverterProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_FILE_SUFFIX;
import static feedconverter.core.properties.ConverterProperty.SOURCE_PREFIX;

/**
 * Creates jobs to convert all existing source files of datasets. Files are grouped by partition bucket, with one job
 * per bucket. Sending the jobs to the queue is left to the caller.
 */
public class BackfillJobCreator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackfillJobCreator.class);

    private final ObjectStore objectStore;
    private final String sourceBucket;
    private final String sourcePrefix;
    private final String sourceFileSuffix;
    private final SourceKeyGrouper grouper;

    public BackfillJobCreator(ConverterProperties properties, ObjectStore objectStore) {
        this.objectStore = objectStore;
        this.sourceBucket = properties.get(SOURCE_BUCKET);
        this.sourcePrefix = properties.get(SOURCE_PREFIX);
        this.sourceFileSuffix = properties.get(SOURCE_FILE_SUFFIX);
        this.grouper = new SourceKeyGrouper(sourcePrefix);
    }

    public List<String> listCollections() {
        return directoryNames(sourcePrefix);
    }

    public List<String> listDatasets(String collection) {
        return directoryNames(sourcePrefix + collection + "/");
    }

    /**
     * Creates jobs for every dataset of every collection.
     *
     * @param  target the target to convert to
     * @return        the jobs
     */
    public List<BackfillConversionJob> createJobsForAllDatasets(ConversionTarget target) {
        target.validateDestinationPrefix(sourcePrefix);
        List<BackfillConversionJob> jobs = new ArrayList<>();
        for (String collection : listCollections()) {
            for (String dataset : listDatasets(collection)) {
                jobs.addAll(createJobs(collection, dataset, target));
            }
        }
        return jobs;
    }

    /**
     * Creates jobs for the given datasets. Each dataset must exist.
     *
     * @param  datasetsByCollection     the names of the datasets, by collection
     * @param  target                   the target to convert to
     * @return                          the jobs
     * @throws IllegalArgumentException if a collection or dataset does not exist
     */
    public List<BackfillConversionJob> createJobs(Map<String, List<String>> datasetsByCollection, ConversionTarget target) {
        target.validateDestinationPrefix(sourcePrefix);
        List<String> collections = listCollections();
        for (Map.Entry<String, List<String>> entry : datasetsByCollection.entrySet()) {
            if (!collections.contains(entry.getKey())) {
                throw new IllegalArgumentException("Invalid collection: " + entry.getKey());
            }
            List<String> datasets = listDatasets(entry.getKey());
            List<String> invalid = entry.getValue().stream()
                    .filter(dataset -> !datasets.contains(dataset))
                    .collect(Collectors.toList());
            if (!invalid.isEmpty()) {
                throw new IllegalArgumentException("Invalid datasets in collection " + entry.getKey() + ": " + invalid);
            }
        }
        List<BackfillConversionJob> jobs = new ArrayList<>();
        datasetsByCollection.forEach((collection, datasets) -> datasets
                .forEach(dataset -> jobs.addAll(createJobs(collection, dataset, target))));
        return jobs;
    }

    /**
     * Creates jobs for one dataset.
     *
     * @param  collection the collection
     * @param  dataset    the dataset
     * @param  target     the target to convert to
     * @return            one job per partition bucket, in time order
     */
    public List<BackfillConversionJob> createJobs(String collection, String dataset, ConversionTarget target) {
        target.validateDestinationPrefix(sourcePrefix);
        List<String> keys = objectStore.listKeys(sourceBucket, sourcePrefix + collection + "/" + dataset + "/", sourceFileSuffix);
        List<PartitionGroup> groups = grouper.group(keys, target.getPartitionSize());
        LOGGER.info("Found {} source files in {} partitions for dataset {}/{}",
                keys.size(), groups.size(), collection, dataset);
        return groups.stream()
                .map(group -> BackfillConversionJob.fromKeys(group.keys(), target))
                .collect(Collectors.toList());
    }

    private List<String> directoryNames(String prefix) {
        return objectStore.listDirectories(sourceBucket, prefix).stream()
                .map(directory -> directory.substring(prefix.length(), directory.length() - 1))
                .collect(Collectors.toList());
    }
}
