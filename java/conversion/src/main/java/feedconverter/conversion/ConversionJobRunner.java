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
package feedconverter.conversion;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.conversion.metadata.DatasetMetadataStore;
import feedconverter.conversion.store.ObjectNotFoundException;
import feedconverter.conversion.store.ObjectStore;
import feedconverter.core.destination.DestinationKeyBuilder;
import feedconverter.core.format.DestinationStore;
import feedconverter.core.job.BackfillConversionJob;
import feedconverter.core.job.ConversionJob;
import feedconverter.core.job.ConversionTarget;
import feedconverter.core.job.SingleFileConversionJob;
import feedconverter.core.partition.PartitionBucket;
import feedconverter.core.partition.PartitionGroup;
import feedconverter.core.partition.PartitionSize;
import feedconverter.core.partition.SourceKeyGrouper;
import feedconverter.core.properties.ConverterProperties;
import feedconverter.core.util.LoggedDuration;
import feedconverter.encoding.TableEncoder;
import feedconverter.table.GzipCsvTableReader;
import feedconverter.table.HourlyTableSplitter;
import feedconverter.table.SchemaNormaliser;
import feedconverter.table.TableConcatenator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static feedconverter.core.properties.ConverterProperty.DESTINATION_BUCKET;
import static feedconverter.core.properties.ConverterProperty.METADATA_COPY;
import static feedconverter.core.properties.ConverterProperty.NON_NULL_FALLBACK_COLUMNS;
import static feedconverter.core.properties.ConverterProperty.PARTITION_TIMESTAMP_COLUMN;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_PREFIX;
import static feedconverter.core.properties.ConverterProperty.TABLE_LOADER_THREADS;

/**
 * Runs a conversion job. Source files are grouped into partition buckets, and each bucket is loaded, merged,
 * normalised, encoded and uploaded in turn. Hourly output is split by the start time of each row. Rows are always written
 * to the file for their own hour, even if that hour is outside the bucket their source file was grouped into.
 * <p>
 * A failure aborts the rest of the job. Files already uploaded for earlier buckets are left in place, and are
 * overwritten when the job is run again.
 */
public class ConversionJobRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionJobRunner.class);

    private final ObjectStore objectStore;
    private final DatasetMetadataStore metadataStore;
    private final String sourceBucket;
    private final String sourcePrefix;
    private final String destinationBucket;
    private final boolean copyMetadata;
    private final SourceKeyGrouper grouper;
    private final SourceTableLoader tableLoader;
    private final SchemaNormaliser normaliser;
    private final HourlyTableSplitter splitter;
    private final MemoryUsageLogger memoryLogger;

    public ConversionJobRunner(ConverterProperties properties, ObjectStore objectStore) {
        this(properties, objectStore, new MemoryUsageLogger());
    }

    public ConversionJobRunner(ConverterProperties properties, ObjectStore objectStore, MemoryUsageLogger memoryLogger) {
        this.objectStore = objectStore;
        this.metadataStore = new DatasetMetadataStore(objectStore, properties);
        this.sourceBucket = properties.get(SOURCE_BUCKET);
        this.sourcePrefix = properties.get(SOURCE_PREFIX);
        this.destinationBucket = properties.get(DESTINATION_BUCKET);
        this.copyMetadata = properties.getBoolean(METADATA_COPY);
        this.grouper = new SourceKeyGrouper(sourcePrefix);
        this.tableLoader = new SourceTableLoader(objectStore, sourceBucket, new GzipCsvTableReader(),
                properties.getInt(TABLE_LOADER_THREADS), memoryLogger);
        this.normaliser = new SchemaNormaliser(properties.getList(NON_NULL_FALLBACK_COLUMNS));
        this.splitter = new HourlyTableSplitter(properties.get(PARTITION_TIMESTAMP_COLUMN));
        this.memoryLogger = memoryLogger;
    }

    /**
     * Runs a job. The job is checked against the source location before any file is read.
     *
     * @param  job the job
     * @return     the keys of the files written, in the order they were uploaded
     */
    public List<String> run(ConversionJob job) {
        Instant startTime = Instant.now();
        ConversionTarget target = job.getTarget();
        target.validateDestinationPrefix(sourcePrefix);
        List<PartitionGroup> groups = groupSourceFiles(job);
        LOGGER.info("Converting {} source files in {} partitions to {}",
                job.getSourceKeys().size(), groups.size(), target);

        DestinationKeyBuilder keyBuilder = new DestinationKeyBuilder(target);
        TableEncoder encoder = TableEncoder.forFormat(target.getFileFormat());
        List<String> written = new ArrayList<>();
        for (PartitionGroup group : groups) {
            written.addAll(convertGroup(group, job.isBackfill(), target, keyBuilder, encoder));
        }
        if (copyMetadata && target.getDestinationStore() == DestinationStore.DATACLIENT) {
            groups.stream()
                    .map(PartitionGroup::bucket)
                    .map(bucket -> List.of(bucket.collection(), bucket.dataset()))
                    .distinct()
                    .forEach(dataset -> copyMetadata(dataset.get(0), dataset.get(1), keyBuilder));
        }
        LOGGER.info("Finished job, wrote {} files in {}", written.size(), LoggedDuration.between(startTime, Instant.now()));
        return written;
    }

    private List<PartitionGroup> groupSourceFiles(ConversionJob job) {
        PartitionSize size = job.getTarget().getPartitionSize();
        if (job instanceof SingleFileConversionJob) {
            String key = ((SingleFileConversionJob) job).getSourceKey();
            return List.of(new PartitionGroup(grouper.bucketFor(key, size), List.of(key)));
        } else if (job instanceof BackfillConversionJob) {
            return grouper.group(job.getSourceKeys(), size);
        } else {
            throw new IllegalArgumentException("Unrecognised job type: " + job.getClass().getName());
        }
    }

    private List<String> convertGroup(
            PartitionGroup group, boolean backfill, ConversionTarget target, DestinationKeyBuilder keyBuilder,
            TableEncoder encoder) {
        PartitionBucket bucket = group.bucket();
        LOGGER.info("Loading {} source files for partition {}", group.keys().size(), bucket);
        Optional<List<String>> superkey = metadataStore.getSuperkey(bucket.collection(), bucket.dataset());
        try (BufferAllocator allocator = new RootAllocator()) {
            List<VectorSchemaRoot> sourceTables = tableLoader.load(group.keys(), allocator);
            try (VectorSchemaRoot merged = TableConcatenator.concatenate(sourceTables, allocator);
                    VectorSchemaRoot table = normaliser.normalise(merged, superkey)) {
                memoryLogger.log("merging " + sourceTables.size() + " tables", allocator);
                if (bucket.size() == PartitionSize.HOUR) {
                    return writeHours(bucket, backfill, table, target, keyBuilder, encoder, allocator);
                } else {
                    return List.of(write(bucket, bucket.start(), table, target, keyBuilder, encoder, allocator));
                }
            }
        }
    }

    private List<String> writeHours(
            PartitionBucket bucket, boolean backfill, VectorSchemaRoot table, ConversionTarget target,
            DestinationKeyBuilder keyBuilder, TableEncoder encoder, BufferAllocator allocator) {
        Map<Instant, VectorSchemaRoot> hours = splitter.split(table, allocator);
        LOGGER.info("Split partition {} into {} hours", bucket, hours.size());
        logHoursOutsideBucket(bucket, backfill, hours.keySet());
        List<String> written = new ArrayList<>(hours.size());
        try {
            for (Map.Entry<Instant, VectorSchemaRoot> hour : hours.entrySet()) {
                written.add(write(bucket, hour.getKey(), hour.getValue(), target, keyBuilder, encoder, allocator));
            }
        } finally {
            hours.values().forEach(VectorSchemaRoot::close);
        }
        return written;
    }

    private static void logHoursOutsideBucket(PartitionBucket bucket, boolean backfill, Collection<Instant> hours) {
        List<Instant> outside = hours.stream()
                .filter(hour -> !bucket.contains(hour))
                .collect(Collectors.toList());
        if (outside.isEmpty()) {
            return;
        }
        if (backfill) {
            // Each of these hours is also written by the job for its own bucket, and the last write wins
            LOGGER.warn("Partition {} has rows in {} hours outside it, writing them may replace output of other jobs: {}",
                    bucket, outside.size(), outside);
        } else {
            LOGGER.info("Source file for partition {} also holds rows for {} other hours", bucket, outside.size());
        }
    }

    private String write(
            PartitionBucket bucket, Instant fileStart, VectorSchemaRoot table, ConversionTarget target,
            DestinationKeyBuilder keyBuilder, TableEncoder encoder, BufferAllocator allocator) {
        byte[] data;
        try {
            data = encoder.encode(table, target.getCompression(), target.getCompressionLevel());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        memoryLogger.log("encoding " + table.getRowCount() + " rows", allocator);
        String key = keyBuilder.buildKey(bucket.collection(), bucket.dataset(), fileStart);
        objectStore.put(destinationBucket, key, data);
        return key;
    }

    private void copyMetadata(String collection, String dataset, DestinationKeyBuilder keyBuilder) {
        String sourceKey = metadataStore.getMetadataKey(collection, dataset);
        String destinationKey = keyBuilder.datasetPrefix(collection, dataset) + metadataStore.getMetadataFilename();
        try {
            objectStore.copy(sourceBucket, sourceKey, destinationBucket, destinationKey);
        } catch (ObjectNotFoundException e) {
            LOGGER.info("No metadata file to copy for dataset {}/{}", collection, dataset);
        }
    }
}
