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
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.conversion.store.ObjectStore;
import feedconverter.table.TableReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches and parses source files into tables. Files are loaded concurrently by a fixed number of threads, so that
 * memory use does not grow with the number of files in flight.
 */
public class SourceTableLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceTableLoader.class);

    private final ObjectStore objectStore;
    private final String bucket;
    private final TableReader reader;
    private final int threads;
    private final MemoryUsageLogger memoryLogger;

    public SourceTableLoader(ObjectStore objectStore, String bucket, TableReader reader, int threads, MemoryUsageLogger memoryLogger) {
        this.objectStore = objectStore;
        this.bucket = bucket;
        this.reader = reader;
        this.threads = threads;
        this.memoryLogger = memoryLogger;
    }

    /**
     * Loads source files. If any file fails to load, every table that was loaded is closed and the first failure is
     * thrown.
     *
     * @param  keys      the object keys of the source files
     * @param  allocator the allocator to hold the tables
     * @return           the tables, in the same order as the keys
     */
    public List<VectorSchemaRoot> load(List<String> keys, BufferAllocator allocator) {
        if (keys.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, keys.size()));
        try {
            List<Future<VectorSchemaRoot>> futures = new ArrayList<>(keys.size());
            for (int i = 0; i < keys.size(); i++) {
                String key = keys.get(i);
                int fileNumber = i + 1;
                futures.add(executor.submit(() -> loadTable(key, fileNumber, keys.size(), allocator)));
            }
            return waitForTables(futures);
        } finally {
            executor.shutdown();
        }
    }

    private VectorSchemaRoot loadTable(String key, int fileNumber, int fileCount, BufferAllocator allocator) throws IOException {
        byte[] bytes = objectStore.get(bucket, key);
        VectorSchemaRoot table = reader.read(new ByteArrayInputStream(bytes), allocator);
        LOGGER.debug("Loaded {} rows from {}", table.getRowCount(), key);
        memoryLogger.log("loading table " + fileNumber + " of " + fileCount, allocator);
        return table;
    }

    private static List<VectorSchemaRoot> waitForTables(List<Future<VectorSchemaRoot>> futures) {
        List<VectorSchemaRoot> tables = new ArrayList<>(futures.size());
        RuntimeException failure = null;
        for (Future<VectorSchemaRoot> future : futures) {
            try {
                tables.add(future.get());
            } catch (ExecutionException e) {
                RuntimeException cause = unwrap(e);
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                RuntimeException interrupted = new IllegalStateException("Interrupted loading source files", e);
                if (failure == null) {
                    failure = interrupted;
                } else {
                    failure.addSuppressed(interrupted);
                }
                break;
            }
        }
        if (failure != null) {
            tables.forEach(VectorSchemaRoot::close);
            throw failure;
        }
        return tables;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        } else if (cause instanceof IOException) {
            return new UncheckedIOException((IOException) cause);
        } else if (cause instanceof Error) {
            throw (Error) cause;
        } else {
            return new IllegalStateException(cause);
        }
    }
}
