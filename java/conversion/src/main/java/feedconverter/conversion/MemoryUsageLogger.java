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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.core.util.JvmMemoryUse;

import static feedconverter.core.util.NumberFormatUtils.formatBytes;

/**
 * Logs memory use at each stage of a conversion. Jobs run with a hard memory limit, so this shows how close a job
 * came to the limit before it failed.
 */
public class MemoryUsageLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryUsageLogger.class);

    private final JvmMemoryUse.Provider memoryProvider;

    public MemoryUsageLogger() {
        this(JvmMemoryUse.getProvider());
    }

    public MemoryUsageLogger(JvmMemoryUse.Provider memoryProvider) {
        this.memoryProvider = memoryProvider;
    }

    /**
     * Logs heap use and memory allocated by Arrow.
     *
     * @param stage     a description of the stage that was just completed
     * @param allocator the allocator holding the tables of the current job
     */
    public void log(String stage, BufferAllocator allocator) {
        LOGGER.info("Memory after {}: heap {}, Arrow allocated {} (peak {})",
                stage, memoryProvider.getMemory(),
                formatBytes(allocator.getAllocatedMemory()), formatBytes(allocator.getPeakMemoryAllocation()));
    }
}
