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
package feedconverter.core.util;

/**
 * The heap memory in use in the Java Virtual Machine, as reported by {@link Runtime}.
 * <p>
 * Total memory is what the operating system has currently allocated to the JVM, including free space within it. Max
 * memory is the most the JVM will attempt to use, or {@link Long#MAX_VALUE} if there is no limit.
 *
 * @param totalMemory the memory currently allocated to the JVM, in bytes
 * @param freeMemory  the allocated memory not yet in use, in bytes
 * @param maxMemory   the most memory the JVM will attempt to use, in bytes
 */
public record JvmMemoryUse(long totalMemory, long freeMemory, long maxMemory) {

    /**
     * Reads the current state of memory from the runtime.
     *
     * @param  runtime the runtime
     * @return         the state of memory
     */
    public static JvmMemoryUse from(Runtime runtime) {
        return new JvmMemoryUse(runtime.totalMemory(), runtime.freeMemory(), runtime.maxMemory());
    }

    /**
     * Gets a provider to read the current state of memory from the JVM runtime.
     *
     * @return the provider
     */
    public static Provider getProvider() {
        return () -> from(Runtime.getRuntime());
    }

    public long usedMemory() {
        return totalMemory - freeMemory;
    }

    public boolean isMaxMemoryKnown() {
        return maxMemory != Long.MAX_VALUE;
    }

    @Override
    public String toString() {
        return "used " + NumberFormatUtils.formatBytes(usedMemory())
                + ", total " + NumberFormatUtils.formatBytes(totalMemory)
                + ", max " + (isMaxMemoryKnown() ? NumberFormatUtils.formatBytes(maxMemory) : "unknown");
    }

    /**
     * Reads the current state of memory. Can be used to fake the state of memory in tests.
     */
    @FunctionalInterface
    public interface Provider {

        JvmMemoryUse getMemory();
    }
}
