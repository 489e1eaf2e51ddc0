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
import org.junit.jupiter.api.Test;

import feedconverter.core.util.JvmMemoryUse;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class MemoryUsageLoggerTest {

    @Test
    void shouldReadMemoryFromProvider() {
        // Given
        JvmMemoryUse.Provider provider = mock(JvmMemoryUse.Provider.class);
        when(provider.getMemory()).thenReturn(new JvmMemoryUse(2048, 1024, 4096));
        MemoryUsageLogger logger = new MemoryUsageLogger(provider);

        // When
        try (BufferAllocator allocator = new RootAllocator()) {
            logger.log("loading table 1 of 1", allocator);
        }

        // Then
        verify(provider).getMemory();
    }

    @Test
    void shouldLogWithDefaultProvider() {
        try (BufferAllocator allocator = new RootAllocator()) {
            assertThatCode(() -> new MemoryUsageLogger().log("merging 2 tables", allocator))
                    .doesNotThrowAnyException();
        }
    }
}
