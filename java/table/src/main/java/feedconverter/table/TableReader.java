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
package feedconverter.table;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.io.IOException;
import java.io.InputStream;

/**
 * Parses a source file into a table of typed columns. Column names are taken from the file, and column types are
 * inferred from the values.
 */
@FunctionalInterface
public interface TableReader {

    /**
     * Reads a source file. The caller owns the returned table, and must close it.
     *
     * @param  input                     the contents of the file
     * @param  allocator                 the allocator to hold the table
     * @return                           the table
     * @throws IOException               if the file could not be read
     * @throws SourceFileFormatException if the contents are not in the expected format
     */
    VectorSchemaRoot read(InputStream input, BufferAllocator allocator) throws IOException;
}
