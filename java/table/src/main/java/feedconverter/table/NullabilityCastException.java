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

import java.util.List;

/**
 * Thrown when columns that should be marked as non-nullable contain null values.
 */
public class NullabilityCastException extends RuntimeException {

    private final transient List<String> nullColumns;

    public NullabilityCastException(List<String> nullColumns) {
        super("Cannot mark columns as non-nullable as they contain nulls: " + nullColumns);
        this.nullColumns = nullColumns;
    }

    public List<String> getNullColumns() {
        return nullColumns;
    }
}
