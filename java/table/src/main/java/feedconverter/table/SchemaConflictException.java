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

/**
 * Thrown when the columns of a table cannot be reconciled. This may be because source files hold values of
 * incompatible types in the same column, or because a column needed to split a table is unusable.
 */
public class SchemaConflictException extends RuntimeException {

    public SchemaConflictException(String column, ColumnType left, ColumnType right) {
        super("Column \"" + column + "\" has incompatible types " + left + " and " + right);
    }

    public SchemaConflictException(String message) {
        super(message);
    }
}
