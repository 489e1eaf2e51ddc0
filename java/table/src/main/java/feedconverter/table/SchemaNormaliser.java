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

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sets which columns of a concatenated table are nullable. Readers of converted files enforce nullability, so a
 * column may only be marked non-nullable if it holds no nulls.
 * <p>
 * The superkey columns of a dataset are marked non-nullable if the dataset metadata is available. Source data does
 * not guarantee that superkey columns are free of nulls, so if any of them hold nulls we fall back to a minimal set of
 * columns that are expected to be non-null in every dataset. Any of those that do hold nulls are left nullable.
 */
public class SchemaNormaliser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaNormaliser.class);

    private final List<String> fallbackNonNullColumns;

    public SchemaNormaliser(List<String> fallbackNonNullColumns) {
        this.fallbackNonNullColumns = List.copyOf(fallbackNonNullColumns);
    }

    /**
     * Normalises the nullability of a table. The returned table shares its column vectors with the given table, and
     * closing it will release them. Columns named as non-null that are not in the table are ignored.
     *
     * @param  table    the table
     * @param  superkey the superkey columns of the dataset, if the dataset metadata is available
     * @return          the table with nullability set on its schema
     */
    public VectorSchemaRoot normalise(VectorSchemaRoot table, Optional<List<String>> superkey) {
        if (superkey.isPresent()) {
            try {
                return castNonNull(table, superkey.get());
            } catch (NullabilityCastException e) {
                LOGGER.warn("Superkey columns contain nulls, falling back to non-null columns {}: {}",
                        fallbackNonNullColumns, e.getNullColumns());
            }
        } else {
            LOGGER.info("No dataset metadata, setting non-null columns {}", fallbackNonNullColumns);
        }
        List<String> nullColumns = nullColumns(table, fallbackNonNullColumns);
        if (!nullColumns.isEmpty()) {
            LOGGER.warn("Fallback non-null columns contain nulls, leaving them nullable: {}", nullColumns);
        }
        return withNonNullColumns(table, fallbackNonNullColumns.stream()
                .filter(column -> !nullColumns.contains(column))
                .collect(Collectors.toUnmodifiableSet()));
    }

    private static VectorSchemaRoot castNonNull(VectorSchemaRoot table, Collection<String> nonNullColumns) {
        List<String> nullColumns = nullColumns(table, nonNullColumns);
        if (!nullColumns.isEmpty()) {
            throw new NullabilityCastException(nullColumns);
        }
        return withNonNullColumns(table, Set.copyOf(nonNullColumns));
    }

    private static List<String> nullColumns(VectorSchemaRoot table, Collection<String> columns) {
        return table.getFieldVectors().stream()
                .filter(vector -> columns.contains(vector.getName()))
                .filter(vector -> vector.getNullCount() > 0)
                .map(FieldVector::getName)
                .collect(Collectors.toUnmodifiableList());
    }

    private static VectorSchemaRoot withNonNullColumns(VectorSchemaRoot table, Set<String> nonNull) {
        List<Field> fields = new ArrayList<>();
        for (FieldVector vector : table.getFieldVectors()) {
            Field field = vector.getField();
            boolean nullable = !nonNull.contains(field.getName());
            fields.add(new Field(field.getName(),
                    new FieldType(nullable, field.getType(), field.getDictionary(), field.getMetadata()),
                    field.getChildren()));
        }
        return new VectorSchemaRoot(fields, table.getFieldVectors(), table.getRowCount());
    }
}
