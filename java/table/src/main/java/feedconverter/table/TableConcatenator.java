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
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concatenates tables read from separate source files into one table. Columns are matched by name. A column missing
 * from some tables is null in their rows. A column whose type differs between tables is promoted to a type that can
 * hold all its values, as in {@link ColumnType#promote}. An integer is only widened to floating point if it can be held
 * exactly.
 */
public class TableConcatenator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TableConcatenator.class);

    private TableConcatenator() {
    }

    /**
     * Concatenates tables. Rows are kept in the order of the given tables. Each input table is closed once its rows
     * have been copied, so that at most one input is held alongside the output.
     *
     * @param  tables                  the tables to concatenate
     * @param  allocator               the allocator to hold the output
     * @return                         the concatenated table
     * @throws SchemaConflictException if a column has types in different tables that cannot be reconciled
     */
    public static VectorSchemaRoot concatenate(List<VectorSchemaRoot> tables, BufferAllocator allocator) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("No tables to concatenate");
        }
        Map<String, ColumnType> columnTypes;
        try {
            columnTypes = mergeColumnTypes(tables);
        } catch (RuntimeException e) {
            tables.forEach(VectorSchemaRoot::close);
            throw e;
        }
        if (tables.size() == 1) {
            return tables.get(0);
        }
        int totalRows = tables.stream().mapToInt(VectorSchemaRoot::getRowCount).sum();
        LOGGER.debug("Concatenating {} tables with {} rows total, columns {}", tables.size(), totalRows, columnTypes);
        List<FieldVector> vectors = new ArrayList<>(columnTypes.size());
        int nextTable = 0;
        try {
            for (Map.Entry<String, ColumnType> column : columnTypes.entrySet()) {
                FieldVector vector = Field.nullable(column.getKey(), column.getValue().getArrowType())
                        .createVector(allocator);
                vectors.add(vector);
                vector.setInitialCapacity(totalRows);
                vector.allocateNew();
            }
            int offset = 0;
            for (VectorSchemaRoot table : tables) {
                for (FieldVector target : vectors) {
                    copyColumn(table, target, offset);
                }
                offset += table.getRowCount();
                table.close();
                nextTable++;
            }
            VectorSchemaRoot output = new VectorSchemaRoot(vectors);
            output.setRowCount(totalRows);
            return output;
        } catch (RuntimeException e) {
            tables.subList(nextTable, tables.size()).forEach(VectorSchemaRoot::close);
            vectors.forEach(FieldVector::close);
            throw e;
        }
    }

    private static Map<String, ColumnType> mergeColumnTypes(List<VectorSchemaRoot> tables) {
        Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        for (VectorSchemaRoot table : tables) {
            for (Field field : table.getSchema().getFields()) {
                ColumnType type = ColumnType.fromArrowType(field.getType());
                columnTypes.merge(field.getName(), type,
                        (before, after) -> ColumnType.promote(field.getName(), before, after));
            }
        }
        return columnTypes;
    }

    private static void copyColumn(VectorSchemaRoot table, FieldVector target, int offset) {
        FieldVector source = table.getVector(target.getName());
        if (source == null) {
            return;
        }
        ColumnType sourceType = ColumnType.fromArrowType(source.getField().getType());
        ColumnType targetType = ColumnType.fromArrowType(target.getField().getType());
        int rows = table.getRowCount();
        if (sourceType == ColumnType.NULL || targetType == ColumnType.NULL) {
            return;
        } else if (sourceType == targetType) {
            for (int row = 0; row < rows; row++) {
                target.copyFromSafe(row, offset + row, source);
            }
        } else if (sourceType == ColumnType.INT64 && targetType == ColumnType.FLOAT64) {
            BigIntVector longs = (BigIntVector) source;
            Float8Vector doubles = (Float8Vector) target;
            for (int row = 0; row < rows; row++) {
                if (!longs.isNull(row)) {
                    doubles.setSafe(offset + row, toExactDouble(target.getName(), longs.get(row)));
                }
            }
        } else {
            throw new SchemaConflictException(target.getName(), sourceType, targetType);
        }
    }

    private static double toExactDouble(String column, long value) {
        double converted = (double) value;
        if (converted == 0x1p63 || (long) converted != value) {
            throw new SchemaConflictException("Column \"" + column + "\" mixes integers and decimals, "
                    + "and integer " + value + " cannot be held exactly as a decimal");
        }
        return converted;
    }
}
