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
import org.apache.arrow.vector.NullVector;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a table into one table per hour, by the start time held in each row. Used when output is written hourly
 * but source files each hold more than one hour.
 */
public class HourlyTableSplitter {

    private static final long SECONDS_PER_HOUR = 3600;

    private final String timestampColumn;

    /**
     * Creates a splitter.
     *
     * @param timestampColumn the column holding the start time of each row, in seconds since the epoch
     */
    public HourlyTableSplitter(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    /**
     * Splits a table by hour. Every output table has the same schema as the input table, including columns that are
     * entirely null within that hour. The input table is not closed.
     *
     * @param  table                   the table
     * @param  allocator               the allocator to hold the output tables
     * @return                         the tables for each hour, by the start of the hour, in time order
     * @throws SchemaConflictException if the timestamp column is missing, is not an integer, or contains nulls
     */
    public Map<Instant, VectorSchemaRoot> split(VectorSchemaRoot table, BufferAllocator allocator) {
        BigIntVector timestamps = timestampVector(table);
        Map<Long, List<Integer>> rowsByHour = new TreeMap<>();
        for (int row = 0; row < table.getRowCount(); row++) {
            long timestamp = timestamps.get(row);
            long hour = timestamp - Math.floorMod(timestamp, SECONDS_PER_HOUR);
            rowsByHour.computeIfAbsent(hour, h -> new ArrayList<>()).add(row);
        }
        Map<Instant, VectorSchemaRoot> tables = new LinkedHashMap<>();
        try {
            for (Map.Entry<Long, List<Integer>> hour : rowsByHour.entrySet()) {
                tables.put(Instant.ofEpochSecond(hour.getKey()), copyRows(table, hour.getValue(), allocator));
            }
        } catch (RuntimeException e) {
            tables.values().forEach(VectorSchemaRoot::close);
            throw e;
        }
        return tables;
    }

    private BigIntVector timestampVector(VectorSchemaRoot table) {
        FieldVector vector = table.getVector(timestampColumn);
        if (vector == null) {
            throw new SchemaConflictException("Timestamp column \"" + timestampColumn + "\" not found");
        }
        if (!(vector instanceof BigIntVector)) {
            throw new SchemaConflictException("Timestamp column \"" + timestampColumn + "\" has type "
                    + vector.getField().getType() + ", expected an integer");
        }
        if (vector.getNullCount() > 0) {
            throw new SchemaConflictException("Timestamp column \"" + timestampColumn + "\" contains "
                    + vector.getNullCount() + " nulls");
        }
        return (BigIntVector) vector;
    }

    private static VectorSchemaRoot copyRows(VectorSchemaRoot table, List<Integer> rows, BufferAllocator allocator) {
        VectorSchemaRoot output = VectorSchemaRoot.create(table.getSchema(), allocator);
        try {
            for (FieldVector target : output.getFieldVectors()) {
                if (target instanceof NullVector) {
                    continue;
                }
                target.setInitialCapacity(rows.size());
                target.allocateNew();
                FieldVector source = table.getVector(target.getName());
                for (int i = 0; i < rows.size(); i++) {
                    target.copyFromSafe(rows.get(i), i, source);
                }
            }
            output.setRowCount(rows.size());
            return output;
        } catch (RuntimeException e) {
            output.close();
            throw e;
        }
    }
}
