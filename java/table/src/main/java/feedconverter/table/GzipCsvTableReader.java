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

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Reads gzip compressed comma separated values into a table. The first row holds the column names. Column types are
 * inferred with {@link ColumnTypeInference}.
 */
public class GzipCsvTableReader implements TableReader {

    @Override
    public VectorSchemaRoot read(InputStream input, BufferAllocator allocator) throws IOException {
        List<String> header;
        List<String[]> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(
                new InputStreamReader(new GZIPInputStream(input), StandardCharsets.UTF_8)).build()) {
            String[] headerRow = reader.readNext();
            if (headerRow == null) {
                throw new SourceFileFormatException("No header row found");
            }
            header = readHeader(headerRow);
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (isBlankLine(row)) {
                    continue;
                }
                if (row.length != header.size()) {
                    throw new SourceFileFormatException("Expected " + header.size() + " values on line "
                            + reader.getLinesRead() + ", found " + row.length);
                }
                rows.add(row);
            }
        } catch (CsvValidationException e) {
            throw new SourceFileFormatException("Failed reading delimited text", e);
        }
        return buildTable(header, rows, allocator);
    }

    private static List<String> readHeader(String[] headerRow) {
        Set<String> seen = new HashSet<>();
        List<String> header = new ArrayList<>(headerRow.length);
        for (String column : headerRow) {
            String name = column.strip();
            if (name.isEmpty()) {
                throw new SourceFileFormatException("Empty column name in header");
            }
            if (!seen.add(name)) {
                throw new SourceFileFormatException("Duplicate column name in header: " + name);
            }
            header.add(name);
        }
        return header;
    }

    private static boolean isBlankLine(String[] row) {
        return row.length == 1 && row[0].isEmpty();
    }

    private static VectorSchemaRoot buildTable(List<String> header, List<String[]> rows, BufferAllocator allocator) {
        List<FieldVector> vectors = new ArrayList<>(header.size());
        try {
            for (int column = 0; column < header.size(); column++) {
                List<String> values = columnValues(rows, column);
                ColumnType type = ColumnTypeInference.infer(values);
                FieldVector vector = Field.nullable(header.get(column), type.getArrowType()).createVector(allocator);
                vectors.add(vector);
                writeValues(type, values, vector);
            }
            VectorSchemaRoot root = new VectorSchemaRoot(vectors);
            root.setRowCount(rows.size());
            return root;
        } catch (RuntimeException e) {
            vectors.forEach(FieldVector::close);
            throw e;
        }
    }

    private static List<String> columnValues(List<String[]> rows, int column) {
        List<String> values = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            values.add(row[column]);
        }
        return values;
    }

    private static void writeValues(ColumnType type, List<String> values, FieldVector vector) {
        vector.setInitialCapacity(values.size());
        vector.allocateNew();
        for (int row = 0; row < values.size(); row++) {
            String value = values.get(row);
            // Rows left unset are null
            if (type != ColumnType.STRING && ColumnTypeInference.isNullToken(value)) {
                continue;
            }
            switch (type) {
                case INT64:
                    ((BigIntVector) vector).setSafe(row, Long.parseLong(value));
                    break;
                case FLOAT64:
                    ((Float8Vector) vector).setSafe(row, ColumnTypeInference.parseDouble(value));
                    break;
                case BOOLEAN:
                    ((BitVector) vector).setSafe(row, ColumnTypeInference.parseBoolean(value) ? 1 : 0);
                    break;
                case STRING:
                    ((VarCharVector) vector).setSafe(row, value.getBytes(StandardCharsets.UTF_8));
                    break;
                default:
                    throw new IllegalStateException("Unexpected column type: " + type);
            }
        }
    }
}
