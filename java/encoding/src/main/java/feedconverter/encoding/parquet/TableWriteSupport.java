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
package feedconverter.encoding.parquet;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.io.api.RecordConsumer;
import org.apache.parquet.schema.MessageType;

import feedconverter.table.ColumnType;

import java.util.HashMap;
import java.util.List;

/**
 * Support for writing rows of an Arrow table to Parquet. Each record passed to the writer is a row number in the
 * table. Null values are left out of the record, so the field is read back as absent.
 */
class TableWriteSupport extends WriteSupport<Integer> {
    private final MessageType messageType;
    private final VectorSchemaRoot table;
    private RecordConsumer recordConsumer;

    TableWriteSupport(MessageType messageType, VectorSchemaRoot table) {
        this.messageType = messageType;
        this.table = table;
    }

    @Override
    public WriteContext init(Configuration configuration) {
        return new WriteContext(messageType, new HashMap<>());
    }

    @Override
    public void prepareForWrite(RecordConsumer recordConsumer) {
        this.recordConsumer = recordConsumer;
    }

    @Override
    @SuppressFBWarnings("UWF_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR")
    public void write(Integer row) {
        recordConsumer.startMessage();
        List<FieldVector> vectors = table.getFieldVectors();
        for (int index = 0; index < vectors.size(); index++) {
            FieldVector vector = vectors.get(index);
            if (vector.isNull(row)) {
                continue;
            }
            recordConsumer.startField(vector.getName(), index);
            addValue(vector, row);
            recordConsumer.endField(vector.getName(), index);
        }
        recordConsumer.endMessage();
    }

    private void addValue(FieldVector vector, int row) {
        ColumnType type = ColumnType.fromArrowType(vector.getField().getType());
        switch (type) {
            case INT64:
                recordConsumer.addLong(((BigIntVector) vector).get(row));
                break;
            case FLOAT64:
                recordConsumer.addDouble(((Float8Vector) vector).get(row));
                break;
            case BOOLEAN:
                recordConsumer.addBoolean(((BitVector) vector).get(row) != 0);
                break;
            case STRING:
                recordConsumer.addBinary(Binary.fromConstantByteArray(((VarCharVector) vector).get(row)));
                break;
            default:
                throw new IllegalStateException("Found value in column \"" + vector.getName() + "\" of type " + type);
        }
    }
}
