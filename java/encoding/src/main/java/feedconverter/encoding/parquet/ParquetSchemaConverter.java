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

import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Type.Repetition;
import org.apache.parquet.schema.Types;

import feedconverter.table.ColumnType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the schema of an Arrow table to a Parquet {@link MessageType}. Non-nullable columns are required, all
 * others optional. A column that is entirely null has no type of its own, and is written as an optional string.
 */
public class ParquetSchemaConverter {

    private ParquetSchemaConverter() {
    }

    public static MessageType getSchema(Schema schema) {
        List<Type> types = new ArrayList<>();
        for (Field field : schema.getFields()) {
            types.add(getParquetType(field));
        }
        return new MessageType("schema", types);
    }

    private static Type getParquetType(Field field) {
        ColumnType type = ColumnType.fromArrowType(field.getType());
        Repetition repetition = field.isNullable() || type == ColumnType.NULL
                ? Repetition.OPTIONAL
                : Repetition.REQUIRED;
        switch (type) {
            case INT64:
                return Types.primitive(PrimitiveTypeName.INT64, repetition).named(field.getName());
            case FLOAT64:
                return Types.primitive(PrimitiveTypeName.DOUBLE, repetition).named(field.getName());
            case BOOLEAN:
                return Types.primitive(PrimitiveTypeName.BOOLEAN, repetition).named(field.getName());
            case STRING:
            case NULL:
                return Types.primitive(PrimitiveTypeName.BINARY, repetition)
                        .as(LogicalTypeAnnotation.stringType())
                        .named(field.getName());
            default:
                throw new IllegalArgumentException("Unknown type " + type + " for field " + field.getName());
        }
    }
}
