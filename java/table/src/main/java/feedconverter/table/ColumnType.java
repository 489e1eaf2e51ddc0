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

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * The logical type of a column read from a source file.
 */
public enum ColumnType {
    /**
     * A column with no values in any row.
     */
    NULL(ArrowType.Null.INSTANCE),
    BOOLEAN(ArrowType.Bool.INSTANCE),
    INT64(new ArrowType.Int(64, true)),
    FLOAT64(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)),
    STRING(ArrowType.Utf8.INSTANCE);

    private final ArrowType arrowType;

    ColumnType(ArrowType arrowType) {
        this.arrowType = arrowType;
    }

    /**
     * Finds the column type that is held in Arrow with the given type.
     *
     * @param  arrowType                the Arrow type
     * @return                          the column type
     * @throws IllegalArgumentException if the Arrow type is not one that a source file can produce
     */
    public static ColumnType fromArrowType(ArrowType arrowType) {
        for (ColumnType type : values()) {
            if (type.arrowType.equals(arrowType)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported Arrow type: " + arrowType);
    }

    /**
     * Finds a type that can hold all values of two column types without losing data. A column with no values can
     * take any type, and integers widen to floating point. Any other mix of types cannot be reconciled.
     *
     * @param  column                  the name of the column, for error reporting
     * @param  left                    one type
     * @param  right                   the other type
     * @return                         the promoted type
     * @throws SchemaConflictException if no type can hold both
     */
    public static ColumnType promote(String column, ColumnType left, ColumnType right) {
        if (left == right) {
            return left;
        }
        if (left == NULL) {
            return right;
        }
        if (right == NULL) {
            return left;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return FLOAT64;
        }
        throw new SchemaConflictException(column, left, right);
    }

    private static boolean isNumeric(ColumnType type) {
        return type == INT64 || type == FLOAT64;
    }

    public ArrowType getArrowType() {
        return arrowType;
    }
}
