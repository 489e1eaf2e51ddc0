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
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the type of a column from its text values. The narrowest type that can hold every value is chosen, trying
 * integer, then floating point, then boolean, then falling back to string.
 * <p>
 * Some tokens are read as null in columns of any type other than string. A string column keeps these as they appear.
 */
public class ColumnTypeInference {

    private static final Set<String> NULL_TOKENS = Set.of("", "NULL", "null", "N/A", "NA", "NaN", "nan");
    private static final Set<String> TRUE_TOKENS = Set.of("true", "True", "TRUE");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "False", "FALSE");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(inf|Infinity)");

    private ColumnTypeInference() {
    }

    /**
     * Infers the type of a column.
     *
     * @param  values the values in the column, in text form
     * @return        the type
     */
    public static ColumnType infer(List<String> values) {
        boolean anyValue = false;
        boolean allIntegers = true;
        boolean allDecimals = true;
        boolean allBooleans = true;
        for (String value : values) {
            if (isNullToken(value)) {
                continue;
            }
            anyValue = true;
            allIntegers = allIntegers && isInteger(value);
            allDecimals = allDecimals && (isInteger(value) || DECIMAL.matcher(value).matches());
            allBooleans = allBooleans && (TRUE_TOKENS.contains(value) || FALSE_TOKENS.contains(value));
            if (!allIntegers && !allDecimals && !allBooleans) {
                return ColumnType.STRING;
            }
        }
        if (!anyValue) {
            return ColumnType.NULL;
        } else if (allIntegers) {
            return ColumnType.INT64;
        } else if (allDecimals) {
            return ColumnType.FLOAT64;
        } else {
            return ColumnType.BOOLEAN;
        }
    }

    public static boolean isNullToken(String value) {
        return value == null || NULL_TOKENS.contains(value);
    }

    public static boolean parseBoolean(String value) {
        return TRUE_TOKENS.contains(value);
    }

    /**
     * Parses a floating point value that has been accepted by inference.
     *
     * @param  value the value
     * @return       the number
     */
    public static double parseDouble(String value) {
        String unsigned = value.startsWith("+") || value.startsWith("-") ? value.substring(1) : value;
        if (unsigned.equals("inf") || unsigned.equals("Infinity")) {
            return value.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(value);
    }

    private static boolean isInteger(String value) {
        if (!INTEGER.matcher(value).matches()) {
            return false;
        }
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
