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
package feedconverter.core.properties;

import java.util.List;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Validates and reads values of converter properties.
 */
public class ConverterPropertyValueUtils {

    private ConverterPropertyValueUtils() {
    }

    public static boolean isPositiveInteger(String integer) {
        return parseAndCheckInteger(integer, num -> num > 0);
    }

    public static boolean isNonNullNonEmptyString(String string) {
        return null != string && !string.isEmpty();
    }

    public static boolean isTrueOrFalse(String string) {
        return "true".equalsIgnoreCase(string) || "false".equalsIgnoreCase(string);
    }

    public static boolean isDirectoryPrefix(String string) {
        return isNonNullNonEmptyString(string) && string.endsWith("/");
    }

    /**
     * Reads a comma separated list. Whitespace around each item is removed.
     *
     * @param  value the property value
     * @return       the list, or an empty list if the value is null
     */
    public static List<String> readList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private static boolean parseAndCheckInteger(String string, IntPredicate check) {
        if (string == null) {
            return false;
        }
        try {
            return check.test(Integer.parseInt(string));
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
