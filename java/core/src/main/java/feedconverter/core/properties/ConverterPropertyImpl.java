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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

class ConverterPropertyImpl implements ConverterProperty {

    private static final List<ConverterProperty> ALL = new ArrayList<>();
    private final String propertyName;
    private final String defaultValue;
    private final Predicate<String> validationPredicate;
    private final String description;

    private ConverterPropertyImpl(Builder builder) {
        propertyName = Objects.requireNonNull(builder.propertyName, "propertyName must not be null");
        defaultValue = builder.defaultValue;
        validationPredicate = Objects.requireNonNull(builder.validationPredicate, "validationPredicate must not be null");
        description = Objects.requireNonNull(builder.description, "description must not be null");
    }

    static Builder named(String name) {
        return new Builder().propertyName(name);
    }

    static List<ConverterProperty> getAll() {
        return Collections.unmodifiableList(ALL);
    }

    @Override
    public Predicate<String> getValidationPredicate() {
        return validationPredicate;
    }

    @Override
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return propertyName;
    }

    static final class Builder {
        private String propertyName;
        private String defaultValue;
        private Predicate<String> validationPredicate = s -> true;
        private String description = "No description available";

        private Builder() {
        }

        Builder propertyName(String propertyName) {
            this.propertyName = propertyName;
            return this;
        }

        Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        Builder validationPredicate(Predicate<String> validationPredicate) {
            this.validationPredicate = validationPredicate;
            return this;
        }

        Builder description(String description) {
            this.description = description;
            return this;
        }

        ConverterProperty build() {
            ConverterProperty property = new ConverterPropertyImpl(this);
            ALL.add(property);
            return property;
        }
    }
}
