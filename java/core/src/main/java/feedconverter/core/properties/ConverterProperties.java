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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import static feedconverter.core.properties.ConverterProperty.DESTINATION_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;

/**
 * Holds values for converter configuration properties. Unset properties take their default value.
 */
public class ConverterProperties {

    private final Properties properties;

    public ConverterProperties() {
        this(new Properties());
    }

    public ConverterProperties(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads and validates properties from environment variables. Each property is read from the variable named by
     * {@link ConverterProperty#toEnvironmentVariable}.
     *
     * @param  environment                         the environment variables
     * @return                                     the properties
     * @throws ConverterPropertiesInvalidException if any value is invalid
     */
    public static ConverterProperties fromEnvironment(Map<String, String> environment) {
        Properties properties = new Properties();
        for (ConverterProperty property : ConverterProperty.getAll()) {
            String value = environment.get(property.toEnvironmentVariable());
            if (value != null) {
                properties.setProperty(property.getPropertyName(), value);
            }
        }
        return loadAndValidate(properties);
    }

    /**
     * Loads and validates properties.
     *
     * @param  properties                          the property values
     * @return                                     the properties
     * @throws ConverterPropertiesInvalidException if any value is invalid
     */
    public static ConverterProperties loadAndValidate(Properties properties) {
        ConverterProperties converterProperties = new ConverterProperties(properties);
        converterProperties.validate();
        return converterProperties;
    }

    /**
     * Validates the values of all properties. Every property is checked, and the exception reports the first failure
     * along with the number of failures.
     *
     * @throws ConverterPropertiesInvalidException if any value is invalid
     */
    public void validate() throws ConverterPropertiesInvalidException {
        Map<ConverterProperty, String> invalidValues = new LinkedHashMap<>();
        for (ConverterProperty property : ConverterProperty.getAll()) {
            String value = get(property);
            if (!property.getValidationPredicate().test(value)) {
                invalidValues.put(property, value);
            }
        }
        if (!invalidValues.isEmpty()) {
            throw new ConverterPropertiesInvalidException(invalidValues);
        }
    }

    /**
     * Retrieves the value of a property, or its default value if it is unset.
     *
     * @param  property the property
     * @return          the value of the property
     */
    public String get(ConverterProperty property) {
        String value = properties.getProperty(property.getPropertyName());
        if (value == null || value.isEmpty()) {
            if (property == DESTINATION_BUCKET) {
                return get(SOURCE_BUCKET);
            }
            return property.getDefaultValue();
        }
        return value;
    }

    public int getInt(ConverterProperty property) {
        return Integer.parseInt(get(property));
    }

    public boolean getBoolean(ConverterProperty property) {
        return Boolean.parseBoolean(get(property));
    }

    public List<String> getList(ConverterProperty property) {
        return ConverterPropertyValueUtils.readList(get(property));
    }

    public void set(ConverterProperty property, String value) {
        if (value != null) {
            properties.setProperty(property.getPropertyName(), value);
        }
    }

    public void setNumber(ConverterProperty property, Number number) {
        set(property, number == null ? null : number.toString());
    }

    public void setList(ConverterProperty property, List<String> list) {
        set(property, String.join(",", list));
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        ConverterProperties that = (ConverterProperties) object;
        return Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(properties);
    }

    @Override
    public String toString() {
        return "ConverterProperties{" + properties + '}';
    }
}
