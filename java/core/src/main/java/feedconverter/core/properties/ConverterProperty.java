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
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Defines a property used to configure the converter. Used to validate values and to read them from the environment.
 */
public interface ConverterProperty {

    ConverterProperty SOURCE_BUCKET = ConverterPropertyImpl.named("converter.source.bucket")
            .description("The bucket holding the source files, and the dataset metadata files.")
            .validationPredicate(ConverterPropertyValueUtils::isNonNullNonEmptyString)
            .build();
    ConverterProperty SOURCE_PREFIX = ConverterPropertyImpl.named("converter.source.prefix")
            .description("The prefix that source files are held under, as <collection>/<dataset>/... " +
                    "Must end with a /.")
            .defaultValue("version5/aurora/gz/")
            .validationPredicate(ConverterPropertyValueUtils::isDirectoryPrefix)
            .build();
    ConverterProperty DESTINATION_BUCKET = ConverterPropertyImpl.named("converter.destination.bucket")
            .description("The bucket to write converted files to. Defaults to the source bucket.")
            .build();
    ConverterProperty SOURCE_FILE_SUFFIX = ConverterPropertyImpl.named("converter.source.file.suffix")
            .description("The suffix of source files. Other objects under the source prefix are ignored when " +
                    "listing files to backfill.")
            .defaultValue(".csv.gz")
            .validationPredicate(ConverterPropertyValueUtils::isNonNullNonEmptyString)
            .build();
    ConverterProperty METADATA_FILENAME = ConverterPropertyImpl.named("converter.metadata.filename")
            .description("The name of the file in each dataset directory that holds the dataset metadata.")
            .defaultValue("METADATA.json")
            .validationPredicate(ConverterPropertyValueUtils::isNonNullNonEmptyString)
            .build();
    ConverterProperty TABLE_LOADER_THREADS = ConverterPropertyImpl.named("converter.table.loader.threads")
            .description("The number of source files to fetch and parse at once. Fixed for each job, regardless " +
                    "of the number of source files.")
            .defaultValue("10")
            .validationPredicate(ConverterPropertyValueUtils::isPositiveInteger)
            .build();
    ConverterProperty PARTITION_TIMESTAMP_COLUMN = ConverterPropertyImpl.named("converter.partition.timestamp.column")
            .description("The column holding the start time of each row, in seconds since the epoch. Used to " +
                    "split tables into hourly output files.")
            .defaultValue("target_start")
            .validationPredicate(ConverterPropertyValueUtils::isNonNullNonEmptyString)
            .build();
    ConverterProperty NON_NULL_FALLBACK_COLUMNS = ConverterPropertyImpl.named("converter.nonnull.fallback.columns")
            .description("A comma separated list of columns that are never null in any dataset. Used to set " +
                    "nullability when dataset metadata is missing, or when a superkey column contains nulls.")
            .defaultValue("target_start,target_end,release_date,tag")
            .build();
    ConverterProperty METADATA_COPY = ConverterPropertyImpl.named("converter.metadata.copy")
            .description("Whether to copy the dataset metadata file alongside converted files in the data client " +
                    "store.")
            .defaultValue("true")
            .validationPredicate(ConverterPropertyValueUtils::isTrueOrFalse)
            .build();

    static List<ConverterProperty> getAll() {
        return ConverterPropertyImpl.getAll();
    }

    /**
     * Retrieves the name of the property, used to set the value in a properties file.
     *
     * @return the property name
     */
    String getPropertyName();

    /**
     * Retrieves the default value of the property. May be null if the property has no default value.
     *
     * @return the default value
     */
    String getDefaultValue();

    String getDescription();

    /**
     * Retrieves a predicate to check whether a value of this property is valid.
     *
     * @return the predicate
     */
    Predicate<String> getValidationPredicate();

    /**
     * Builds an environment variable name that is equivalent to the name of this property. Used to configure the
     * converter when it is deployed as a function.
     *
     * @return the environment variable name
     */
    default String toEnvironmentVariable() {
        return getPropertyName().toUpperCase(Locale.ROOT).replace('.', '_');
    }
}
