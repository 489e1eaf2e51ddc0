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
package feedconverter.core.format;

import org.apache.commons.lang3.EnumUtils;

import feedconverter.core.job.ConversionJobValidationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A downstream reader of converted files. Each store has its own path conventions and accepted formats.
 */
public enum DestinationStore {
    /**
     * Generic columnar file store, read by the data client. Paths are partitioned by year.
     */
    DATACLIENT(EnumSet.allOf(FileFormat.class)),
    /**
     * Partition-projected analytical query store. Partition values are derived from dates embedded in the path.
     */
    ATHENA(EnumSet.of(FileFormat.PARQUET));

    private final Set<FileFormat> supportedFormats;

    DestinationStore(Set<FileFormat> supportedFormats) {
        this.supportedFormats = supportedFormats;
    }

    /**
     * Reads a destination store from the name used in job payloads, e.g. "athena".
     *
     * @param  name the name
     * @return      the store
     */
    public static DestinationStore fromName(String name) {
        DestinationStore store = name == null ? null
                : EnumUtils.getEnum(DestinationStore.class, name.toUpperCase(Locale.ROOT));
        if (store != null) {
            return store;
        }
        throw new ConversionJobValidationException("Invalid dest_store: " + name);
    }

    public boolean supports(FileFormat format) {
        return supportedFormats.contains(format);
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
