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

import java.util.Locale;

/**
 * The container format of a converted file.
 */
public enum FileFormat {
    /**
     * An Arrow IPC stream. The whole stream is compressed with the chosen codec.
     */
    ARROW,
    /**
     * A Parquet file. The chosen codec is applied to each page by the Parquet writer.
     */
    PARQUET;

    /**
     * Reads a file format from the name used in job payloads and paths, e.g. "arrow".
     *
     * @param  name the name
     * @return      the file format
     */
    public static FileFormat fromName(String name) {
        FileFormat format = name == null ? null : EnumUtils.getEnum(FileFormat.class, name.toUpperCase(Locale.ROOT));
        if (format != null) {
            return format;
        }
        throw new ConversionJobValidationException("Invalid file_format: " + name);
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
