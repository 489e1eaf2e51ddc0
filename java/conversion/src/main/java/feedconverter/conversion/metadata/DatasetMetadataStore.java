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
package feedconverter.conversion.metadata;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.conversion.store.ObjectNotFoundException;
import feedconverter.conversion.store.ObjectStore;
import feedconverter.core.properties.ConverterProperties;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static feedconverter.core.properties.ConverterProperty.METADATA_FILENAME;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_PREFIX;

/**
 * Reads the metadata file held alongside the source files of each dataset. The file is written upstream, and is
 * read to find the superkey of a dataset.
 */
public class DatasetMetadataStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetMetadataStore.class);

    private final ObjectStore objectStore;
    private final String bucket;
    private final String sourcePrefix;
    private final String metadataFilename;
    private final Gson gson = new Gson();

    public DatasetMetadataStore(ObjectStore objectStore, ConverterProperties properties) {
        this.objectStore = objectStore;
        this.bucket = properties.get(SOURCE_BUCKET);
        this.sourcePrefix = properties.get(SOURCE_PREFIX);
        this.metadataFilename = properties.get(METADATA_FILENAME);
    }

    /**
     * Reads the superkey of a dataset.
     *
     * @param  collection the collection
     * @param  dataset    the dataset
     * @return            the superkey column names, or an empty optional if the metadata file is missing or does not
     *                    set a superkey
     */
    public Optional<List<String>> getSuperkey(String collection, String dataset) {
        String key = getMetadataKey(collection, dataset);
        byte[] bytes;
        try {
            bytes = objectStore.get(bucket, key);
        } catch (ObjectNotFoundException e) {
            LOGGER.info("No metadata file found for dataset {}/{}", collection, dataset);
            return Optional.empty();
        }
        DatasetMetadataJson metadata;
        try {
            metadata = gson.fromJson(new String(bytes, StandardCharsets.UTF_8), DatasetMetadataJson.class);
        } catch (JsonParseException e) {
            LOGGER.warn("Could not parse metadata file {}", key, e);
            return Optional.empty();
        }
        if (metadata == null || metadata.superkey == null) {
            LOGGER.info("No superkey set in metadata file {}", key);
            return Optional.empty();
        }
        return Optional.of(List.copyOf(metadata.superkey));
    }

    /**
     * Builds the key of the metadata file of a dataset.
     *
     * @param  collection the collection
     * @param  dataset    the dataset
     * @return            the object key in the source bucket
     */
    public String getMetadataKey(String collection, String dataset) {
        return sourcePrefix + collection + "/" + dataset + "/" + metadataFilename;
    }

    public String getMetadataFilename() {
        return metadataFilename;
    }

    /**
     * The fields of the metadata file that are read. Other fields are ignored.
     */
    private static class DatasetMetadataJson {
        private List<String> superkey;
    }
}
