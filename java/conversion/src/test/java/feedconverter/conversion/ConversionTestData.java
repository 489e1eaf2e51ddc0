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
package feedconverter.conversion;

import feedconverter.conversion.store.InMemoryObjectStore;
import feedconverter.core.properties.ConverterProperties;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static feedconverter.core.properties.ConverterProperty.DESTINATION_BUCKET;
import static feedconverter.core.properties.ConverterProperty.SOURCE_BUCKET;
import static feedconverter.table.TableTestHelper.dailyPriceLines;
import static feedconverter.table.TableTestHelper.gzipCsv;

/**
 * Writes source files in the layout produced upstream, for tests.
 */
public class ConversionTestData {

    public static final String SOURCE_BUCKET_NAME = "source-bucket";
    public static final String DESTINATION_BUCKET_NAME = "destination-bucket";
    public static final String SOURCE_PREFIX = "version5/aurora/gz/";
    public static final String HEADER = "target_start,target_end,node_id,lmp";
    public static final String METADATA = "{\"superkey\":[\"target_start\",\"target_end\",\"node_id\"]," +
            "\"description\":\"Locational marginal prices\"}";

    private ConversionTestData() {
    }

    public static ConverterProperties createProperties() {
        ConverterProperties properties = new ConverterProperties();
        properties.set(SOURCE_BUCKET, SOURCE_BUCKET_NAME);
        properties.set(DESTINATION_BUCKET, DESTINATION_BUCKET_NAME);
        return properties;
    }

    public static String sourceKey(String collection, String dataset, long timestamp) {
        int year = Instant.ofEpochSecond(timestamp).atZone(ZoneOffset.UTC).getYear();
        return SOURCE_PREFIX + collection + "/" + dataset + "/year=" + year + "/" + timestamp + ".csv.gz";
    }

    /**
     * Writes one source file for each hour of a day, each holding one row.
     *
     * @param  store      the store
     * @param  collection the collection
     * @param  dataset    the dataset
     * @param  dayStart   the start of the day in seconds since the epoch
     * @return            the keys of the files
     */
    public static List<String> writeHourlyFiles(InMemoryObjectStore store, String collection, String dataset, long dayStart) {
        List<String> keys = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            long start = dayStart + hour * 3600L;
            String key = sourceKey(collection, dataset, start);
            store.put(SOURCE_BUCKET_NAME, key, gzipCsv(HEADER, start + "," + (start + 3600) + "," + hour + ",8.9"));
            keys.add(key);
        }
        return keys;
    }

    /**
     * Writes one source file for a day, holding one row for each hour.
     *
     * @param  store      the store
     * @param  collection the collection
     * @param  dataset    the dataset
     * @param  dayStart   the start of the day in seconds since the epoch
     * @return            the key of the file
     */
    public static String writeDailyFile(InMemoryObjectStore store, String collection, String dataset, long dayStart) {
        String key = sourceKey(collection, dataset, dayStart);
        store.put(SOURCE_BUCKET_NAME, key, gzipCsv(dailyPriceLines(dayStart)));
        return key;
    }

    public static void writeMetadata(InMemoryObjectStore store, String collection, String dataset) {
        store.putString(SOURCE_BUCKET_NAME, SOURCE_PREFIX + collection + "/" + dataset + "/METADATA.json", METADATA);
    }
}
