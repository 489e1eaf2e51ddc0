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
package feedconverter.core.job;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Serialises a conversion job to and from the JSON payload of a queue message. Field names are snake case, e.g.
 * "dest_prefix".
 */
public class ConversionJobSerDe {
    private final Gson gson;
    private final Gson gsonPrettyPrinting;

    public ConversionJobSerDe() {
        GsonBuilder builder = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES);
        gson = builder.create();
        gsonPrettyPrinting = builder.setPrettyPrinting().create();
    }

    /**
     * Formats a job as a JSON string.
     *
     * @param  job the job
     * @return     a JSON string of the job
     */
    public String toJson(ConversionJob job) {
        return gson.toJson(ConversionJobJson.from(job));
    }

    /**
     * Formats a job as a JSON string with the option to pretty print.
     *
     * @param  job         the job
     * @param  prettyPrint true to pretty print
     * @return             a JSON string of the job
     */
    public String toJson(ConversionJob job, boolean prettyPrint) {
        if (prettyPrint) {
            return gsonPrettyPrinting.toJson(ConversionJobJson.from(job));
        }
        return toJson(job);
    }

    /**
     * Reads a job from a JSON string. The job is validated as it is read.
     *
     * @param  json                             the JSON string
     * @return                                  the job
     * @throws ConversionJobValidationException if the JSON is not a valid job
     */
    public ConversionJob fromJson(String json) {
        ConversionJobJson jobJson;
        try {
            jobJson = gson.fromJson(json, ConversionJobJson.class);
        } catch (JsonParseException e) {
            throw new ConversionJobValidationException("Could not parse JSON", e);
        }
        if (jobJson == null) {
            throw new ConversionJobValidationException("Empty message");
        }
        return jobJson.to();
    }
}
