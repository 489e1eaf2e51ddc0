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

import java.util.List;

/**
 * A unit of conversion work, read from a queue message. A job either converts a single new source file as it arrives,
 * or converts a batch of historical source files that share one partition bucket.
 */
public interface ConversionJob {

    ConversionTarget getTarget();

    /**
     * Lists the full object keys of the source files to convert.
     *
     * @return the source keys
     */
    List<String> getSourceKeys();

    /**
     * Checks whether this is a backfill job. Backfill jobs may hold many source files, which must be grouped into
     * partition buckets before conversion.
     *
     * @return true if this is a backfill job
     */
    boolean isBackfill();
}
