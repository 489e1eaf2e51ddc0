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
package feedconverter.core.source;

/**
 * Thrown when a source object key does not have the expected shape
 * {@code <prefix><collection>/<dataset>/.../<unix timestamp>.<extension>}.
 */
public class MalformedKeyException extends RuntimeException {

    public MalformedKeyException(String key, String reason) {
        super("Malformed source key \"" + key + "\": " + reason);
    }

    public MalformedKeyException(String key, String reason, Throwable cause) {
        super("Malformed source key \"" + key + "\": " + reason, cause);
    }
}
