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
package feedconverter.conversion.store;

/**
 * Thrown when reading an object that does not exist.
 */
public class ObjectNotFoundException extends RuntimeException {

    public ObjectNotFoundException(String bucket, String key) {
        this(bucket, key, null);
    }

    public ObjectNotFoundException(String bucket, String key, Throwable cause) {
        super("Object not found in bucket " + bucket + ": " + key, cause);
    }
}
