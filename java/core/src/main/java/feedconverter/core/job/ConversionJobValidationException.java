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

/**
 * Thrown when the parameters of a conversion job are invalid. This is always raised before any data is read.
 */
public class ConversionJobValidationException extends RuntimeException {

    public ConversionJobValidationException(String message) {
        super("Conversion job validation failed: " + message);
    }

    public ConversionJobValidationException(String message, Throwable cause) {
        super("Conversion job validation failed: " + message, cause);
    }
}
