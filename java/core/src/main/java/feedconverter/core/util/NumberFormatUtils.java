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
package feedconverter.core.util;

/**
 * Formats numbers as human readable strings.
 */
public class NumberFormatUtils {

    private static final long K_COUNT = 1_000;
    private static final long M_COUNT = 1_000_000;
    private static final long G_COUNT = 1_000_000_000;

    private NumberFormatUtils() {
    }

    /**
     * Formats a number of bytes, followed by a human readable representation, e.g. "1500B (1.5KB)".
     *
     * @param  bytes the number of bytes
     * @return       the formatted string
     */
    public static String formatBytes(long bytes) {
        if (bytes < K_COUNT) {
            return bytes + "B";
        } else if (bytes < M_COUNT) {
            return String.format("%dB (%.1fKB)", bytes, bytes / (double) K_COUNT);
        } else if (bytes < G_COUNT) {
            return String.format("%dB (%.1fMB)", bytes, bytes / (double) M_COUNT);
        } else {
            return String.format("%dB (%.1fGB)", bytes, bytes / (double) G_COUNT);
        }
    }
}
