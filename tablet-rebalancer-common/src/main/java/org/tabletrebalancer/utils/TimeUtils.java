/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tabletrebalancer.utils;

import org.tabletrebalancer.annotation.Internal;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/** Collection of time related utilities. */
@Internal
public class TimeUtils {

    private static final Map<String, ChronoUnit> LABEL_TO_UNIT_MAP = initMap();

    /**
     * Parse the given string to a java {@link Duration}. The string is in format "{length
     * value}{time unit label}", e.g. "123ms", "321 s". If no time unit label is specified, it will
     * be considered as milliseconds.
     *
     * <p>Supported time unit labels are:
     *
     * <ul>
     *   <li>MILLISECONDS: "ms", "milli", "millis"
     *   <li>SECONDS: "s", "sec", "secs", "second", "seconds"
     *   <li>MINUTES: "min", "minute", "minutes"
     *   <li>HOURS: "h", "hour", "hours"
     *   <li>DAYS: "d", "day", "days"
     * </ul>
     *
     * @param text string to parse.
     */
    public static Duration parseDuration(String text) {
        checkNotNull(text);

        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("argument is an empty- or whitespace-only string");
        }

        final int len = trimmed.length();
        int pos = 0;

        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unitLabel = trimmed.substring(pos).trim().toLowerCase(Locale.US);

        if (number.isEmpty()) {
            throw new NumberFormatException("text does not start with a number");
        }

        final long value;
        try {
            value = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be re represented as 64bit number (numeric overflow).");
        }

        if (unitLabel.isEmpty()) {
            return toDuration(value, ChronoUnit.MILLIS, trimmed);
        }

        ChronoUnit unit = LABEL_TO_UNIT_MAP.get(unitLabel);
        if (unit != null) {
            return toDuration(value, unit, trimmed);
        } else {
            throw new IllegalArgumentException(
                    "Time interval unit label '"
                            + unitLabel
                            + "' does not match any of the recognized units: "
                            + LABEL_TO_UNIT_MAP.keySet());
        }
    }

    private static Duration toDuration(long value, ChronoUnit unit, String text) {
        try {
            return Duration.of(value, unit);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "The duration '" + text + "' cannot be represented (numeric overflow).", e);
        }
    }

    /** Pretty prints the duration as a lowest granularity unit that does not lose precision. */
    public static String formatWithHighestUnit(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos % 86_400_000_000_000L == 0) {
            return (nanos / 86_400_000_000_000L) + " d";
        } else if (nanos % 3_600_000_000_000L == 0) {
            return (nanos / 3_600_000_000_000L) + " h";
        } else if (nanos % 60_000_000_000L == 0) {
            return (nanos / 60_000_000_000L) + " min";
        } else if (nanos % 1_000_000_000L == 0) {
            return (nanos / 1_000_000_000L) + " s";
        } else if (nanos % 1_000_000L == 0) {
            return (nanos / 1_000_000L) + " ms";
        }
        return nanos + " ns";
    }

    private static Map<String, ChronoUnit> initMap() {
        Map<String, ChronoUnit> labelToUnit = new HashMap<>();
        putLabels(labelToUnit, ChronoUnit.MILLIS, Arrays.asList("ms", "milli", "millis"));
        putLabels(
                labelToUnit,
                ChronoUnit.SECONDS,
                Arrays.asList("s", "sec", "secs", "second", "seconds"));
        putLabels(labelToUnit, ChronoUnit.MINUTES, Arrays.asList("min", "minute", "minutes"));
        putLabels(labelToUnit, ChronoUnit.HOURS, Arrays.asList("h", "hour", "hours"));
        putLabels(labelToUnit, ChronoUnit.DAYS, Arrays.asList("d", "day", "days"));
        return labelToUnit;
    }

    private static void putLabels(
            Map<String, ChronoUnit> labelToUnit, ChronoUnit unit, List<String> labels) {
        for (String label : labels) {
            labelToUnit.put(label, unit);
        }
    }

    private TimeUtils() {}
}
