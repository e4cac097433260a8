/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.tracehub.report.serialize;

import com.dslplatform.json.JsonWriter;
import com.dslplatform.json.NumberConverter;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

/**
 * Serializes epoch timestamps, either as an ISO 8601 date time string with millisecond precision,
 * for example {@code 2021-03-04T12:13:14.123Z}, or as epoch seconds with microsecond precision,
 * for example {@code 1614859994.123456}.
 * <p>
 * Determining year, month and day is left to {@link SimpleDateFormat}, the result is cached for the whole day.
 * </p>
 * <p>
 * Note: this class is not thread safe.
 * </p>
 */
class DateSerializer {

    private static final long MILLIS_PER_SECOND = 1000;
    private static final long MILLIS_PER_MINUTE = MILLIS_PER_SECOND * 60;
    private static final long MILLIS_PER_HOUR = MILLIS_PER_MINUTE * 60;
    private static final long MILLIS_PER_DAY = MILLIS_PER_HOUR * 24;
    private static final long MICROS_PER_SECOND = 1_000_000;
    private static final byte TIME_SEPARATOR = 'T';
    private static final byte TIME_ZONE_SEPARATOR = 'Z';
    private static final byte COLON = ':';
    private static final byte DOT = '.';
    private static final byte ZERO = '0';
    private final SimpleDateFormat dateFormat;
    // initialized in constructor via cacheDate
    @SuppressWarnings("NullableProblems")
    private String cachedDateIso;
    private long startOfCachedDate;
    private long endOfCachedDate;

    DateSerializer() {
        dateFormat = new SimpleDateFormat("yyyy-MM-dd");
        dateFormat.setTimeZone(TimeZone.getTimeZone("UTC"));
        cacheDate(System.currentTimeMillis());
    }

    private static long atStartOfDay(long epochMillis) {
        return epochMillis - epochMillis % MILLIS_PER_DAY;
    }

    private static long atEndOfDay(long epochMillis) {
        return atStartOfDay(epochMillis) + MILLIS_PER_DAY - 1;
    }

    void serializeEpochTimestampAsIsoDateTime(JsonWriter jw, long epochMillis) {
        if (!isDateCached(epochMillis)) {
            cacheDate(epochMillis);
        }
        jw.writeAscii(cachedDateIso);

        jw.writeByte(TIME_SEPARATOR);

        // hours
        long remainder = epochMillis % MILLIS_PER_DAY;
        serializeWithLeadingZero(jw, remainder / MILLIS_PER_HOUR, 2);
        jw.writeByte(COLON);

        // minutes
        remainder %= MILLIS_PER_HOUR;
        serializeWithLeadingZero(jw, remainder / MILLIS_PER_MINUTE, 2);
        jw.writeByte(COLON);

        // seconds
        remainder %= MILLIS_PER_MINUTE;
        serializeWithLeadingZero(jw, remainder / MILLIS_PER_SECOND, 2);
        jw.writeByte(DOT);

        // milliseconds
        remainder %= MILLIS_PER_SECOND;
        serializeWithLeadingZero(jw, remainder, 3);

        jw.writeByte(TIME_ZONE_SEPARATOR);
    }

    /**
     * Writes a JSON number, for example {@code 1614859994.000042} for {@code 1614859994000042} micros.
     */
    static void serializeEpochMicrosAsSeconds(JsonWriter jw, long epochMicros) {
        NumberConverter.serialize(epochMicros / MICROS_PER_SECOND, jw);
        jw.writeByte(DOT);
        serializeWithLeadingZero(jw, epochMicros % MICROS_PER_SECOND, 6);
    }

    private static void serializeWithLeadingZero(JsonWriter jw, long value, int minLength) {
        for (int i = minLength - 1; i > 0; i--) {
            if (value < Math.pow(10, i)) {
                jw.writeByte(ZERO);
            }
        }
        NumberConverter.serialize(value, jw);
    }

    private void cacheDate(long epochMillis) {
        cachedDateIso = dateFormat.format(new Date(epochMillis));
        startOfCachedDate = atStartOfDay(epochMillis);
        endOfCachedDate = atEndOfDay(epochMillis);
    }

    private boolean isDateCached(long epochMillis) {
        return epochMillis >= startOfCachedDate && epochMillis <= endOfCachedDate;
    }
}
