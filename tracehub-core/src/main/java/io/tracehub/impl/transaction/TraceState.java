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
package io.tracehub.impl.transaction;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonWriter;
import io.tracehub.impl.Client;
import io.tracehub.impl.ClientOptions;
import io.tracehub.impl.Dsn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static com.dslplatform.json.JsonWriter.COMMA;
import static com.dslplatform.json.JsonWriter.OBJECT_END;
import static com.dslplatform.json.JsonWriter.OBJECT_START;

/**
 * Encodes the trace-level data used for dynamic sampling into a value which is safe to be used in a
 * {@code tracestate} header entry.
 * <p>
 * The value is the base64 encoded UTF-16LE representation of
 * {@code {"trace_id":"...","public_key":"...","environment":"...","release":"..."}}.
 * As {@code =} is a delimiter in {@code tracestate} headers, the trailing base64 padding is replaced by a single {@code .}.
 * When decoding, the padding is restored based on the length of the value,
 * so that values which required two padding characters are restored correctly as well.
 * </p>
 */
public class TraceState {

    public static final String HEADER_NAME = "tracestate";
    public static final String VENDOR_KEY = "sentry";
    static final String NO_ENVIRONMENT = "no environment specified";
    static final String NO_RELEASE = "no release specified";
    private static final Logger logger = LoggerFactory.getLogger(TraceState.class);
    private static final char PADDING_SENTINEL = '.';
    private static final DslJson<Object> dslJson = new DslJson<>();

    private TraceState() {
    }

    /**
     * Creates the tracestate value of a new trace.
     *
     * @param traceId the id of the trace
     * @param client  the client the trace is reported to
     * @return the encoded value,
     * {@code null} if there is no client or the client has no destination (propagation is skipped in that case),
     * or the empty string if the value could not be encoded
     */
    @Nullable
    public static String createValue(Id traceId, @Nullable Client client) {
        if (client == null) {
            return null;
        }
        final Dsn dsn = client.getDsn();
        if (dsn == null) {
            return null;
        }
        final ClientOptions options = client.getOptions();
        try {
            return encode(traceId.toString(), dsn.getPublicKey(), options.getEnvironment(), options.getRelease());
        } catch (TraceStateEncodingException e) {
            logger.warn("Could not create tracestate for trace {}", traceId, e);
            return "";
        }
    }

    public static String encode(String traceId, String publicKey, @Nullable String environment, @Nullable String release)
        throws TraceStateEncodingException {
        return encode(toJson(traceId, publicKey, environment, release));
    }

    /**
     * Encodes an arbitrary string.
     *
     * @param json the string to encode, usually a JSON object
     * @return the base64 encoded UTF-16LE representation, padding replaced by {@code .}
     * @throws TraceStateEncodingException if the string contains unpaired surrogates
     */
    public static String encode(String json) throws TraceStateEncodingException {
        final ByteBuffer bytes;
        try {
            bytes = StandardCharsets.UTF_16LE.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(json));
        } catch (CharacterCodingException e) {
            throw new TraceStateEncodingException("Unable to convert string to base64: " + abbreviate(json), e);
        }
        final byte[] data = new byte[bytes.remaining()];
        bytes.get(data);
        final String base64 = Base64.getEncoder().encodeToString(data);
        int end = base64.length();
        while (end > 0 && base64.charAt(end - 1) == '=') {
            end--;
        }
        if (end == base64.length()) {
            return base64;
        }
        return base64.substring(0, end) + PADDING_SENTINEL;
    }

    /**
     * Decodes a value created by {@link #encode(String)}.
     *
     * @param value the encoded value
     * @return the decoded string
     * @throws TraceStateEncodingException if the value is not valid base64 or does not represent UTF-16LE text
     */
    public static String decode(String value) throws TraceStateEncodingException {
        final StringBuilder base64 = new StringBuilder(value.length() + 2);
        if (!value.isEmpty() && value.charAt(value.length() - 1) == PADDING_SENTINEL) {
            base64.append(value, 0, value.length() - 1);
        } else {
            base64.append(value);
        }
        if (base64.length() % 4 == 1) {
            throw new TraceStateEncodingException("Unable to convert from base64, invalid length: " + abbreviate(value));
        }
        while (base64.length() % 4 != 0) {
            base64.append('=');
        }
        final byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(base64.toString());
        } catch (IllegalArgumentException e) {
            throw new TraceStateEncodingException("Unable to convert from base64: " + abbreviate(value), e);
        }
        try {
            return StandardCharsets.UTF_16LE.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new TraceStateEncodingException("Unable to convert string from base64: " + abbreviate(value), e);
        }
    }

    /**
     * @return the header entry for the given value, for example {@code sentry=eyJ0cmFjZV9pZCI6...}
     */
    public static String toHeaderValue(String value) {
        return VENDOR_KEY + "=" + value;
    }

    /**
     * Extracts the value of the {@code sentry} entry from a {@code tracestate} header,
     * which may contain entries of other vendors.
     *
     * @param header the header value, for example {@code sentry=eyJ0cmFjZV9pZCI6...,other=value}
     * @return the value of the entry, or {@code null} if there is none
     */
    @Nullable
    public static String extractFromHeader(String header) {
        for (String entry : header.split(",")) {
            final String trimmed = entry.trim();
            final int separator = trimmed.indexOf('=');
            if (separator > 0 && VENDOR_KEY.equals(trimmed.substring(0, separator).trim())) {
                final String value = trimmed.substring(separator + 1).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    static String toJson(String traceId, String publicKey, @Nullable String environment, @Nullable String release) {
        final JsonWriter jw = dslJson.newWriter(256);
        jw.writeByte(OBJECT_START);
        writeField("trace_id", traceId, jw);
        jw.writeByte(COMMA);
        writeField("public_key", publicKey, jw);
        jw.writeByte(COMMA);
        writeField("environment", isEmpty(environment) ? NO_ENVIRONMENT : environment, jw);
        jw.writeByte(COMMA);
        writeField("release", isEmpty(release) ? NO_RELEASE : release, jw);
        jw.writeByte(OBJECT_END);
        return jw.toString();
    }

    private static void writeField(String fieldName, String value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeAscii(fieldName);
        jw.writeByte(JsonWriter.QUOTE);
        jw.writeByte(JsonWriter.SEMI);
        jw.writeString(value);
    }

    private static boolean isEmpty(@Nullable String s) {
        return s == null || s.isEmpty();
    }

    private static String abbreviate(String s) {
        return s.length() > 256 ? s.substring(0, 256) + "..." : s;
    }
}
