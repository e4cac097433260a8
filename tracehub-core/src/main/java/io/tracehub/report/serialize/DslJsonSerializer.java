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

import com.dslplatform.json.BoolConverter;
import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonWriter;
import com.dslplatform.json.NumberConverter;
import com.dslplatform.json.StringConverter;
import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.transaction.AbstractSpan;
import io.tracehub.impl.transaction.Measurement;
import io.tracehub.impl.transaction.Span;
import io.tracehub.impl.transaction.SpanStatus;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.dslplatform.json.JsonWriter.ARRAY_END;
import static com.dslplatform.json.JsonWriter.ARRAY_START;
import static com.dslplatform.json.JsonWriter.COMMA;
import static com.dslplatform.json.JsonWriter.OBJECT_END;
import static com.dslplatform.json.JsonWriter.OBJECT_START;
import static com.dslplatform.json.JsonWriter.QUOTE;

/**
 * Writes events, spans and sessions as JSON.
 * <p>
 * Timestamps of events and spans are written as epoch seconds with microsecond precision,
 * timestamps of sessions and envelope headers as ISO 8601 strings.
 * </p>
 * <p>
 * Note: this class is not thread safe, as it reuses the same {@link JsonWriter}.
 * </p>
 */
public class DslJsonSerializer {

    static final int BUFFER_SIZE = 16384;
    // visible for testing
    final JsonWriter jw;
    private final DateSerializer dateSerializer;

    public DslJsonSerializer() {
        jw = new DslJson<>().newWriter(BUFFER_SIZE);
        dateSerializer = new DateSerializer();
    }

    public String toJsonString(Event event) {
        return toJsonString(event, true);
    }

    /**
     * @param includeTracestate whether to add the {@code tracestate} field,
     *                          which is omitted when the tracestate is already part of the envelope header
     */
    public String toJsonString(Event event, boolean includeTracestate) {
        jw.reset();
        serializeEvent(event, includeTracestate);
        return flushToString();
    }

    public String toJsonString(AbstractSpan<?> span) {
        jw.reset();
        serializeSpan(span);
        return flushToString();
    }

    public String toJsonString(Session session) {
        jw.reset();
        serializeSession(session);
        return flushToString();
    }

    /**
     * Serializes the first line of an envelope.
     *
     * @param eventId      the id of the event contained in the envelope
     * @param sentAtMillis the time the envelope is sent, in milliseconds since epoch
     * @param traceId      the id of the trace of a transaction
     * @param trace        the decoded tracestate JSON, or the empty string if it could not be decoded
     */
    public String envelopeHeader(@Nullable String eventId, long sentAtMillis, @Nullable String traceId, @Nullable String trace) {
        jw.reset();
        jw.writeByte(OBJECT_START);
        writeField("event_id", eventId);
        writeDateField("sent_at", sentAtMillis, traceId != null || trace != null);
        if (traceId != null) {
            writeFieldName("trace_id");
            jw.writeString(traceId);
            if (trace != null) {
                jw.writeByte(COMMA);
            }
        }
        if (trace != null) {
            writeFieldName("trace");
            jw.writeString(trace);
        }
        jw.writeByte(OBJECT_END);
        return flushToString();
    }

    public String itemHeader(String type) {
        jw.reset();
        jw.writeByte(OBJECT_START);
        writeLastField("type", type);
        jw.writeByte(OBJECT_END);
        return flushToString();
    }

    private String flushToString() {
        final String s = jw.toString();
        jw.reset();
        return s;
    }

    private void serializeEvent(Event event, boolean includeTracestate) {
        jw.writeByte(OBJECT_START);
        if (event.isTransaction()) {
            writeField("type", event.getType().getValue());
        }
        writeField("message", event.getMessage());
        if (event.getLevel() != null) {
            writeField("level", event.getLevel().getValue());
        }
        writeField("transaction", event.getTransaction());
        writeField("platform", event.getPlatform());
        writeField("environment", event.getEnvironment());
        writeField("release", event.getRelease());
        if (event.getStartTimestamp() >= 0) {
            writeSecondsField("start_timestamp", event.getStartTimestamp());
        }
        if (event.getTimestamp() >= 0) {
            writeSecondsField("timestamp", event.getTimestamp());
        }
        if (!event.getTags().isEmpty()) {
            writeFieldName("tags");
            serializeTags(event.getTags());
            jw.writeByte(COMMA);
        }
        final AbstractSpan<?> traceContext = event.getTraceContext();
        if (traceContext != null) {
            writeFieldName("contexts");
            jw.writeByte(OBJECT_START);
            writeFieldName("trace");
            serializeTraceContext(traceContext);
            jw.writeByte(OBJECT_END);
            jw.writeByte(COMMA);
        }
        if (event.isTransaction()) {
            serializeSpans(event.getSpans());
        }
        if (!event.getMeasurements().isEmpty()) {
            serializeMeasurements(event.getMeasurements());
        }
        if (includeTracestate) {
            writeField("tracestate", event.getTracestate());
        }
        writeLastField("event_id", event.getEventId());
        jw.writeByte(OBJECT_END);
    }

    private void serializeSpans(List<Span> spans) {
        writeFieldName("spans");
        jw.writeByte(ARRAY_START);
        for (int i = 0; i < spans.size(); i++) {
            if (i > 0) {
                jw.writeByte(COMMA);
            }
            serializeSpan(spans.get(i));
        }
        jw.writeByte(ARRAY_END);
        jw.writeByte(COMMA);
    }

    private void serializeSpan(AbstractSpan<?> span) {
        jw.writeByte(OBJECT_START);
        serializeSpanFields(span);
        writeSecondsField("start_timestamp", span.getTimestamp());
        if (span.isFinished()) {
            writeSecondsField("timestamp", span.getEndTimestamp());
        }
        writeHexField("trace_id", span.getTraceId().toString(), false);
        jw.writeByte(OBJECT_END);
    }

    /**
     * The trace context of an event: the ids and metadata of a span, without its timestamps
     */
    private void serializeTraceContext(AbstractSpan<?> span) {
        jw.writeByte(OBJECT_START);
        serializeSpanFields(span);
        writeHexField("trace_id", span.getTraceId().toString(), false);
        jw.writeByte(OBJECT_END);
    }

    private void serializeSpanFields(AbstractSpan<?> span) {
        writeHexField("span_id", span.getSpanId().toString(), true);
        if (!span.getParentSpanId().isEmpty()) {
            writeHexField("parent_span_id", span.getParentSpanId().toString(), true);
        }
        writeField("op", span.getOp());
        writeField("description", span.getDescription());
        final SpanStatus status = span.getStatus();
        if (status != null) {
            writeField("status", status.getValue());
        }
        if (!span.getTags().isEmpty()) {
            writeFieldName("tags");
            serializeTags(span.getTags());
            jw.writeByte(COMMA);
        }
        if (!span.getData().isEmpty()) {
            writeFieldName("data");
            serializeObject(span.getData());
            jw.writeByte(COMMA);
        }
    }

    private void serializeMeasurements(Map<String, Measurement> measurements) {
        writeFieldName("measurements");
        jw.writeByte(OBJECT_START);
        final Iterator<Map.Entry<String, Measurement>> iterator = measurements.entrySet().iterator();
        while (iterator.hasNext()) {
            final Map.Entry<String, Measurement> entry = iterator.next();
            jw.writeString(entry.getKey());
            jw.writeByte(JsonWriter.SEMI);
            jw.writeByte(OBJECT_START);
            writeField("unit", entry.getValue().getUnit());
            writeFieldName("value");
            NumberConverter.serialize(entry.getValue().getValue(), jw);
            jw.writeByte(OBJECT_END);
            if (iterator.hasNext()) {
                jw.writeByte(COMMA);
            }
        }
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
    }

    private void serializeSession(Session session) {
        jw.writeByte(OBJECT_START);
        writeField("sid", session.getSid());
        writeField("did", session.getDid());
        writeField("init", session.isInit());
        writeDateField("started", session.getStarted(), true);
        writeDateField("timestamp", session.getTimestamp(), true);
        writeField("duration", session.getDuration());
        writeField("status", session.getStatus().getValue());
        writeFieldName("attrs");
        jw.writeByte(OBJECT_START);
        writeField("environment", session.getEnvironment());
        writeField("ip_address", session.getIpAddress());
        writeField("user_agent", session.getUserAgent());
        writeLastField("release", session.getRelease());
        jw.writeByte(OBJECT_END);
        jw.writeByte(COMMA);
        writeFieldName("errors");
        NumberConverter.serialize(session.getErrors(), jw);
        jw.writeByte(OBJECT_END);
    }

    void serializeTags(Map<String, String> value) {
        jw.writeByte(OBJECT_START);
        final int size = value.size();
        if (size > 0) {
            final Iterator<Map.Entry<String, String>> iterator = value.entrySet().iterator();
            Map.Entry<String, String> kv = iterator.next();
            jw.writeString(kv.getKey());
            jw.writeByte(JsonWriter.SEMI);
            StringConverter.serializeNullable(kv.getValue(), jw);
            for (int i = 1; i < size; i++) {
                jw.writeByte(COMMA);
                kv = iterator.next();
                jw.writeString(kv.getKey());
                jw.writeByte(JsonWriter.SEMI);
                StringConverter.serializeNullable(kv.getValue(), jw);
            }
        }
        jw.writeByte(OBJECT_END);
    }

    private void serializeObject(Map<?, ?> map) {
        jw.writeByte(OBJECT_START);
        final Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
        while (iterator.hasNext()) {
            final Map.Entry<?, ?> entry = iterator.next();
            jw.writeString(String.valueOf(entry.getKey()));
            jw.writeByte(JsonWriter.SEMI);
            serializeValue(entry.getValue());
            if (iterator.hasNext()) {
                jw.writeByte(COMMA);
            }
        }
        jw.writeByte(OBJECT_END);
    }

    private void serializeValue(@Nullable Object value) {
        if (value == null) {
            jw.writeNull();
        } else if (value instanceof String) {
            writeStringValue((String) value);
        } else if (value instanceof Boolean) {
            BoolConverter.serialize((Boolean) value, jw);
        } else if (value instanceof Double || value instanceof Float) {
            NumberConverter.serialize(((Number) value).doubleValue(), jw);
        } else if (value instanceof Number) {
            NumberConverter.serialize(((Number) value).longValue(), jw);
        } else if (value instanceof Map) {
            serializeObject((Map<?, ?>) value);
        } else if (value instanceof Collection) {
            jw.writeByte(ARRAY_START);
            final Iterator<?> iterator = ((Collection<?>) value).iterator();
            while (iterator.hasNext()) {
                serializeValue(iterator.next());
                if (iterator.hasNext()) {
                    jw.writeByte(COMMA);
                }
            }
            jw.writeByte(ARRAY_END);
        } else {
            writeStringValue(value.toString());
        }
    }

    void writeField(final String fieldName, @Nullable final String value) {
        if (value != null) {
            writeFieldName(fieldName);
            writeStringValue(value);
            jw.writeByte(COMMA);
        }
    }

    private void writeStringValue(String value) {
        jw.writeString(value);
    }

    private void writeField(final String fieldName, final boolean value) {
        writeFieldName(fieldName);
        BoolConverter.serialize(value, jw);
        jw.writeByte(COMMA);
    }

    private void writeField(final String fieldName, final double value) {
        writeFieldName(fieldName);
        NumberConverter.serialize(value, jw);
        jw.writeByte(COMMA);
    }

    void writeLastField(final String fieldName, @Nullable final String value) {
        writeFieldName(fieldName);
        if (value != null) {
            writeStringValue(value);
        } else {
            jw.writeNull();
        }
    }

    private void writeFieldName(final String fieldName) {
        jw.writeByte(QUOTE);
        jw.writeAscii(fieldName);
        jw.writeByte(QUOTE);
        jw.writeByte(JsonWriter.SEMI);
    }

    private void writeHexField(String fieldName, String hex, boolean comma) {
        writeFieldName(fieldName);
        jw.writeByte(QUOTE);
        jw.writeAscii(hex);
        jw.writeByte(QUOTE);
        if (comma) {
            jw.writeByte(COMMA);
        }
    }

    private void writeSecondsField(final String fieldName, final long epochMicros) {
        writeFieldName(fieldName);
        DateSerializer.serializeEpochMicrosAsSeconds(jw, epochMicros);
        jw.writeByte(COMMA);
    }

    private void writeDateField(final String fieldName, final long epochMillis, boolean comma) {
        writeFieldName(fieldName);
        jw.writeByte(QUOTE);
        dateSerializer.serializeEpochTimestampAsIsoDateTime(jw, epochMillis);
        jw.writeByte(QUOTE);
        if (comma) {
            jw.writeByte(COMMA);
        }
    }
}
