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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tracehub.impl.Hub;
import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.EventType;
import io.tracehub.impl.event.Level;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.event.SessionStatus;
import io.tracehub.impl.sampling.SamplingDecision;
import io.tracehub.impl.sampling.SamplingMethod;
import io.tracehub.impl.transaction.Measurement;
import io.tracehub.impl.transaction.Span;
import io.tracehub.impl.transaction.SpanContext;
import io.tracehub.impl.transaction.SpanStatus;
import io.tracehub.impl.transaction.Transaction;
import io.tracehub.impl.transaction.TransactionContext;
import io.tracehub.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DslJsonSerializerTest {

    private static final String TRACE_ID = "12312012123120121231201212312012";

    private DslJsonSerializer serializer;
    private ObjectMapper objectMapper;
    private Transaction transaction;

    @BeforeEach
    void setUp() {
        serializer = new DslJsonSerializer();
        objectMapper = new ObjectMapper();
        transaction = new Transaction(TransactionContext.create("GET /dogs")
            .withTraceId(TRACE_ID)
            .withSpanId("1121201211212012")
            .withStartTimestamp(1_614_859_994_000_001L),
            new Hub(null), SamplingDecision.of(true, SamplingMethod.EXPLICITLY_SET));
        transaction.initSpanRecorder();
    }

    private JsonNode readTree(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    void testSerializeMessageEvent() throws Exception {
        Event event = Event.message("Woof", Level.ERROR)
            .withEventId("0123456789abcdef0123456789abcdef")
            .withTimestamp(1_614_859_994_123_456L)
            .withEnvironment("production")
            .withTag("dog", "Charlie");

        String jsonString = serializer.toJsonString(event);
        JsonNode json = readTree(jsonString);

        assertThat(json.has("type")).isFalse();
        assertThat(json.get("message").textValue()).isEqualTo("Woof");
        assertThat(json.get("level").textValue()).isEqualTo("error");
        assertThat(json.get("environment").textValue()).isEqualTo("production");
        assertThat(json.has("release")).isFalse();
        assertThat(jsonString).contains("\"timestamp\":1614859994.123456,");
        assertThat(json.has("start_timestamp")).isFalse();
        assertThat(json.get("tags").get("dog").textValue()).isEqualTo("Charlie");
        assertThat(json.get("event_id").textValue()).isEqualTo("0123456789abcdef0123456789abcdef");
    }

    @Test
    void testEventIdIsNullIfNotSet() throws Exception {
        JsonNode json = readTree(serializer.toJsonString(new Event()));

        assertThat(json.get("event_id").isNull()).isTrue();
    }

    @Test
    void testSerializeTransactionEvent() throws Exception {
        Span span = transaction.startChild(SpanContext.withOperation("db.query")
            .withDescription("SELECT * FROM dogs")
            .withStatus(SpanStatus.OK)
            .withStartTimestamp(1_614_859_994_100_000L));
        span.setData("rows", 3).setData("cached", false);
        span.finish(1_614_859_994_200_000L);
        Event event = new Event(EventType.TRANSACTION)
            .withTraceContext(transaction)
            .withTransaction(transaction.getName())
            .withStartTimestamp(transaction.getTimestamp())
            .withTimestamp(1_614_859_995_000_000L)
            .withTracestate("abc.");
        event.getSpans().add(span);
        event.getMeasurements().put("fp", new Measurement(12.5, null));

        String jsonString = serializer.toJsonString(event);
        JsonNode json = readTree(jsonString);

        assertThat(json.get("type").textValue()).isEqualTo("transaction");
        assertThat(json.get("transaction").textValue()).isEqualTo("GET /dogs");
        assertThat(jsonString).contains("\"start_timestamp\":1614859994.000001,\"timestamp\":1614859995.000000,");
        assertThat(json.get("tracestate").textValue()).isEqualTo("abc.");

        JsonNode trace = json.get("contexts").get("trace");
        assertThat(trace.get("trace_id").textValue()).isEqualTo(TRACE_ID);
        assertThat(trace.get("span_id").textValue()).isEqualTo("1121201211212012");
        assertThat(trace.has("parent_span_id")).isFalse();
        assertThat(trace.has("start_timestamp")).isFalse();

        assertThat(json.get("spans")).hasSize(1);
        JsonNode jsonSpan = json.get("spans").get(0);
        assertThat(jsonSpan.get("span_id").textValue()).isEqualTo(span.getSpanId().toString());
        assertThat(jsonSpan.get("parent_span_id").textValue()).isEqualTo("1121201211212012");
        assertThat(jsonSpan.get("trace_id").textValue()).isEqualTo(TRACE_ID);
        assertThat(jsonSpan.get("op").textValue()).isEqualTo("db.query");
        assertThat(jsonSpan.get("description").textValue()).isEqualTo("SELECT * FROM dogs");
        assertThat(jsonSpan.get("status").textValue()).isEqualTo("ok");
        assertThat(jsonSpan.get("data").get("rows").intValue()).isEqualTo(3);
        assertThat(jsonSpan.get("data").get("cached").booleanValue()).isFalse();
        assertThat(jsonString).contains("\"start_timestamp\":1614859994.100000,\"timestamp\":1614859994.200000,");

        assertThat(json.get("measurements").get("fp").get("value").doubleValue()).isEqualTo(12.5);
        assertThat(json.get("measurements").get("fp").has("unit")).isFalse();
    }

    @Test
    void testTracestateCanBeOmitted() throws Exception {
        Event event = new Event(EventType.TRANSACTION).withTraceContext(transaction).withTracestate("abc.");

        assertThat(readTree(serializer.toJsonString(event, false)).has("tracestate")).isFalse();
    }

    @Test
    void testSerializeUnfinishedSpan() throws Exception {
        Span span = transaction.startChild();

        JsonNode json = readTree(serializer.toJsonString(span));

        assertThat(json.has("start_timestamp")).isTrue();
        assertThat(json.has("timestamp")).isFalse();
        assertThat(json.has("op")).isFalse();
    }

    @Test
    void testSerializeNestedData() throws Exception {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("list", Arrays.asList(1, "two", null));
        nested.put("map", Collections.singletonMap("ratio", 0.5));
        Span span = transaction.startChild().setData("nested", nested).setData("other", new StringBuilder("custom"));

        JsonNode data = readTree(serializer.toJsonString(span)).get("data");

        assertThat(data.get("nested").get("list")).hasSize(3);
        assertThat(data.get("nested").get("list").get(1).textValue()).isEqualTo("two");
        assertThat(data.get("nested").get("list").get(2).isNull()).isTrue();
        assertThat(data.get("nested").get("map").get("ratio").doubleValue()).isEqualTo(0.5);
        assertThat(data.get("other").textValue()).isEqualTo("custom");
    }

    @Test
    void testLongValuesAreWrittenCompletely() throws Exception {
        StringBuilder longValue = new StringBuilder();
        for (int i = 0; i < DslJsonSerializer.BUFFER_SIZE + 10; i++) {
            longValue.append((char) ('a' + i % 26));
        }
        Event event = Event.message(longValue.toString(), null)
            .withTransaction(longValue.toString())
            .withTag("long", longValue.toString());

        JsonNode json = readTree(serializer.toJsonString(event));

        assertThat(json.get("message").textValue()).isEqualTo(longValue.toString());
        assertThat(json.get("transaction").textValue()).isEqualTo(longValue.toString());
        assertThat(json.get("tags").get("long").textValue()).isEqualTo(longValue.toString());
    }

    @Test
    void testSerializeSession() throws Exception {
        Session session = new Session(new MutableClock(1_614_859_994_000L))
            .withDid("user-1")
            .withRelease("1.0")
            .withEnvironment("production")
            .withUserAgent("Mozilla/5.0")
            .withErrors(2);
        session.update(1_614_859_996_500L);
        session.withStatus(SessionStatus.CRASHED);

        JsonNode json = readTree(serializer.toJsonString(session));

        assertThat(json.get("sid").textValue()).isEqualTo(session.getSid());
        assertThat(json.get("did").textValue()).isEqualTo("user-1");
        assertThat(json.get("init").booleanValue()).isTrue();
        assertThat(json.get("started").textValue()).isEqualTo("2021-03-04T12:13:14.000Z");
        assertThat(json.get("timestamp").textValue()).isEqualTo("2021-03-04T12:13:16.500Z");
        assertThat(json.get("duration").doubleValue()).isEqualTo(2.5);
        assertThat(json.get("status").textValue()).isEqualTo("crashed");
        assertThat(json.get("errors").intValue()).isEqualTo(2);
        JsonNode attrs = json.get("attrs");
        assertThat(attrs.get("release").textValue()).isEqualTo("1.0");
        assertThat(attrs.get("environment").textValue()).isEqualTo("production");
        assertThat(attrs.get("user_agent").textValue()).isEqualTo("Mozilla/5.0");
        assertThat(attrs.has("ip_address")).isFalse();
    }

    @Test
    void testEnvelopeHeader() throws Exception {
        JsonNode header = readTree(serializer.envelopeHeader("0123456789abcdef0123456789abcdef", 1_614_859_994_000L, TRACE_ID, "{\"a\":1}"));

        assertThat(header.get("event_id").textValue()).isEqualTo("0123456789abcdef0123456789abcdef");
        assertThat(header.get("sent_at").textValue()).isEqualTo("2021-03-04T12:13:14.000Z");
        assertThat(header.get("trace_id").textValue()).isEqualTo(TRACE_ID);
        assertThat(header.get("trace").textValue()).isEqualTo("{\"a\":1}");
    }

    @Test
    void testEnvelopeHeaderOmitsAbsentFields() {
        assertThat(serializer.envelopeHeader(null, 1_614_859_994_000L, null, null))
            .isEqualTo("{\"sent_at\":\"2021-03-04T12:13:14.000Z\"}");
        assertThat(serializer.envelopeHeader(null, 1_614_859_994_000L, TRACE_ID, null))
            .isEqualTo("{\"sent_at\":\"2021-03-04T12:13:14.000Z\",\"trace_id\":\"" + TRACE_ID + "\"}");
        assertThat(serializer.envelopeHeader(null, 1_614_859_994_000L, null, ""))
            .isEqualTo("{\"sent_at\":\"2021-03-04T12:13:14.000Z\",\"trace\":\"\"}");
    }

    @Test
    void testItemHeader() {
        assertThat(serializer.itemHeader("transaction")).isEqualTo("{\"type\":\"transaction\"}");
    }
}
