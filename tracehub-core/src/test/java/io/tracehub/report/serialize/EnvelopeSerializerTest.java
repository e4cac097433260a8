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
import io.tracehub.impl.Dsn;
import io.tracehub.impl.Hub;
import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.EventType;
import io.tracehub.impl.event.Level;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.sampling.SamplingDecision;
import io.tracehub.impl.sampling.SamplingMethod;
import io.tracehub.impl.transaction.TraceState;
import io.tracehub.impl.transaction.Transaction;
import io.tracehub.impl.transaction.TransactionContext;
import io.tracehub.report.ApiEndpoints;
import io.tracehub.report.RequestType;
import io.tracehub.report.TransportRequest;
import io.tracehub.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeSerializerTest {

    private static final String TRACE_ID = "12312012123120121231201212312012";
    private static final String EVENT_ID = "0123456789abcdef0123456789abcdef";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EnvelopeSerializer envelopeSerializer;
    private Transaction transaction;

    @BeforeEach
    void setUp() {
        envelopeSerializer = new EnvelopeSerializer(new ApiEndpoints(Dsn.parse("https://abc@example.com/42")),
            Clock.fixed(Instant.ofEpochMilli(1_614_859_994_000L), ZoneOffset.UTC));
        transaction = new Transaction(TransactionContext.create("GET /dogs").withTraceId(TRACE_ID), new Hub(null),
            SamplingDecision.of(true, SamplingMethod.EXPLICITLY_SET));
    }

    private Event transactionEvent(String tracestate) {
        return new Event(EventType.TRANSACTION)
            .withEventId(EVENT_ID)
            .withTraceContext(transaction)
            .withTransaction("GET /dogs")
            .withTracestate(tracestate);
    }

    @Test
    void testTransactionEnvelope() throws Exception {
        String tracestate = TraceState.encode(TRACE_ID, "abc", "production", "1.0");

        TransportRequest request = envelopeSerializer.toRequest(transactionEvent(tracestate));

        assertThat(request.getType()).isEqualTo(RequestType.TRANSACTION);
        assertThat(request.getUrl()).isEqualTo("https://example.com/api/42/envelope/?sentry_key=abc&sentry_version=7");
        assertThat(request.getBody()).doesNotEndWith("\n");
        String[] lines = request.getBody().split("\n", -1);
        assertThat(lines).hasSize(3);

        JsonNode header = objectMapper.readTree(lines[0]);
        assertThat(header.get("event_id").textValue()).isEqualTo(EVENT_ID);
        assertThat(header.get("sent_at").textValue()).isEqualTo("2021-03-04T12:13:14.000Z");
        assertThat(header.get("trace_id").textValue()).isEqualTo(TRACE_ID);
        assertThat(header.get("trace").textValue())
            .isEqualTo("{\"trace_id\":\"" + TRACE_ID + "\",\"public_key\":\"abc\",\"environment\":\"production\",\"release\":\"1.0\"}");

        assertThat(lines[1]).isEqualTo("{\"type\":\"transaction\"}");

        JsonNode body = objectMapper.readTree(lines[2]);
        assertThat(body.get("event_id").textValue()).isEqualTo(EVENT_ID);
        assertThat(body.get("transaction").textValue()).isEqualTo("GET /dogs");
        assertThat(body.has("tracestate")).isFalse();
    }

    @Test
    void testUndecodableTracestateLeadsToEmptyTrace() throws Exception {
        TransportRequest request = envelopeSerializer.toRequest(transactionEvent("a"));

        JsonNode header = objectMapper.readTree(request.getBody().split("\n")[0]);
        assertThat(header.get("trace").textValue()).isEmpty();
        assertThat(header.get("trace_id").textValue()).isEqualTo(TRACE_ID);
    }

    @Test
    void testTraceIsOmittedWithoutTracestate() throws Exception {
        TransportRequest request = envelopeSerializer.toRequest(transactionEvent(null));

        JsonNode header = objectMapper.readTree(request.getBody().split("\n")[0]);
        assertThat(header.has("trace")).isFalse();
        assertThat(header.get("trace_id").textValue()).isEqualTo(TRACE_ID);
    }

    @Test
    void testSessionEnvelope() throws Exception {
        Session session = new Session(new MutableClock(1_614_859_990_000L)).withRelease("1.0");

        TransportRequest request = envelopeSerializer.sessionToRequest(session);

        assertThat(request.getType()).isEqualTo(RequestType.SESSION);
        assertThat(request.getUrl()).isEqualTo("https://example.com/api/42/envelope/?sentry_key=abc&sentry_version=7");
        String[] lines = request.getBody().split("\n", -1);
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("{\"sent_at\":\"2021-03-04T12:13:14.000Z\"}");
        assertThat(lines[1]).isEqualTo("{\"type\":\"session\"}");
        assertThat(objectMapper.readTree(lines[2]).get("sid").textValue()).isEqualTo(session.getSid());
    }

    @Test
    void testOtherEventsAreSentAsFlatJson() throws Exception {
        Event event = Event.message("Woof", Level.INFO).withEventId(EVENT_ID).withTracestate("abc.");

        TransportRequest request = envelopeSerializer.toRequest(event);

        assertThat(request.getType()).isEqualTo(RequestType.EVENT);
        assertThat(request.getUrl()).isEqualTo("https://example.com/api/42/store/?sentry_key=abc&sentry_version=7");
        assertThat(request.getBody()).doesNotContain("\n");
        JsonNode body = objectMapper.readTree(request.getBody());
        assertThat(body.get("event_id").textValue()).isEqualTo(EVENT_ID);
        assertThat(body.get("message").textValue()).isEqualTo("Woof");
    }
}
