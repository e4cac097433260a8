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
package io.tracehub.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.Level;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.event.SessionStatus;
import io.tracehub.impl.sampling.FixedRandom;
import io.tracehub.impl.sampling.RequestData;
import io.tracehub.impl.sampling.Sampler;
import io.tracehub.impl.sampling.SamplingContext;
import io.tracehub.impl.sampling.SamplingEnvironment;
import io.tracehub.impl.sampling.SamplingMethod;
import io.tracehub.impl.sampling.TracesSampler;
import io.tracehub.impl.transaction.Span;
import io.tracehub.impl.transaction.TraceState;
import io.tracehub.impl.transaction.Transaction;
import io.tracehub.impl.transaction.TransactionContext;
import io.tracehub.report.MockTransport;
import io.tracehub.report.RequestType;
import io.tracehub.report.TransportRequest;
import io.tracehub.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HubTest {

    private static final String DSN = "https://dogsarebadatkeepingsecrets@squirrelchasers.ingest.example.io/12312012";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockTransport transport;
    private ClientOptions options;
    private FixedRandom random;
    private Hub hub;

    @BeforeEach
    void setUp() {
        transport = new MockTransport();
        options = new ClientOptions().withDsn(DSN).withEnvironment("dogpark").withRelease("off.leash.park");
        random = new FixedRandom(0.5);
        hub = new Hub(new DefaultClient(options, transport), new Sampler(random), SamplingEnvironment.NONE);
    }

    private String[] envelopeLines(TransportRequest request) {
        return request.getBody().split("\n", -1);
    }

    @Test
    void testSampledTransactionIsSentAsEnvelope() throws Exception {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        Span span = transaction.startChild().setOp("db");
        span.finish();

        String eventId = transaction.finish();

        assertThat(eventId).isNotNull();
        TransportRequest request = transport.getFirstRequest(RequestType.TRANSACTION);
        assertThat(request.getUrl()).endsWith("/api/12312012/envelope/?sentry_key=dogsarebadatkeepingsecrets&sentry_version=7");
        String[] lines = envelopeLines(request);
        assertThat(lines).hasSize(3);

        JsonNode header = objectMapper.readTree(lines[0]);
        assertThat(header.get("event_id").textValue()).isEqualTo(eventId);
        assertThat(header.get("trace_id").textValue()).isEqualTo(transaction.getTraceId().toString());
        JsonNode trace = objectMapper.readTree(header.get("trace").textValue());
        assertThat(trace.get("trace_id").textValue()).isEqualTo(transaction.getTraceId().toString());
        assertThat(trace.get("public_key").textValue()).isEqualTo("dogsarebadatkeepingsecrets");
        assertThat(trace.get("environment").textValue()).isEqualTo("dogpark");
        assertThat(trace.get("release").textValue()).isEqualTo("off.leash.park");

        assertThat(objectMapper.readTree(lines[1]).get("type").textValue()).isEqualTo("transaction");

        JsonNode body = objectMapper.readTree(lines[2]);
        assertThat(body.get("type").textValue()).isEqualTo("transaction");
        assertThat(body.get("transaction").textValue()).isEqualTo("FETCH /ball");
        assertThat(body.has("tracestate")).isFalse();
        assertThat(body.get("contexts").get("trace").get("span_id").textValue()).isEqualTo(transaction.getSpanId().toString());
        assertThat(body.get("spans")).hasSize(1);
        assertThat(body.get("spans").get(0).get("op").textValue()).isEqualTo("db");
        assertThat(body.get("spans").get(0).get("parent_span_id").textValue()).isEqualTo(transaction.getSpanId().toString());
    }

    @Test
    void testUnsampledTransactionIsNotSent() {
        options.withTracesSampleRate(0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        transaction.startChild().finish();

        assertThat(transaction.isSampled()).isFalse();
        assertThat(transaction.finish()).isNull();
        assertThat(transport.getRequests()).isEmpty();
    }

    @Test
    void testTracingDisabledWithoutSampleRate() {
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));

        assertThat(transaction.isSampled()).isFalse();
        assertThat(transaction.getSamplingDecision().getMethod()).isEqualTo(SamplingMethod.TRACING_DISABLED);
    }

    @Test
    void testFinishingTwiceSendsOnce() {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));

        transaction.finish();
        transaction.finish();

        assertThat(transport.getRequests(RequestType.TRANSACTION)).hasSize(1);
    }

    @Test
    void testContinuedTraceInheritsParentDecision() {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.fromHeaders(
            "12312012123120121231201212312012-1121201211212012-0", "sentry=doGsaREgReaT"));

        assertThat(transaction.isSampled()).isFalse();
        assertThat(transaction.getSamplingDecision().getMethod()).isEqualTo(SamplingMethod.INHERITANCE);
        assertThat(transaction.getTraceId().toString()).isEqualTo("12312012123120121231201212312012");
        assertThat(transaction.getParentSpanId().toString()).isEqualTo("1121201211212012");
        assertThat(transaction.getTracestate()).isEqualTo("doGsaREgReaT");
        assertThat(transaction.toTraceparent()).startsWith("12312012123120121231201212312012-").endsWith("-0");
    }

    @Test
    void testTracestateIsCreatedForNewTrace() throws Exception {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));

        assertThat(transaction.getTracestate()).isEqualTo(TraceState.encode(transaction.getTraceId().toString(),
            "dogsarebadatkeepingsecrets", "dogpark", "off.leash.park"));
    }

    @Test
    void testInvalidTracestateLeadsToEmptyTraceInEnvelope() throws Exception {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball").withTracestate("!!!"));

        transaction.finish();

        JsonNode header = objectMapper.readTree(envelopeLines(transport.getFirstRequest(RequestType.TRANSACTION))[0]);
        assertThat(header.get("trace").textValue()).isEmpty();
    }

    @Test
    void testSamplingContextIsPassedToTracesSampler() {
        TracesSampler tracesSampler = mock(TracesSampler.class);
        when(tracesSampler.sample(any())).thenReturn(true);
        options.withTracesSampler(tracesSampler);
        final RequestData request = new RequestData().withMethod("GET").withUrl("http://dogs.are.great/tricks/kangaroo")
            .withHeader("dogs", "are great");
        hub = new Hub(new DefaultClient(options, transport), new Sampler(random), new SamplingEnvironment() {
            @Override
            public RequestData getRequest() {
                return request;
            }

            @Override
            public Map<String, String> getLocation() {
                return null;
            }
        });

        Transaction transaction = hub.startTransaction(TransactionContext.create("GET /tricks/kangaroo"),
            Collections.<String, Object>singletonMap("dog", "Maisey"));

        assertThat(transaction.isSampled()).isTrue();
        ArgumentCaptor<SamplingContext> captor = ArgumentCaptor.forClass(SamplingContext.class);
        verify(tracesSampler).sample(captor.capture());
        assertThat(captor.getValue().getRequest().getHeaders()).containsEntry("dogs", "are great");
        assertThat(captor.getValue().getLocation()).isNull();
        assertThat(captor.getValue().get("dog")).isEqualTo("Maisey");
    }

    @Test
    void testMaxSpans() throws Exception {
        options.withTracesSampleRate(1.0).withMaxSpans(2);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        for (int i = 0; i < 3; i++) {
            transaction.startChild().finish();
        }

        transaction.finish();

        assertThat(transaction.getDroppedSpans()).isEqualTo(1);
        JsonNode body = objectMapper.readTree(envelopeLines(transport.getFirstRequest(RequestType.TRANSACTION))[2]);
        assertThat(body.get("spans")).hasSize(2);
    }

    @Test
    void testLastEventIdIgnoresTransactions() {
        options.withTracesSampleRate(1.0);
        String messageId = hub.captureMessage("Woof", Level.INFO);
        hub.startTransaction(TransactionContext.create("FETCH /ball")).finish();

        assertThat(messageId).isNotNull();
        assertThat(hub.lastEventId()).isEqualTo(messageId);
    }

    @Test
    void testCaptureWithoutClient() {
        Hub noClient = new Hub(null);

        assertThat(noClient.captureMessage("Woof", null)).isNull();
        assertThat(noClient.lastEventId()).isNull();
        assertThat(noClient.startTransaction(TransactionContext.create("FETCH /ball")).isSampled()).isFalse();
    }

    @Test
    void testScopeIsAppliedToEvents() throws Exception {
        options.withTracesSampleRate(1.0);
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        hub.configureScope(scope -> scope.setSpan(transaction).setTag("dog", "Charlie"));

        hub.captureEvent(Event.message("Woof", null));

        JsonNode body = objectMapper.readTree(transport.getFirstRequest(RequestType.EVENT).getBody());
        assertThat(body.get("tags").get("dog").textValue()).isEqualTo("Charlie");
        assertThat(body.get("tags").get("transaction").textValue()).isEqualTo("FETCH /ball");
        assertThat(body.get("contexts").get("trace").get("trace_id").textValue()).isEqualTo(transaction.getTraceId().toString());
    }

    @Test
    void testTraceHeaders() {
        options.withTracesSampleRate(1.0);
        assertThat(hub.getTraceHeaders()).isEmpty();

        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        Span span = transaction.startChild();
        hub.getScope().setSpan(span);

        Map<String, String> headers = hub.getTraceHeaders();
        assertThat(headers.get("sentry-trace")).isEqualTo(transaction.getTraceId() + "-" + span.getSpanId() + "-1");
        assertThat(headers.get("tracestate")).isEqualTo("sentry=" + transaction.getTracestate());
    }

    @Test
    void testStartSessionEndsPreviousSession() throws Exception {
        Session first = hub.startSession();
        assertThat(first.getRelease()).isEqualTo("off.leash.park");
        assertThat(first.getEnvironment()).isEqualTo("dogpark");

        Session second = hub.startSession();

        assertThat(first.getStatus()).isEqualTo(SessionStatus.EXITED);
        assertThat(second.getStatus()).isEqualTo(SessionStatus.OK);
        assertThat(hub.getScope().getSession()).isSameAs(second);
        assertThat(transport.getRequests(RequestType.SESSION)).hasSize(1);
        JsonNode body = objectMapper.readTree(envelopeLines(transport.getFirstRequest(RequestType.SESSION))[2]);
        assertThat(body.get("sid").textValue()).isEqualTo(first.getSid());
        assertThat(body.get("status").textValue()).isEqualTo("exited");
    }

    @Test
    void testEndSessionKeepsFinalStatus() {
        Session session = hub.startSession();
        session.withStatus(SessionStatus.CRASHED);
        hub.captureSession();

        hub.endSession();

        assertThat(session.getStatus()).isEqualTo(SessionStatus.CRASHED);
        assertThat(hub.getScope().getSession()).isNull();
        assertThat(transport.getRequests(RequestType.SESSION)).hasSize(2);
    }

    @Test
    void testSessionsAndTransactionsReadTheHubClock() {
        MutableClock clock = new MutableClock(1_614_859_990_000L);
        options.withTracesSampleRate(1.0);
        hub = new Hub(new DefaultClient(options, transport, clock), new Sampler(random), SamplingEnvironment.NONE, clock);

        Session session = hub.startSession();
        Transaction transaction = hub.startTransaction(TransactionContext.create("FETCH /ball"));
        clock.advanceMillis(2_000);
        hub.endSession();

        assertThat(session.getStarted()).isEqualTo(1_614_859_990_000L);
        assertThat(session.getTimestamp()).isEqualTo(1_614_859_992_000L);
        assertThat(session.getDuration()).isEqualTo(2.0);
        assertThat(transaction.getTimestamp()).isEqualTo(1_614_859_990_000_000L);
    }
}
