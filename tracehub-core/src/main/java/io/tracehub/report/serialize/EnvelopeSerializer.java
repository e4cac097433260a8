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

import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.transaction.AbstractSpan;
import io.tracehub.impl.transaction.TraceState;
import io.tracehub.impl.transaction.TraceStateEncodingException;
import io.tracehub.report.ApiEndpoints;
import io.tracehub.report.RequestType;
import io.tracehub.report.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;

/**
 * Turns events and sessions into {@link TransportRequest}s.
 * <p>
 * Transactions and sessions are sent as envelopes: newline delimited JSON documents
 * consisting of an envelope header, an item header and the item itself, without a trailing newline.
 * All other events are sent as a single JSON document to the store endpoint.
 * </p>
 */
public class EnvelopeSerializer {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeSerializer.class);
    private static final char NEW_LINE = '\n';

    private final ApiEndpoints endpoints;
    private final Clock clock;
    private final DslJsonSerializer serializer = new DslJsonSerializer();

    public EnvelopeSerializer(ApiEndpoints endpoints) {
        this(endpoints, Clock.systemUTC());
    }

    public EnvelopeSerializer(ApiEndpoints endpoints, Clock clock) {
        this.endpoints = endpoints;
        this.clock = clock;
    }

    // the DslJsonSerializer is not thread safe
    public synchronized TransportRequest toRequest(Event event) {
        if (event.isTransaction()) {
            return transactionToRequest(event);
        }
        return eventToRequest(event);
    }

    public synchronized TransportRequest eventToRequest(Event event) {
        return new TransportRequest(serializer.toJsonString(event), RequestType.EVENT,
            endpoints.getStoreEndpointWithUrlEncodedAuth());
    }

    /**
     * The tracestate of the transaction is moved from the body to the envelope header,
     * where it is sent in its decoded form so that the server can use it for dynamic sampling.
     */
    public synchronized TransportRequest transactionToRequest(Event event) {
        final AbstractSpan<?> traceContext = event.getTraceContext();
        final String header = serializer.envelopeHeader(event.getEventId(), clock.millis(),
            traceContext != null ? traceContext.getTraceId().toString() : null,
            decodeTracestate(event.getTracestate()));
        final String itemHeader = serializer.itemHeader(RequestType.TRANSACTION.getValue());
        final String body = serializer.toJsonString(event, false);
        return new TransportRequest(header + NEW_LINE + itemHeader + NEW_LINE + body, RequestType.TRANSACTION,
            endpoints.getEnvelopeEndpointWithUrlEncodedAuth());
    }

    public synchronized TransportRequest sessionToRequest(Session session) {
        final String header = serializer.envelopeHeader(null, clock.millis(), null, null);
        final String itemHeader = serializer.itemHeader(RequestType.SESSION.getValue());
        final String body = serializer.toJsonString(session);
        return new TransportRequest(header + NEW_LINE + itemHeader + NEW_LINE + body, RequestType.SESSION,
            endpoints.getEnvelopeEndpointWithUrlEncodedAuth());
    }

    /**
     * @return the decoded tracestate JSON,
     * {@code null} if there is no tracestate and the empty string if it can't be decoded
     */
    @Nullable
    private static String decodeTracestate(@Nullable String tracestate) {
        if (tracestate == null || tracestate.isEmpty()) {
            return null;
        }
        try {
            return TraceState.decode(tracestate);
        } catch (TraceStateEncodingException e) {
            logger.warn("Could not decode tracestate {}", tracestate, e);
            return "";
        }
    }
}
