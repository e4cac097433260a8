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

import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.Level;
import io.tracehub.impl.event.Session;
import io.tracehub.impl.event.SessionStatus;
import io.tracehub.impl.sampling.Sampler;
import io.tracehub.impl.sampling.SamplingDecision;
import io.tracehub.impl.sampling.SamplingEnvironment;
import io.tracehub.impl.transaction.AbstractSpan;
import io.tracehub.impl.transaction.SpanRecorder;
import io.tracehub.impl.transaction.Transaction;
import io.tracehub.impl.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;

/**
 * The entry point for capturing data: starts transactions and passes captured events and sessions to the {@link Client}.
 * <p>
 * There is no global hub. Integrations which isolate concurrent requests pass each request its own hub, or at least its
 * own {@link Scope}.
 * </p>
 */
public class Hub {

    private static final Logger logger = LoggerFactory.getLogger(Hub.class);

    @Nullable
    private volatile Client client;
    private final Scope scope = new Scope();
    private final Sampler sampler;
    private final SamplingEnvironment samplingEnvironment;
    private final Clock clock;
    @Nullable
    private String lastEventId;

    public Hub(@Nullable Client client) {
        this(client, new Sampler(), SamplingEnvironment.NONE);
    }

    public Hub(@Nullable Client client, Sampler sampler, SamplingEnvironment samplingEnvironment) {
        this(client, sampler, samplingEnvironment, Clock.systemUTC());
    }

    /**
     * @param clock the wall clock for the timestamps of transactions and sessions
     */
    public Hub(@Nullable Client client, Sampler sampler, SamplingEnvironment samplingEnvironment, Clock clock) {
        this.client = client;
        this.sampler = sampler;
        this.samplingEnvironment = samplingEnvironment;
        this.clock = clock;
    }

    @Nullable
    public Client getClient() {
        return client;
    }

    public void bindClient(@Nullable Client client) {
        this.client = client;
    }

    public Scope getScope() {
        return scope;
    }

    public void configureScope(Scope.Callback callback) {
        callback.configure(scope);
    }

    public Transaction startTransaction(TransactionContext context) {
        return startTransaction(context, Collections.<String, Object>emptyMap());
    }

    /**
     * Starts a new transaction and decides whether it is sampled.
     * <p>
     * The transaction is not set as the active span of the scope, use {@link Scope#setSpan(AbstractSpan)} for that.
     * </p>
     *
     * @param context               the options of the transaction
     * @param customSamplingContext additional data for the {@link io.tracehub.impl.sampling.TracesSampler}
     * @return the new transaction
     */
    public Transaction startTransaction(TransactionContext context, Map<String, Object> customSamplingContext) {
        final Client client = this.client;
        final SamplingDecision decision = sampler.sample(context, client, samplingEnvironment, customSamplingContext);
        final Transaction transaction = new Transaction(context, this, decision, clock);
        if (transaction.isSampled()) {
            transaction.initSpanRecorder(client != null ? client.getOptions().getMaxSpans() : SpanRecorder.DEFAULT_MAX_LEN);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("startTransaction {} {}", transaction, decision);
        }
        return transaction;
    }

    /**
     * Captures an event.
     * Events which are not transactions get the tags and the trace context of the {@link Scope}.
     *
     * @return the id of the captured event, {@code null} if it has not been captured
     */
    @Nullable
    public String captureEvent(Event event) {
        final Client client = this.client;
        if (client == null) {
            logger.debug("Not capturing {} as there is no client", event);
            return null;
        }
        if (!event.isTransaction()) {
            scope.applyToEvent(event);
        }
        final String eventId = client.captureEvent(event);
        if (!event.isTransaction() && eventId != null) {
            lastEventId = eventId;
        }
        return eventId;
    }

    @Nullable
    public String captureMessage(String message, @Nullable Level level) {
        return captureEvent(Event.message(message, level));
    }

    /**
     * @return the id of the last captured event which is not a transaction
     */
    @Nullable
    public String lastEventId() {
        return lastEventId;
    }

    /**
     * Starts a new session and ends the current one, if any.
     */
    public Session startSession() {
        final Client client = this.client;
        final Session session = new Session(clock);
        if (client != null) {
            session.withRelease(client.getOptions().getRelease())
                .withEnvironment(client.getOptions().getEnvironment());
        }
        final Session current = scope.getSession();
        if (current != null && current.getStatus() == SessionStatus.OK) {
            current.withStatus(SessionStatus.EXITED);
        }
        endSession();
        scope.setSession(session);
        return session;
    }

    /**
     * Closes the current session and sends its final state.
     */
    public void endSession() {
        final Session session = scope.getSession();
        if (session != null) {
            session.close(null);
        }
        sendSessionUpdate();
        scope.setSession(null);
    }

    /**
     * Sends the current state of the current session.
     */
    public void captureSession() {
        sendSessionUpdate();
    }

    private void sendSessionUpdate() {
        final Session session = scope.getSession();
        final Client client = this.client;
        if (session != null && client != null) {
            client.captureSession(session);
        }
    }

    /**
     * @return the headers to propagate the active span to a downstream service, empty if there is no active span
     */
    public Map<String, String> getTraceHeaders() {
        final AbstractSpan<?> span = scope.getSpan();
        if (span == null) {
            return Collections.emptyMap();
        }
        return span.getTraceHeaders();
    }
}
