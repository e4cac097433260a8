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

import io.tracehub.impl.Hub;
import io.tracehub.impl.event.Event;
import io.tracehub.impl.event.EventType;
import io.tracehub.impl.sampling.SamplingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The root span of a trace within one service.
 * <p>
 * When a sampled transaction is {@link #finish() finished}, it is sent to the {@link Hub}
 * together with all of its finished children.
 * </p>
 */
public class Transaction extends AbstractSpan<Transaction> {

    static final String UNLABELED_TRANSACTION = "<unlabeled transaction>";
    private static final Logger logger = LoggerFactory.getLogger(Transaction.class);

    private final Hub hub;
    private final SamplingDecision samplingDecision;
    /**
     * Computed once when the transaction is created, {@code null} if propagation is disabled
     */
    @Nullable
    private final String tracestate;
    private final boolean trimEnd;
    private String name;
    private final Map<String, Measurement> measurements = new LinkedHashMap<>();

    /**
     * Use {@link Hub#startTransaction(TransactionContext)} to create transactions.
     */
    public Transaction(TransactionContext context, Hub hub, SamplingDecision samplingDecision) {
        this(context, hub, samplingDecision, Clock.systemUTC());
    }

    public Transaction(TransactionContext context, Hub hub, SamplingDecision samplingDecision, Clock wallClock) {
        super(context, samplingDecision.isSampled(), wallClock);
        this.hub = hub;
        this.samplingDecision = samplingDecision;
        this.name = context.getName();
        this.trimEnd = context.isTrimEnd();
        final String inherited = context.getTracestate();
        this.tracestate = inherited != null ? inherited : TraceState.createValue(traceId, hub.getClient());
    }

    /**
     * Creates the recorder which collects the children of this transaction.
     * Calling this method more than once has no effect.
     *
     * @param maxLen the maximum number of children to record
     */
    public void initSpanRecorder(int maxLen) {
        if (spanRecorder == null) {
            spanRecorder = new SpanRecorder(maxLen);
            spanRecorder.add(this);
        }
    }

    public void initSpanRecorder() {
        initSpanRecorder(SpanRecorder.DEFAULT_MAX_LEN);
    }

    @Nullable
    public String finish() {
        return finish(clock.getEpochMicros());
    }

    /**
     * Finishes this transaction and, if it is sampled, sends it to the hub.
     *
     * @param epochMicros the end timestamp in microseconds since epoch
     * @return the id of the captured event,
     * {@code null} if the transaction has already been finished, is not sampled, or has not been captured
     */
    @Nullable
    public String finish(long epochMicros) {
        if (isFinished()) {
            logger.debug("Transaction {} has already been finished", this);
            return null;
        }
        if (name.isEmpty()) {
            logger.warn("Transaction has no name, falling back to `{}`.", UNLABELED_TRANSACTION);
            name = UNLABELED_TRANSACTION;
        }
        markFinished(epochMicros);

        if (!isSampled()) {
            logger.debug("Discarding transaction because its trace was not chosen to be sampled.");
            return null;
        }

        final List<Span> finishedSpans = getFinishedSpans();
        if (trimEnd && !finishedSpans.isEmpty()) {
            long latestEnd = Long.MIN_VALUE;
            for (Span span : finishedSpans) {
                latestEnd = Math.max(latestEnd, span.getEndTimestamp());
            }
            endTimestamp = latestEnd;
        }

        final Event event = new Event(EventType.TRANSACTION)
            .withTraceContext(this)
            .withStartTimestamp(timestamp)
            .withTimestamp(endTimestamp)
            .withTracestate(tracestate)
            .withTransaction(name);
        event.getSpans().addAll(finishedSpans);
        event.getTags().putAll(getTags());
        if (!measurements.isEmpty()) {
            logger.debug("Measurements {}", measurements);
            event.getMeasurements().putAll(measurements);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("finish {} with {} spans", this, finishedSpans.size());
        }
        return hub.captureEvent(event);
    }

    private List<Span> getFinishedSpans() {
        final SpanRecorder recorder = spanRecorder;
        if (recorder == null) {
            return Collections.emptyList();
        }
        final List<Span> finishedSpans = new ArrayList<>();
        for (AbstractSpan<?> span : recorder.getSpans()) {
            if (span != this && span.isFinished() && span instanceof Span) {
                finishedSpans.add((Span) span);
            }
        }
        return finishedSpans;
    }

    @Override
    public Transaction getTransaction() {
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * @param name the new name, {@code null} is treated like an empty name
     */
    public Transaction setName(@Nullable String name) {
        this.name = name != null ? name : "";
        return this;
    }

    public Transaction setMeasurement(String name, double value, @Nullable String unit) {
        measurements.put(name, new Measurement(value, unit));
        return this;
    }

    /**
     * Replaces all measurements of this transaction
     */
    public Transaction setMeasurements(Map<String, Measurement> measurements) {
        this.measurements.clear();
        this.measurements.putAll(measurements);
        return this;
    }

    public Map<String, Measurement> getMeasurements() {
        return Collections.unmodifiableMap(measurements);
    }

    @Nullable
    public String getTracestate() {
        return tracestate;
    }

    public SamplingDecision getSamplingDecision() {
        return samplingDecision;
    }

    public boolean isTrimEnd() {
        return trimEnd;
    }

    /**
     * @return the number of children which have not been recorded because the span limit has been reached
     */
    public int getDroppedSpans() {
        return spanRecorder != null ? spanRecorder.getDropped() : 0;
    }

    @Override
    public String toString() {
        return String.format("'%s' %s (%s)", name, spanId, Integer.toHexString(System.identityHashCode(this)));
    }
}
