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

import io.tracehub.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The common base of {@link Transaction}s and {@link Span}s: a timed unit of work with an identity,
 * an optional parent and attached metadata.
 * <p>
 * The sampling decision is made before a span is created and can't be changed afterwards.
 * It is passed on to all children.
 * </p>
 *
 * @param <T> the concrete type, for fluent setters
 */
public abstract class AbstractSpan<T extends AbstractSpan<T>> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSpan.class);
    static final String HTTP_STATUS_CODE_TAG = "http.status_code";

    protected final Id traceId = Id.new128BitId();
    protected final Id spanId = Id.new64BitId();
    protected final Id parentSpanId = Id.new64BitId();
    protected final EpochTickClock clock = new EpochTickClock();
    private final boolean sampled;
    @Nullable
    private String op;
    @Nullable
    private String description;
    @Nullable
    private SpanStatus status;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> data = new LinkedHashMap<>();
    /**
     * Start of the span in microseconds since epoch
     */
    protected long timestamp;
    /**
     * End of the span in microseconds since epoch, only valid once {@link #finished} is set
     */
    protected long endTimestamp;
    private boolean finished;
    @Nullable
    protected SpanRecorder spanRecorder;

    /**
     * Creates the root of a trace or the continuation of a trace started by an upstream service.
     */
    protected AbstractSpan(AbstractSpanContext<?> context, boolean sampled, Clock wallClock) {
        this.sampled = sampled;
        idFromHexOrRandom(traceId, context.getTraceId());
        idFromHexOrRandom(spanId, context.getSpanId());
        final String parentId = context.getParentSpanId();
        if (parentId != null && HexUtils.isLowerCaseHex(parentId, parentSpanId.getHexLength())) {
            parentSpanId.fromHexString(parentId, 0);
        }
        final long now = clock.calibrate(wallClock);
        timestamp = context.getStartTimestamp() >= 0 ? context.getStartTimestamp() : now;
        applyContext(context);
    }

    /**
     * Creates a child of {@code parent}, which shares its trace id, sampling decision and clock.
     */
    protected AbstractSpan(AbstractSpanContext<?> context, AbstractSpan<?> parent) {
        this.sampled = parent.sampled;
        traceId.copyFrom(parent.traceId);
        idFromHexOrRandom(spanId, context.getSpanId());
        parentSpanId.copyFrom(parent.spanId);
        clock.alignWith(parent.clock);
        timestamp = context.getStartTimestamp() >= 0 ? context.getStartTimestamp() : clock.getEpochMicros();
        applyContext(context);
    }

    private void applyContext(AbstractSpanContext<?> context) {
        op = context.getOp();
        description = context.getDescription();
        status = context.getStatus();
        tags.putAll(context.getTags());
        data.putAll(context.getData());
    }

    private static void idFromHexOrRandom(Id id, @Nullable String hex) {
        if (hex != null) {
            if (HexUtils.isLowerCaseHex(hex, id.getHexLength())) {
                id.fromHexString(hex, 0);
                if (!id.isEmpty()) {
                    return;
                }
            }
            logger.debug("Ignoring invalid id {}, generating a new one", hex);
        }
        id.setToRandomValue();
    }

    /**
     * Starts a child span.
     * <p>
     * This is also possible after this span has been finished.
     * The child is recorded by the transaction's {@link SpanRecorder}, unless the recorder's limit has been reached.
     * </p>
     *
     * @param context the options of the child
     * @return the new child
     */
    public Span startChild(SpanContext context) {
        final Span child = new Span(context, this);
        final SpanRecorder recorder = spanRecorder;
        if (recorder != null) {
            child.spanRecorder = recorder;
            recorder.add(child);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("startChild {} of {}", child, this);
        }
        return child;
    }

    public Span startChild() {
        return startChild(new SpanContext());
    }

    /**
     * Marks this span as finished.
     *
     * @param epochMicros the end timestamp
     * @return {@code false} if the span has already been finished before
     */
    protected boolean markFinished(long epochMicros) {
        if (finished) {
            logger.debug("{} has already been finished", this);
            return false;
        }
        endTimestamp = epochMicros;
        finished = true;
        return true;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * @return the value of the {@code sentry-trace} header to propagate this span to a downstream service
     */
    public String toTraceparent() {
        return TraceParent.format(traceId, spanId, sampled);
    }

    /**
     * @return the headers to propagate this span to a downstream service
     */
    public Map<String, String> getTraceHeaders() {
        final Map<String, String> headers = new LinkedHashMap<>();
        headers.put(TraceParent.HEADER_NAME, toTraceparent());
        final String tracestate = getTransaction().getTracestate();
        if (tracestate != null && !tracestate.isEmpty()) {
            headers.put(TraceState.HEADER_NAME, TraceState.toHeaderValue(tracestate));
        }
        return headers;
    }

    /**
     * @return the transaction this span belongs to, the transaction itself for a {@link Transaction}
     */
    public abstract Transaction getTransaction();

    public T setTag(String key, String value) {
        tags.put(key, value);
        return thiz();
    }

    public T setData(String key, Object value) {
        data.put(key, value);
        return thiz();
    }

    public T setStatus(@Nullable SpanStatus status) {
        this.status = status;
        return thiz();
    }

    /**
     * Sets the {@code http.status_code} tag and derives the status from the HTTP status code
     */
    public T setHttpStatus(int httpStatus) {
        setTag(HTTP_STATUS_CODE_TAG, Integer.toString(httpStatus));
        final SpanStatus spanStatus = SpanStatus.fromHttpCode(httpStatus);
        if (spanStatus != SpanStatus.UNKNOWN_ERROR) {
            setStatus(spanStatus);
        }
        return thiz();
    }

    public boolean isSuccess() {
        return status == SpanStatus.OK;
    }

    public T setOp(@Nullable String op) {
        this.op = op;
        return thiz();
    }

    public T setDescription(@Nullable String description) {
        this.description = description;
        return thiz();
    }

    @SuppressWarnings("unchecked")
    protected T thiz() {
        return (T) this;
    }

    void clearSpanRecorder() {
        spanRecorder = null;
    }

    @Nullable
    SpanRecorder getSpanRecorder() {
        return spanRecorder;
    }

    public Id getTraceId() {
        return traceId;
    }

    public Id getSpanId() {
        return spanId;
    }

    /**
     * @return the id of the parent, {@link Id#isEmpty() empty} for the root of a trace
     */
    public Id getParentSpanId() {
        return parentSpanId;
    }

    public boolean isSampled() {
        return sampled;
    }

    @Nullable
    public String getOp() {
        return op;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    @Nullable
    public SpanStatus getStatus() {
        return status;
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * @return the start of this span in microseconds since epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * @return the end of this span in microseconds since epoch, {@code -1} if it has not been finished yet
     */
    public long getEndTimestamp() {
        return finished ? endTimestamp : -1;
    }
}
