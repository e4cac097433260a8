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

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The options a span or transaction is started with.
 * <p>
 * Ids are kept as hex strings as they usually originate from incoming headers.
 * Absent ids are generated when the span is created.
 * </p>
 *
 * @param <T> the concrete type, for fluent setters
 */
public abstract class AbstractSpanContext<T extends AbstractSpanContext<T>> {

    @Nullable
    private String traceId;
    @Nullable
    private String spanId;
    @Nullable
    private String parentSpanId;
    @Nullable
    private Boolean sampled;
    @Nullable
    private String op;
    @Nullable
    private String description;
    @Nullable
    private SpanStatus status;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> data = new LinkedHashMap<>();
    /**
     * Epoch micros, {@code -1} means the span starts when it is created
     */
    private long startTimestamp = -1;

    @SuppressWarnings("unchecked")
    protected T thiz() {
        return (T) this;
    }

    @Nullable
    public String getTraceId() {
        return traceId;
    }

    public T withTraceId(@Nullable String traceId) {
        this.traceId = traceId;
        return thiz();
    }

    @Nullable
    public String getSpanId() {
        return spanId;
    }

    public T withSpanId(@Nullable String spanId) {
        this.spanId = spanId;
        return thiz();
    }

    @Nullable
    public String getParentSpanId() {
        return parentSpanId;
    }

    public T withParentSpanId(@Nullable String parentSpanId) {
        this.parentSpanId = parentSpanId;
        return thiz();
    }

    /**
     * @return the explicitly set sampling decision, {@code null} if the sampler should decide
     */
    @Nullable
    public Boolean getSampled() {
        return sampled;
    }

    public T withSampled(@Nullable Boolean sampled) {
        this.sampled = sampled;
        return thiz();
    }

    @Nullable
    public String getOp() {
        return op;
    }

    public T withOp(@Nullable String op) {
        this.op = op;
        return thiz();
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public T withDescription(@Nullable String description) {
        this.description = description;
        return thiz();
    }

    @Nullable
    public SpanStatus getStatus() {
        return status;
    }

    public T withStatus(@Nullable SpanStatus status) {
        this.status = status;
        return thiz();
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public T withTag(String key, String value) {
        tags.put(key, value);
        return thiz();
    }

    public Map<String, Object> getData() {
        return data;
    }

    public T withData(String key, Object value) {
        data.put(key, value);
        return thiz();
    }

    public long getStartTimestamp() {
        return startTimestamp;
    }

    public T withStartTimestamp(long epochMicros) {
        this.startTimestamp = epochMicros;
        return thiz();
    }
}
