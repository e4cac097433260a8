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

/**
 * Options for a new {@link Transaction}, see {@link io.tracehub.impl.Hub#startTransaction(TransactionContext)}.
 */
public class TransactionContext extends AbstractSpanContext<TransactionContext> {

    private String name = "";
    @Nullable
    private Boolean parentSampled;
    @Nullable
    private String tracestate;
    private boolean trimEnd;

    public static TransactionContext create(String name) {
        return new TransactionContext().withName(name);
    }

    /**
     * Continues a trace started by an upstream service.
     *
     * @param traceparent the value of the {@code sentry-trace} header, may be {@code null} or malformed
     * @return a context continuing the upstream trace, or a fresh context if the header could not be parsed
     */
    public static TransactionContext fromTraceparent(@Nullable String traceparent) {
        return fromHeaders(traceparent, null);
    }

    /**
     * Continues a trace started by an upstream service.
     *
     * @param traceparent      the value of the {@code sentry-trace} header, may be {@code null} or malformed
     * @param tracestateHeader the value of the {@code tracestate} header, may be {@code null}
     * @return a context continuing the upstream trace, or a fresh context if the trace-parent could not be parsed
     */
    public static TransactionContext fromHeaders(@Nullable String traceparent, @Nullable String tracestateHeader) {
        final TransactionContext context = new TransactionContext();
        final TraceParent parent = traceparent != null ? TraceParent.extract(traceparent) : null;
        if (parent != null) {
            context.withTraceId(parent.getTraceId())
                .withParentSpanId(parent.getParentSpanId())
                .withParentSampled(parent.getParentSampled());
            if (tracestateHeader != null) {
                context.withTracestate(TraceState.extractFromHeader(tracestateHeader));
            }
        }
        return context;
    }

    public String getName() {
        return name;
    }

    public TransactionContext withName(@Nullable String name) {
        this.name = name != null ? name : "";
        return this;
    }

    /**
     * @return the sampling decision of the upstream caller, {@code null} if it did not make one
     */
    @Nullable
    public Boolean getParentSampled() {
        return parentSampled;
    }

    public TransactionContext withParentSampled(@Nullable Boolean parentSampled) {
        this.parentSampled = parentSampled;
        return this;
    }

    /**
     * @return an inherited tracestate value which is reused instead of computing a new one
     */
    @Nullable
    public String getTracestate() {
        return tracestate;
    }

    public TransactionContext withTracestate(@Nullable String tracestate) {
        this.tracestate = tracestate;
        return this;
    }

    public boolean isTrimEnd() {
        return trimEnd;
    }

    /**
     * @param trimEnd whether the end of the transaction should be set to the end of its latest finished child
     */
    public TransactionContext withTrimEnd(boolean trimEnd) {
        this.trimEnd = trimEnd;
        return this;
    }
}
