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

import io.tracehub.configuration.CoreConfiguration;
import io.tracehub.impl.sampling.TracesSampler;
import io.tracehub.impl.transaction.SpanRecorder;

import javax.annotation.Nullable;

/**
 * The options of a {@link Client}.
 * <p>
 * The sample rate may be a {@link Number} or a {@link Boolean},
 * and it is only validated when a sampling decision is made.
 * </p>
 */
public class ClientOptions {

    @Nullable
    private String dsn;
    @Nullable
    private volatile Object tracesSampleRate;
    @Nullable
    private TracesSampler tracesSampler;
    @Nullable
    private String environment;
    @Nullable
    private String release;
    private volatile int maxSpans = SpanRecorder.DEFAULT_MAX_LEN;

    public static ClientOptions fromConfiguration(CoreConfiguration configuration) {
        return new ClientOptions()
            .withDsn(configuration.getDsn())
            .withTracesSampleRate(configuration.getTracesSampleRate())
            .withEnvironment(configuration.getEnvironment())
            .withRelease(configuration.getRelease())
            .withMaxSpans(configuration.getMaxSpans());
    }

    /**
     * @return whether a sample rate or a {@link TracesSampler} is configured
     */
    public boolean hasTracingEnabled() {
        return tracesSampleRate != null || tracesSampler != null;
    }

    @Nullable
    public String getDsn() {
        return dsn;
    }

    public ClientOptions withDsn(@Nullable String dsn) {
        this.dsn = dsn;
        return this;
    }

    @Nullable
    public Object getTracesSampleRate() {
        return tracesSampleRate;
    }

    /**
     * @param tracesSampleRate a {@link Number} between 0 and 1 or a {@link Boolean}
     */
    public ClientOptions withTracesSampleRate(@Nullable Object tracesSampleRate) {
        this.tracesSampleRate = tracesSampleRate;
        return this;
    }

    @Nullable
    public TracesSampler getTracesSampler() {
        return tracesSampler;
    }

    public ClientOptions withTracesSampler(@Nullable TracesSampler tracesSampler) {
        this.tracesSampler = tracesSampler;
        return this;
    }

    @Nullable
    public String getEnvironment() {
        return environment;
    }

    public ClientOptions withEnvironment(@Nullable String environment) {
        this.environment = environment;
        return this;
    }

    @Nullable
    public String getRelease() {
        return release;
    }

    public ClientOptions withRelease(@Nullable String release) {
        this.release = release;
        return this;
    }

    public int getMaxSpans() {
        return maxSpans;
    }

    public ClientOptions withMaxSpans(int maxSpans) {
        this.maxSpans = maxSpans;
        return this;
    }
}
