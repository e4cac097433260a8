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
package io.tracehub.report;

import io.tracehub.impl.Dsn;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Derives the URLs events are sent to from a {@link Dsn}.
 */
public class ApiEndpoints {

    static final String PROTOCOL_VERSION = "7";

    private final Dsn dsn;

    public ApiEndpoints(Dsn dsn) {
        this.dsn = dsn;
    }

    public Dsn getDsn() {
        return dsn;
    }

    /**
     * @return for example {@code https://example.com:8080/some/path/api/}
     */
    public String getBaseApiEndpoint() {
        final StringBuilder sb = new StringBuilder();
        sb.append(dsn.getProtocol()).append("://").append(dsn.getHost());
        if (dsn.getPort() != null) {
            sb.append(':').append(dsn.getPort());
        }
        if (!dsn.getPath().isEmpty()) {
            sb.append('/').append(dsn.getPath());
        }
        return sb.append("/api/").toString();
    }

    /**
     * @return the endpoint for flat JSON events
     */
    public String getStoreEndpoint() {
        return getBaseApiEndpoint() + dsn.getProjectId() + "/store/";
    }

    /**
     * @return the endpoint for envelopes (transactions and sessions)
     */
    public String getEnvelopeEndpoint() {
        return getBaseApiEndpoint() + dsn.getProjectId() + "/envelope/";
    }

    public String getStoreEndpointWithUrlEncodedAuth() {
        return getStoreEndpoint() + "?" + getAuthQuery();
    }

    public String getEnvelopeEndpointWithUrlEncodedAuth() {
        return getEnvelopeEndpoint() + "?" + getAuthQuery();
    }

    private String getAuthQuery() {
        return "sentry_key=" + URLEncoder.encode(dsn.getPublicKey(), StandardCharsets.UTF_8)
            + "&sentry_version=" + PROTOCOL_VERSION;
    }
}
