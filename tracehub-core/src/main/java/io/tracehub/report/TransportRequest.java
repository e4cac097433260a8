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

/**
 * A serialized payload, ready to be sent.
 */
public class TransportRequest {

    private final String body;
    private final RequestType type;
    private final String url;

    public TransportRequest(String body, RequestType type, String url) {
        this.body = body;
        this.type = type;
        this.url = url;
    }

    /**
     * @return either a flat JSON document or a newline delimited envelope
     */
    public String getBody() {
        return body;
    }

    public RequestType getType() {
        return type;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String toString() {
        return type.getValue() + " request to " + url;
    }
}
