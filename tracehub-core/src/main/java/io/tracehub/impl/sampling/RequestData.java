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
package io.tracehub.impl.sampling;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized data about the incoming server request a transaction is started for.
 */
public class RequestData {

    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> cookies = new LinkedHashMap<>();
    @Nullable
    private String method;
    @Nullable
    private String url;
    @Nullable
    private String queryString;

    public RequestData withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public RequestData withCookie(String name, String value) {
        cookies.put(name, value);
        return this;
    }

    public RequestData withMethod(@Nullable String method) {
        this.method = method;
        return this;
    }

    public RequestData withUrl(@Nullable String url) {
        this.url = url;
        return this;
    }

    public RequestData withQueryString(@Nullable String queryString) {
        this.queryString = queryString;
        return this;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> getCookies() {
        return Collections.unmodifiableMap(cookies);
    }

    @Nullable
    public String getMethod() {
        return method;
    }

    @Nullable
    public String getUrl() {
        return url;
    }

    @Nullable
    public String getQueryString() {
        return queryString;
    }
}
