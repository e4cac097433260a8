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
import io.tracehub.impl.event.Session;
import io.tracehub.impl.transaction.AbstractSpan;
import io.tracehub.impl.transaction.Transaction;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the active span, the current session and tags which are applied to captured events.
 */
public class Scope {

    static final String TRANSACTION_TAG = "transaction";

    @Nullable
    private AbstractSpan<?> span;
    @Nullable
    private Session session;
    private final Map<String, String> tags = new LinkedHashMap<>();

    public interface Callback {
        void configure(Scope scope);
    }

    @Nullable
    public AbstractSpan<?> getSpan() {
        return span;
    }

    public Scope setSpan(@Nullable AbstractSpan<?> span) {
        this.span = span;
        return this;
    }

    /**
     * @return the transaction of the active span, {@code null} if there is no active span
     */
    @Nullable
    public Transaction getTransaction() {
        final AbstractSpan<?> span = this.span;
        return span != null ? span.getTransaction() : null;
    }

    @Nullable
    public Session getSession() {
        return session;
    }

    public Scope setSession(@Nullable Session session) {
        this.session = session;
        return this;
    }

    public Scope setTag(String key, String value) {
        tags.put(key, value);
        return this;
    }

    public Map<String, String> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public void clear() {
        span = null;
        session = null;
        tags.clear();
    }

    /**
     * Adds the scope's tags and the trace context of the active span to an event.
     * Values which are already set on the event take precedence.
     */
    public void applyToEvent(Event event) {
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (!event.getTags().containsKey(tag.getKey())) {
                event.withTag(tag.getKey(), tag.getValue());
            }
        }
        final AbstractSpan<?> span = this.span;
        if (span != null) {
            if (event.getTraceContext() == null) {
                event.withTraceContext(span);
            }
            final String transactionName = span.getTransaction().getName();
            if (!transactionName.isEmpty() && !event.getTags().containsKey(TRANSACTION_TAG)) {
                event.withTag(TRANSACTION_TAG, transactionName);
            }
        }
    }
}
