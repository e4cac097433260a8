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
package io.tracehub.impl.event;

import io.tracehub.impl.transaction.AbstractSpan;
import io.tracehub.impl.transaction.Measurement;
import io.tracehub.impl.transaction.Span;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data captured by the hub, either a message or a finished {@link io.tracehub.impl.transaction.Transaction}.
 * <p>
 * Timestamps are in microseconds since epoch, {@code -1} if not set.
 * </p>
 */
public class Event {

    public static final String PLATFORM = "java";

    private final EventType type;
    @Nullable
    private String eventId;
    @Nullable
    private String message;
    @Nullable
    private Level level;
    private long timestamp = -1;
    private long startTimestamp = -1;
    private final Map<String, String> tags = new LinkedHashMap<>();
    /**
     * The span whose ids make up the trace context of this event
     */
    @Nullable
    private AbstractSpan<?> traceContext;
    private final List<Span> spans = new ArrayList<>();
    @Nullable
    private String transaction;
    @Nullable
    private String tracestate;
    private final Map<String, Measurement> measurements = new LinkedHashMap<>();
    @Nullable
    private String environment;
    @Nullable
    private String release;
    @Nullable
    private String platform;

    public Event() {
        this(EventType.EVENT);
    }

    public Event(EventType type) {
        this.type = type;
    }

    public static Event message(String message, @Nullable Level level) {
        final Event event = new Event();
        event.message = message;
        event.level = level;
        return event;
    }

    public EventType getType() {
        return type;
    }

    public boolean isTransaction() {
        return type == EventType.TRANSACTION;
    }

    @Nullable
    public String getEventId() {
        return eventId;
    }

    public Event withEventId(@Nullable String eventId) {
        this.eventId = eventId;
        return this;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    public Event withMessage(@Nullable String message) {
        this.message = message;
        return this;
    }

    @Nullable
    public Level getLevel() {
        return level;
    }

    public Event withLevel(@Nullable Level level) {
        this.level = level;
        return this;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Event withTimestamp(long epochMicros) {
        this.timestamp = epochMicros;
        return this;
    }

    public long getStartTimestamp() {
        return startTimestamp;
    }

    public Event withStartTimestamp(long epochMicros) {
        this.startTimestamp = epochMicros;
        return this;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Event withTag(String key, String value) {
        tags.put(key, value);
        return this;
    }

    @Nullable
    public AbstractSpan<?> getTraceContext() {
        return traceContext;
    }

    public Event withTraceContext(@Nullable AbstractSpan<?> traceContext) {
        this.traceContext = traceContext;
        return this;
    }

    public List<Span> getSpans() {
        return spans;
    }

    /**
     * @return the name of the transaction
     */
    @Nullable
    public String getTransaction() {
        return transaction;
    }

    public Event withTransaction(@Nullable String transaction) {
        this.transaction = transaction;
        return this;
    }

    @Nullable
    public String getTracestate() {
        return tracestate;
    }

    public Event withTracestate(@Nullable String tracestate) {
        this.tracestate = tracestate;
        return this;
    }

    public Map<String, Measurement> getMeasurements() {
        return measurements;
    }

    @Nullable
    public String getEnvironment() {
        return environment;
    }

    public Event withEnvironment(@Nullable String environment) {
        this.environment = environment;
        return this;
    }

    @Nullable
    public String getRelease() {
        return release;
    }

    public Event withRelease(@Nullable String release) {
        this.release = release;
        return this;
    }

    @Nullable
    public String getPlatform() {
        return platform;
    }

    public Event withPlatform(@Nullable String platform) {
        this.platform = platform;
        return this;
    }

    @Override
    public String toString() {
        return type.getValue() + " " + (eventId != null ? eventId : "(no id)");
    }
}
