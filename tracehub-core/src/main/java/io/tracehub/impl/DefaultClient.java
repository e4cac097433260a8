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
import io.tracehub.report.ApiEndpoints;
import io.tracehub.report.Transport;
import io.tracehub.report.TransportRequest;
import io.tracehub.report.serialize.EnvelopeSerializer;
import io.tracehub.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Assigns ids to events, applies the configured environment and release,
 * and sends events and sessions through the {@link Transport}.
 * <p>
 * Without a valid destination identifier, nothing is sent.
 * </p>
 */
public class DefaultClient implements Client {

    private static final Logger logger = LoggerFactory.getLogger(DefaultClient.class);

    private final ClientOptions options;
    private final Transport transport;
    private final Clock clock;
    @Nullable
    private final Dsn dsn;
    @Nullable
    private final EnvelopeSerializer envelopeSerializer;

    public DefaultClient(ClientOptions options, Transport transport) {
        this(options, transport, Clock.systemUTC());
    }

    public DefaultClient(ClientOptions options, Transport transport, Clock clock) {
        this.options = options;
        this.transport = transport;
        this.clock = clock;
        this.dsn = parseDsn(options.getDsn());
        this.envelopeSerializer = dsn != null ? new EnvelopeSerializer(new ApiEndpoints(dsn), clock) : null;
    }

    @Nullable
    private static Dsn parseDsn(@Nullable String dsn) {
        if (dsn == null || dsn.isEmpty()) {
            logger.debug("No dsn configured, events will not be sent");
            return null;
        }
        try {
            return Dsn.parse(dsn);
        } catch (IllegalArgumentException e) {
            logger.warn("{}, events will not be sent", e.getMessage());
            return null;
        }
    }

    @Override
    public ClientOptions getOptions() {
        return options;
    }

    @Nullable
    @Override
    public Dsn getDsn() {
        return dsn;
    }

    @Nullable
    @Override
    public String captureEvent(Event event) {
        if (envelopeSerializer == null) {
            logger.debug("Not sending {} as no valid dsn is configured", event);
            return null;
        }
        prepareEvent(event);
        send(envelopeSerializer.toRequest(event));
        return event.getEventId();
    }

    private void prepareEvent(Event event) {
        if (event.getEventId() == null) {
            event.withEventId(newEventId());
        }
        if (event.getTimestamp() < 0) {
            event.withTimestamp(clock.millis() * 1000);
        }
        if (event.getEnvironment() == null) {
            event.withEnvironment(options.getEnvironment());
        }
        if (event.getRelease() == null) {
            event.withRelease(options.getRelease());
        }
        if (event.getPlatform() == null) {
            event.withPlatform(Event.PLATFORM);
        }
    }

    /**
     * @return a random id of 32 lower case hex characters
     */
    public static String newEventId() {
        final byte[] id = new byte[16];
        ThreadLocalRandom.current().nextBytes(id);
        return HexUtils.bytesToHex(id);
    }

    @Override
    public void captureSession(Session session) {
        if (session.getRelease() == null || session.getRelease().isEmpty()) {
            logger.warn("Discarded session because of missing release");
            return;
        }
        if (envelopeSerializer == null) {
            logger.debug("Not sending session {} as no valid dsn is configured", session.getSid());
            return;
        }
        send(envelopeSerializer.sessionToRequest(session));
        session.setInit(false);
    }

    private void send(TransportRequest request) {
        try {
            transport.send(request);
        } catch (RuntimeException e) {
            logger.warn("Failed to send {}", request, e);
        }
    }
}
