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

import io.tracehub.util.HexUtils;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tracks the health of a user session, for example one run of an application.
 * <p>
 * Timestamps are in milliseconds since epoch.
 * </p>
 */
public class Session {

    private final Clock clock;
    private final String sid;
    @Nullable
    private String did;
    private boolean init = true;
    private final long started;
    private long timestamp;
    private double duration;
    private SessionStatus status = SessionStatus.OK;
    private int errors;
    @Nullable
    private String release;
    @Nullable
    private String environment;
    @Nullable
    private String ipAddress;
    @Nullable
    private String userAgent;

    public Session() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock the clock the session reads when it starts, is updated and is closed
     */
    public Session(Clock clock) {
        final byte[] id = new byte[16];
        ThreadLocalRandom.current().nextBytes(id);
        this.clock = clock;
        this.sid = HexUtils.bytesToHex(id);
        this.started = clock.millis();
        this.timestamp = started;
    }

    public void update() {
        update(clock.millis());
    }

    /**
     * Refreshes the timestamp and the duration of this session
     *
     * @param epochMillis the current time
     */
    public void update(long epochMillis) {
        timestamp = epochMillis;
        duration = Math.max(0, timestamp - started) / 1000.0;
    }

    /**
     * Ends this session.
     *
     * @param status the final status, {@code null} to mark a session which is still {@link SessionStatus#OK ok} as
     *               {@link SessionStatus#EXITED exited}
     */
    public void close(@Nullable SessionStatus status) {
        if (status != null) {
            this.status = status;
        } else if (this.status == SessionStatus.OK) {
            this.status = SessionStatus.EXITED;
        }
        update();
    }

    public String getSid() {
        return sid;
    }

    @Nullable
    public String getDid() {
        return did;
    }

    public Session withDid(@Nullable String did) {
        this.did = did;
        return this;
    }

    /**
     * @return whether this is the first update of this session that is sent
     */
    public boolean isInit() {
        return init;
    }

    public void setInit(boolean init) {
        this.init = init;
    }

    public long getStarted() {
        return started;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * @return the duration in seconds
     */
    public double getDuration() {
        return duration;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Session withStatus(SessionStatus status) {
        this.status = status;
        return this;
    }

    public int getErrors() {
        return errors;
    }

    public Session withErrors(int errors) {
        this.errors = errors;
        return this;
    }

    @Nullable
    public String getRelease() {
        return release;
    }

    public Session withRelease(@Nullable String release) {
        this.release = release;
        return this;
    }

    @Nullable
    public String getEnvironment() {
        return environment;
    }

    public Session withEnvironment(@Nullable String environment) {
        this.environment = environment;
        return this;
    }

    @Nullable
    public String getIpAddress() {
        return ipAddress;
    }

    public Session withIpAddress(@Nullable String ipAddress) {
        this.ipAddress = ipAddress;
        return this;
    }

    @Nullable
    public String getUserAgent() {
        return userAgent;
    }

    public Session withUserAgent(@Nullable String userAgent) {
        this.userAgent = userAgent;
        return this;
    }
}
