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

import javax.annotation.Nullable;

/**
 * Prepares captured events and sessions and hands them to the transport.
 */
public interface Client {

    ClientOptions getOptions();

    /**
     * @return the parsed destination identifier, {@code null} if none or an invalid one is configured
     */
    @Nullable
    Dsn getDsn();

    /**
     * @param event the event to send
     * @return the id of the event, {@code null} if it has not been captured
     */
    @Nullable
    String captureEvent(Event event);

    void captureSession(Session session);
}
