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

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Timestamps the spans of one transaction.
 * <p>
 * The clock reads the wall clock once, when the transaction starts, and measures everything after that with
 * {@link System#nanoTime()}. Child spans are aligned with the clock of their transaction, so wall clock jumps
 * while a transaction runs can't make a child end before its parent started.
 * </p>
 */
public class EpochTickClock {

    /**
     * Nanoseconds to add to {@link System#nanoTime()} to get nanoseconds since epoch
     */
    private long epochNanosMinusTicks;

    /**
     * Reads the wall clock and anchors the tick counter to it.
     *
     * @return the wall clock time in microseconds since epoch
     */
    long calibrate(Clock wallClock) {
        return calibrate(toEpochMicros(wallClock.instant()), System.nanoTime());
    }

    long calibrate(long epochMicros, long ticks) {
        epochNanosMinusTicks = TimeUnit.MICROSECONDS.toNanos(epochMicros) - ticks;
        return epochMicros;
    }

    void alignWith(EpochTickClock transactionClock) {
        this.epochNanosMinusTicks = transactionClock.epochNanosMinusTicks;
    }

    public long getEpochMicros() {
        return toEpochMicros(System.nanoTime());
    }

    long toEpochMicros(long ticks) {
        return TimeUnit.NANOSECONDS.toMicros(ticks + epochNanosMinusTicks);
    }

    static long toEpochMicros(Instant instant) {
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(instant.getNano());
    }
}
