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
import java.util.Random;

/**
 * A validated sampling probability between 0.0 and 1.0.
 * <p>
 * A sample rate of 0.5 means that 50% of all transactions should be sampled.
 * Booleans are accepted as well: {@code true} means 1.0, {@code false} means 0.0.
 * </p>
 */
public final class SampleRate {

    public static final SampleRate ALWAYS = new SampleRate(1.0);
    public static final SampleRate NEVER = new SampleRate(0.0);

    private final double rate;

    private SampleRate(double rate) {
        this.rate = rate;
    }

    /**
     * Normalizes a configured sample rate or the return value of a {@link TracesSampler}.
     *
     * @param value a {@link Number} or {@link Boolean}
     * @return the validated sample rate
     * @throws InvalidSampleRateException if the value is not a number or boolean, is {@code NaN} or is not within [0, 1]
     */
    public static SampleRate of(@Nullable Object value) throws InvalidSampleRateException {
        if (value instanceof Boolean) {
            return (Boolean) value ? ALWAYS : NEVER;
        }
        if (!(value instanceof Number) || Double.isNaN(((Number) value).doubleValue())) {
            throw new InvalidSampleRateException(String.format(
                "Sample rate must be a boolean or a number between 0 and 1. Got %s of type %s.",
                value, value == null ? "null" : value.getClass().getSimpleName()));
        }
        final double rate = ((Number) value).doubleValue();
        if (rate < 0 || rate > 1) {
            throw new InvalidSampleRateException("Sample rate must be between 0 and 1. Got " + value + ".");
        }
        return of(rate);
    }

    private static SampleRate of(double rate) {
        if (rate == 1) {
            return ALWAYS;
        }
        if (rate == 0) {
            return NEVER;
        }
        return new SampleRate(rate);
    }

    /**
     * @param random the source of randomness
     * @return {@code true} if a value drawn from {@code random} is less than the rate
     */
    public boolean isSampled(Random random) {
        if (rate == 0) {
            return false;
        }
        if (rate == 1) {
            return true;
        }
        return random.nextDouble() < rate;
    }

    public double getRate() {
        return rate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(((SampleRate) o).rate, rate) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(rate);
    }

    @Override
    public String toString() {
        return Double.toString(rate);
    }
}
