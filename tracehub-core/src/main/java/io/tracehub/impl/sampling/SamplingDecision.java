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

public class SamplingDecision {

    private final boolean sampled;
    private final SamplingMethod method;
    @Nullable
    private final Double sampleRate;

    public SamplingDecision(boolean sampled, SamplingMethod method, @Nullable Double sampleRate) {
        this.sampled = sampled;
        this.method = method;
        this.sampleRate = sampleRate;
    }

    public static SamplingDecision of(boolean sampled, SamplingMethod method) {
        return new SamplingDecision(sampled, method, null);
    }

    public boolean isSampled() {
        return sampled;
    }

    public SamplingMethod getMethod() {
        return method;
    }

    /**
     * @return the rate the decision was drawn with, {@code null} if no rate was involved
     */
    @Nullable
    public Double getSampleRate() {
        return sampleRate;
    }

    @Override
    public String toString() {
        return "sampled=" + sampled + " (" + method.getValue() + (sampleRate != null ? ", rate=" + sampleRate : "") + ")";
    }
}
