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

/**
 * A user supplied function which decides about the sample rate of each new transaction.
 * <p>
 * Takes precedence over the configured {@code traces_sample_rate} and over the decision of the parent.
 * </p>
 */
public interface TracesSampler {

    /**
     * @param samplingContext data about the transaction which is about to be started
     * @return a {@link Number} between 0 and 1, or a {@link Boolean}.
     * Any other value, including {@code null}, means the transaction is not sampled.
     */
    @Nullable
    Object sample(SamplingContext samplingContext);
}
