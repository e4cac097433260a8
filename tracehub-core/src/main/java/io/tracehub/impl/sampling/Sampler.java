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

import io.tracehub.impl.Client;
import io.tracehub.impl.ClientOptions;
import io.tracehub.impl.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.Random;

/**
 * Decides whether a new transaction is sampled, i.e. whether its data is recorded and sent.
 * <p>
 * The first matching rule wins:
 * </p>
 * <ol>
 *     <li>A decision explicitly set on the {@link TransactionContext} is used as-is.</li>
 *     <li>Without a client, or without a configured sample rate or {@link TracesSampler}, nothing is sampled.</li>
 *     <li>A configured {@link TracesSampler} determines the sample rate.</li>
 *     <li>Otherwise, the decision of the parent is inherited if there is one.</li>
 *     <li>Otherwise, the configured sample rate is used.</li>
 * </ol>
 * <p>
 * Invalid sample rates are logged and lead to the transaction not being sampled.
 * This class never throws.
 * </p>
 */
public class Sampler {

    private static final Logger logger = LoggerFactory.getLogger(Sampler.class);

    private final Random random;

    public Sampler() {
        this(new Random());
    }

    /**
     * @param random the source of randomness, can be replaced for deterministic tests
     */
    public Sampler(Random random) {
        this.random = random;
    }

    public boolean resolve(TransactionContext transactionContext, @Nullable Client client) {
        return sample(transactionContext, client, SamplingEnvironment.NONE, Collections.<String, Object>emptyMap()).isSampled();
    }

    /**
     * Makes the sampling decision for a new transaction.
     *
     * @param transactionContext    the options the transaction is started with
     * @param client                the client the transaction would be sent to
     * @param environment           provides request or location data for the {@link TracesSampler}
     * @param customSamplingContext additional entries for the {@link SamplingContext}
     * @return the decision, including the rule which has been applied
     */
    public SamplingDecision sample(TransactionContext transactionContext, @Nullable Client client,
                                   SamplingEnvironment environment, Map<String, Object> customSamplingContext) {
        final Boolean explicitlySampled = transactionContext.getSampled();
        if (explicitlySampled != null) {
            return SamplingDecision.of(explicitlySampled, SamplingMethod.EXPLICITLY_SET);
        }

        final ClientOptions options = client != null ? client.getOptions() : null;
        if (options == null || !options.hasTracingEnabled()) {
            logger.debug("Tracing is disabled, not sampling transaction {}", transactionContext.getName());
            return SamplingDecision.of(false, SamplingMethod.TRACING_DISABLED);
        }

        final Object rateValue;
        final SamplingMethod method;
        final TracesSampler tracesSampler = options.getTracesSampler();
        if (tracesSampler != null) {
            method = SamplingMethod.CLIENT_SAMPLER;
            final SamplingContext samplingContext = new SamplingContext(transactionContext, environment.getRequest(),
                environment.getLocation(), customSamplingContext);
            try {
                rateValue = tracesSampler.sample(samplingContext);
            } catch (RuntimeException e) {
                logger.warn("Exception while calling the traces sampler, discarding transaction {}", transactionContext.getName(), e);
                return SamplingDecision.of(false, method);
            }
        } else if (transactionContext.getParentSampled() != null) {
            return SamplingDecision.of(transactionContext.getParentSampled(), SamplingMethod.INHERITANCE);
        } else {
            method = SamplingMethod.CLIENT_RATE;
            rateValue = options.getTracesSampleRate();
        }

        final SampleRate sampleRate;
        try {
            sampleRate = SampleRate.of(rateValue);
        } catch (InvalidSampleRateException e) {
            logger.warn("Discarding transaction because of invalid sample rate. {}", e.getMessage());
            return SamplingDecision.of(false, method);
        }

        final boolean sampled = sampleRate.isSampled(random);
        if (logger.isDebugEnabled()) {
            if (sampleRate.getRate() == 0) {
                logger.debug("Discarding transaction because {}", method == SamplingMethod.CLIENT_SAMPLER
                    ? "the traces sampler returned 0 or false"
                    : "the sample rate is set to 0");
            } else if (!sampled) {
                logger.debug("Discarding transaction because it's not included in the random sample (sampling rate = {})", sampleRate);
            } else {
                logger.debug("Sampling transaction {} ({})", transactionContext.getName(), method.getValue());
            }
        }
        return new SamplingDecision(sampled, method, sampleRate.getRate());
    }
}
