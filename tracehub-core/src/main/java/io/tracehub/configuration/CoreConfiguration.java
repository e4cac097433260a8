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
package io.tracehub.configuration;

import io.tracehub.impl.transaction.SpanRecorder;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import javax.annotation.Nullable;

public class CoreConfiguration extends ConfigurationOptionProvider {

    public static final String ENABLED = "enabled";
    public static final String DSN = "dsn";
    public static final String ENVIRONMENT = "environment";
    public static final String RELEASE = "release";
    public static final String TRACES_SAMPLE_RATE = "traces_sample_rate";
    public static final String MAX_SPANS = "max_spans";
    private static final String CORE_CATEGORY = "Core";

    private final ConfigurationOption<Boolean> enabled = ConfigurationOption.booleanOption()
        .key(ENABLED)
        .configurationCategory(CORE_CATEGORY)
        .description("A boolean specifying if events should be captured at all.\n" +
            "\n" +
            "When set to false, the hub is created without a client, so that nothing is sampled or sent.")
        .buildWithDefault(true);

    private final ConfigurationOption<String> dsn = ConfigurationOption.stringOption()
        .key(DSN)
        .configurationCategory(CORE_CATEGORY)
        .description("The destination identifier, in the form of `{protocol}://{public_key}@{host}[:{port}]/{path/}{project_id}`.\n" +
            "\n" +
            "Without a DSN, events are not sent and no tracestate is propagated to downstream services.")
        .build();

    private final ConfigurationOption<String> environment = ConfigurationOption.stringOption()
        .key(ENVIRONMENT)
        .configurationCategory(CORE_CATEGORY)
        .description("The name of the environment this service is deployed in, e.g. \"production\" or \"staging\".")
        .build();

    private final ConfigurationOption<String> release = ConfigurationOption.stringOption()
        .key(RELEASE)
        .configurationCategory(CORE_CATEGORY)
        .description("The version of the deployed code. Sessions are only sent if a release is configured.")
        .build();

    private final ConfigurationOption<Double> tracesSampleRate = ConfigurationOption.doubleOption()
        .key(TRACES_SAMPLE_RATE)
        .configurationCategory(CORE_CATEGORY)
        .description("The probability with which a new trace is sampled, a value between 0.0 and 1.0.\n" +
            "\n" +
            "Transactions which continue a trace inherit the decision of their parent instead.\n" +
            "If neither this option nor a traces sampler is set, tracing is disabled.\n" +
            "Invalid values are reported when a transaction is started and lead to the transaction not being sampled.")
        .dynamic(true)
        .build();

    private final ConfigurationOption<Integer> maxSpans = ConfigurationOption.integerOption()
        .key(MAX_SPANS)
        .configurationCategory(CORE_CATEGORY)
        .description("Limits the amount of spans that are recorded per transaction.\n\n" +
            "This is helpful in cases where a transaction creates a very high amount of spans (e.g. thousands of SQL queries).")
        .dynamic(true)
        .buildWithDefault(SpanRecorder.DEFAULT_MAX_LEN);

    public boolean isEnabled() {
        return enabled.getValue();
    }

    @Nullable
    public String getDsn() {
        return dsn.getValue();
    }

    @Nullable
    public String getEnvironment() {
        return environment.getValue();
    }

    @Nullable
    public String getRelease() {
        return release.getValue();
    }

    @Nullable
    public Double getTracesSampleRate() {
        return tracesSampleRate.getValue();
    }

    public ConfigurationOption<Double> getTracesSampleRateOption() {
        return tracesSampleRate;
    }

    public int getMaxSpans() {
        return maxSpans.getValue();
    }

    public ConfigurationOption<Integer> getMaxSpansOption() {
        return maxSpans;
    }
}
