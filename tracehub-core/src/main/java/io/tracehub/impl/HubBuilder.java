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

import io.tracehub.configuration.CoreConfiguration;
import io.tracehub.configuration.PrefixingConfigurationSourceWrapper;
import io.tracehub.impl.sampling.Sampler;
import io.tracehub.impl.sampling.SamplingEnvironment;
import io.tracehub.impl.sampling.TracesSampler;
import io.tracehub.report.NoopTransport;
import io.tracehub.report.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.AbstractConfigurationSource;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.PropertyFileConfigurationSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.ServiceLoader;

/**
 * Creates a {@link Hub} from configuration.
 * <p>
 * Configuration sources, in order of precedence:
 * </p>
 * <ol>
 *     <li>System properties prefixed with {@code tracehub.}</li>
 *     <li>Environment variables prefixed with {@code TRACEHUB_}</li>
 *     <li>Options set via {@link #withConfig(String, String)}</li>
 *     <li>The {@code tracehub.properties} file, if present on the classpath</li>
 * </ol>
 */
public class HubBuilder {

    static final String PROPERTIES_FILE = "tracehub.properties";
    private static final Logger logger = LoggerFactory.getLogger(HubBuilder.class);

    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private Transport transport;
    @Nullable
    private TracesSampler tracesSampler;
    private SamplingEnvironment samplingEnvironment = SamplingEnvironment.NONE;
    @Nullable
    private Random random;
    private Clock clock = Clock.systemUTC();
    private final Map<String, String> inlineConfig = new HashMap<>();

    public HubBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    public HubBuilder transport(Transport transport) {
        this.transport = transport;
        return this;
    }

    public HubBuilder tracesSampler(TracesSampler tracesSampler) {
        this.tracesSampler = tracesSampler;
        return this;
    }

    public HubBuilder samplingEnvironment(SamplingEnvironment samplingEnvironment) {
        this.samplingEnvironment = samplingEnvironment;
        return this;
    }

    /**
     * @param random the source of randomness for sampling decisions
     */
    public HubBuilder random(Random random) {
        this.random = random;
        return this;
    }

    /**
     * @param clock the wall clock used for timestamps of events, sessions and transactions
     */
    public HubBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public HubBuilder withConfig(String key, String value) {
        inlineConfig.put(key, value);
        return this;
    }

    public Hub build() {
        if (configurationRegistry == null) {
            configurationRegistry = getDefaultConfigurationRegistry(getConfigSources());
        }
        final Sampler sampler = random != null ? new Sampler(random) : new Sampler();
        final CoreConfiguration coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
        if (!coreConfiguration.isEnabled()) {
            logger.info("Capturing is disabled");
            return new Hub(null, sampler, samplingEnvironment, clock);
        }
        final ClientOptions options = ClientOptions.fromConfiguration(coreConfiguration)
            .withTracesSampler(tracesSampler);
        coreConfiguration.getTracesSampleRateOption().addChangeListener(new ConfigurationOption.ChangeListener<Double>() {
            @Override
            public void onChange(ConfigurationOption<?> configurationOption, Double oldValue, Double newValue) {
                logger.debug("traces_sample_rate overridden with value = ({}).", newValue);
                options.withTracesSampleRate(newValue);
            }
        });
        coreConfiguration.getMaxSpansOption().addChangeListener(new ConfigurationOption.ChangeListener<Integer>() {
            @Override
            public void onChange(ConfigurationOption<?> configurationOption, Integer oldValue, Integer newValue) {
                logger.debug("max_spans overridden with value = ({}).", newValue);
                options.withMaxSpans(newValue);
            }
        });
        final Client client = new DefaultClient(options, transport != null ? transport : NoopTransport.INSTANCE, clock);
        return new Hub(client, sampler, samplingEnvironment, clock);
    }

    private ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        return ConfigurationRegistry.builder()
            .configSources(configSources)
            .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, HubBuilder.class.getClassLoader()))
            .build();
    }

    private List<ConfigurationSource> getConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(new PrefixingConfigurationSourceWrapper(new SystemPropertyConfigurationSource(), "tracehub."));
        result.add(new PrefixingConfigurationSourceWrapper(new EnvironmentVariableConfigurationSource(), "TRACEHUB_", true));
        result.add(new AbstractConfigurationSource() {
            @Override
            public String getValue(String key) {
                return inlineConfig.get(key);
            }

            @Override
            public String getName() {
                return "Inline configuration";
            }
        });
        if (HubBuilder.class.getClassLoader().getResource(PROPERTIES_FILE) != null) {
            result.add(new PropertyFileConfigurationSource(PROPERTIES_FILE));
        }
        return result;
    }
}
