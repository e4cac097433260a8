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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleRateTest {

    @Test
    void testBooleans() throws Exception {
        assertThat(SampleRate.of(true)).isSameAs(SampleRate.ALWAYS);
        assertThat(SampleRate.of(false)).isSameAs(SampleRate.NEVER);
    }

    @Test
    void testNumbers() throws Exception {
        assertThat(SampleRate.of(1).getRate()).isEqualTo(1.0);
        assertThat(SampleRate.of(0L)).isSameAs(SampleRate.NEVER);
        assertThat(SampleRate.of(0.25f).getRate()).isEqualTo(0.25);
        assertThat(SampleRate.of(0.5)).isEqualTo(SampleRate.of(0.5));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1, 2, Double.POSITIVE_INFINITY})
    void testOutOfRange(double rate) {
        assertThatThrownBy(() -> SampleRate.of(rate))
            .isInstanceOf(InvalidSampleRateException.class)
            .hasMessage("Sample rate must be between 0 and 1. Got " + rate + ".");
    }

    @Test
    void testInvalidTypes() {
        assertThatThrownBy(() -> SampleRate.of("dogs"))
            .isInstanceOf(InvalidSampleRateException.class)
            .hasMessage("Sample rate must be a boolean or a number between 0 and 1. Got dogs of type String.");
        assertThatThrownBy(() -> SampleRate.of(Double.NaN))
            .isInstanceOf(InvalidSampleRateException.class)
            .hasMessageContaining("of type Double");
        assertThatThrownBy(() -> SampleRate.of(null))
            .isInstanceOf(InvalidSampleRateException.class)
            .hasMessageContaining("of type null");
    }

    @Test
    void testAlwaysAndNeverDoNotConsultRandom() {
        FixedRandom random = new FixedRandom(0.5);

        assertThat(SampleRate.ALWAYS.isSampled(random)).isTrue();
        assertThat(SampleRate.NEVER.isSampled(random)).isFalse();

        assertThat(random.getDraws()).isZero();
    }

    @Test
    void testSampledIfRandomIsLessThanRate() throws Exception {
        FixedRandom random = new FixedRandom(0.4999);
        SampleRate rate = SampleRate.of(0.5);

        assertThat(rate.isSampled(random)).isTrue();
        random.setNextDouble(0.5);
        assertThat(rate.isSampled(random)).isFalse();
        assertThat(random.getDraws()).isEqualTo(2);
    }

    @Test
    void testEmpiricalSampleRate() throws Exception {
        Random random = new Random(42);
        SampleRate rate = SampleRate.of(0.3);
        int sampled = 0;
        for (int i = 0; i < 100_000; i++) {
            if (rate.isSampled(random)) {
                sampled++;
            }
        }
        assertThat(sampled / 100_000.0).isBetween(0.29, 0.31);
    }
}
