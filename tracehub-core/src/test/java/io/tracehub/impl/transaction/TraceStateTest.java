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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tracehub.impl.Client;
import io.tracehub.impl.ClientOptions;
import io.tracehub.impl.Dsn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TraceStateTest {

    private static final String ENCODED_DOG_PARK = "ewAiAHAAdQBiAGwAaQBjAF8AawBlAHkAIgA6ACIAZABvAGcAcwBhAHIAZQBiAGEAZABhAHQAawBlAGUAcA" +
        "BpAG4AZwBzAGUAYwByAGUAdABzACIALAAiAGUAbgB2AGkAcgBvAG4AbQBlAG4AdAAiADoAIgBkAG8AZwBwAGEAcgBrACIALAAiA" +
        "HIAZQBsAGUAYQBzAGUAIgA6ACIAbwBmAGYALgBsAGUAYQBzAGgALgBwAGEAcgBrACIAfQA.";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Client client;
    private ClientOptions options;
    private Id traceId;

    @BeforeEach
    void setUp() {
        options = new ClientOptions();
        client = mock(Client.class);
        when(client.getOptions()).thenReturn(options);
        when(client.getDsn()).thenReturn(Dsn.parse("https://dogsarebadatkeepingsecrets@squirrelchasers.ingest.example.io/12312012"));
        traceId = Id.new128BitId();
        traceId.fromHexString("12312012123120121231201212312012", 0);
    }

    @Test
    void testDecodeKnownValue() throws Exception {
        JsonNode json = objectMapper.readTree(TraceState.decode(ENCODED_DOG_PARK));

        assertThat(json.get("public_key").textValue()).isEqualTo("dogsarebadatkeepingsecrets");
        assertThat(json.get("environment").textValue()).isEqualTo("dogpark");
        assertThat(json.get("release").textValue()).isEqualTo("off.leash.park");
        assertThat(json.has("trace_id")).isFalse();
    }

    @Test
    void testEncodeKnownValue() throws Exception {
        String encoded = TraceState.encode("{\"public_key\":\"dogsarebadatkeepingsecrets\",\"environment\":\"dogpark\",\"release\":\"off.leash.park\"}");

        assertThat(encoded).isEqualTo(ENCODED_DOG_PARK);
    }

    @Test
    void testEncodedValueContainsNoPadding() throws Exception {
        assertThat(TraceState.encode("a")).isEqualTo("YQA.");
        assertThat(TraceState.encode("ab")).isEqualTo("YQBiAA.");
        assertThat(TraceState.encode("abc")).isEqualTo("YQBiAGMA");
    }

    @Test
    void testRoundTripWithTwoPaddingCharacters() throws Exception {
        assertThat(TraceState.decode(TraceState.encode("ab"))).isEqualTo("ab");
        assertThat(TraceState.decode(TraceState.encode("{}"))).isEqualTo("{}");
    }

    @Test
    void testRoundTrip() throws Exception {
        String encoded = TraceState.encode("12312012123120121231201212312012", "public", "prod", "1.0.0");

        JsonNode json = objectMapper.readTree(TraceState.decode(encoded));

        assertThat(json.get("trace_id").textValue()).isEqualTo("12312012123120121231201212312012");
        assertThat(json.get("public_key").textValue()).isEqualTo("public");
        assertThat(json.get("environment").textValue()).isEqualTo("prod");
        assertThat(json.get("release").textValue()).isEqualTo("1.0.0");
    }

    @Test
    void testRoundTripRandomTraceIds() throws Exception {
        for (int i = 0; i < 100; i++) {
            Id id = Id.new128BitId();
            id.setToRandomValue();
            String environment = "env-" + "x".repeat(i % 3);

            JsonNode json = objectMapper.readTree(TraceState.decode(TraceState.encode(id.toString(), "key", environment, "rel")));

            assertThat(json.get("trace_id").textValue()).isEqualTo(id.toString());
            assertThat(json.get("environment").textValue()).isEqualTo(environment);
        }
    }

    @Test
    void testRoundTripNonAsciiAndEscapedCharacters() throws Exception {
        String encoded = TraceState.encode("12312012123120121231201212312012", "public", "pr\"ödé 🐶", null);

        JsonNode json = objectMapper.readTree(TraceState.decode(encoded));

        assertThat(json.get("environment").textValue()).isEqualTo("pr\"ödé 🐶");
    }

    @Test
    void testDefaultsForMissingEnvironmentAndRelease() throws Exception {
        JsonNode json = objectMapper.readTree(TraceState.decode(TraceState.encode("12312012123120121231201212312012", "public", null, "")));

        assertThat(json.get("environment").textValue()).isEqualTo("no environment specified");
        assertThat(json.get("release").textValue()).isEqualTo("no release specified");
    }

    @Test
    void testCreateValue() throws Exception {
        options.withEnvironment("dogpark").withRelease("off.leash.park");

        String value = TraceState.createValue(traceId, client);

        assertThat(value).isNotNull().doesNotContain("=");
        JsonNode json = objectMapper.readTree(TraceState.decode(value));
        assertThat(json.get("trace_id").textValue()).isEqualTo("12312012123120121231201212312012");
        assertThat(json.get("public_key").textValue()).isEqualTo("dogsarebadatkeepingsecrets");
        assertThat(json.get("environment").textValue()).isEqualTo("dogpark");
        assertThat(json.get("release").textValue()).isEqualTo("off.leash.park");
    }

    @Test
    void testCreateValueWithoutClientOrDsn() {
        assertThat(TraceState.createValue(traceId, null)).isNull();

        when(client.getDsn()).thenReturn(null);
        assertThat(TraceState.createValue(traceId, client)).isNull();
    }

    @Test
    void testEncodeUnpairedSurrogate() {
        assertThatThrownBy(() -> TraceState.encode("\uD800"))
            .isInstanceOf(TraceStateEncodingException.class);
    }

    @Test
    void testDecodeInvalidBase64() {
        assertThatThrownBy(() -> TraceState.decode("not base64!"))
            .isInstanceOf(TraceStateEncodingException.class)
            .hasMessageContaining("base64");
        assertThatThrownBy(() -> TraceState.decode("a."))
            .isInstanceOf(TraceStateEncodingException.class);
    }

    @Test
    void testDecodeInvalidUtf16() {
        // a single byte
        assertThatThrownBy(() -> TraceState.decode("YQ."))
            .isInstanceOf(TraceStateEncodingException.class);
        // an unpaired high surrogate
        assertThatThrownBy(() -> TraceState.decode("ANg."))
            .isInstanceOf(TraceStateEncodingException.class);
    }

    @Test
    void testHeader() {
        assertThat(TraceState.toHeaderValue("abc.")).isEqualTo("sentry=abc.");
        assertThat(TraceState.extractFromHeader("sentry=abc.")).isEqualTo("abc.");
        assertThat(TraceState.extractFromHeader("vendor=1, sentry=abc. ,other=2")).isEqualTo("abc.");
        assertThat(TraceState.extractFromHeader("vendor=1")).isNull();
        assertThat(TraceState.extractFromHeader("sentry=")).isNull();
    }
}
