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

import io.tracehub.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * The upstream trace data carried in the {@code sentry-trace} header.
 * <pre>
 * sentry-trace: 12312012123120121231201212312012-1121201211212012-1
 *               (______________________________) (______________) |
 *                          trace id                 span id       sampled
 * </pre>
 * The sampled flag is optional.
 */
public class TraceParent {

    public static final String HEADER_NAME = "sentry-trace";
    private static final Logger logger = LoggerFactory.getLogger(TraceParent.class);
    private static final int TRACE_ID_LENGTH = 32;
    private static final int SPAN_ID_LENGTH = 16;
    private static final int SPAN_ID_OFFSET = TRACE_ID_LENGTH + 1;
    private static final int SAMPLED_OFFSET = SPAN_ID_OFFSET + SPAN_ID_LENGTH + 1;
    private static final int LENGTH_WITHOUT_SAMPLED = SPAN_ID_OFFSET + SPAN_ID_LENGTH;
    private static final int LENGTH_WITH_SAMPLED = SAMPLED_OFFSET + 1;

    private final String traceId;
    private final String parentSpanId;
    @Nullable
    private final Boolean parentSampled;

    private TraceParent(String traceId, String parentSpanId, @Nullable Boolean parentSampled) {
        this.traceId = traceId;
        this.parentSpanId = parentSpanId;
        this.parentSampled = parentSampled;
    }

    /**
     * Parses a {@code sentry-trace} header value.
     *
     * @param header the header value
     * @return the parsed value or {@code null} if the value does not match {@code [0-9a-f]{32}-[0-9a-f]{16}(-[01])?}
     */
    @Nullable
    public static TraceParent extract(String header) {
        final String value = header;
        if (value.length() != LENGTH_WITHOUT_SAMPLED && value.length() != LENGTH_WITH_SAMPLED) {
            logger.debug("The sentry-trace header has an invalid length: {}", value.length());
            return null;
        }
        if (!HexUtils.isLowerCaseHex(value, 0, TRACE_ID_LENGTH)
            || !hasDashAtPosition(value, TRACE_ID_LENGTH)
            || !HexUtils.isLowerCaseHex(value, SPAN_ID_OFFSET, SPAN_ID_LENGTH)) {
            logger.debug("The sentry-trace header is malformed: {}", value);
            return null;
        }
        Boolean sampled = null;
        if (value.length() == LENGTH_WITH_SAMPLED) {
            if (!hasDashAtPosition(value, LENGTH_WITHOUT_SAMPLED)) {
                logger.debug("The sentry-trace header is malformed: {}", value);
                return null;
            }
            final char flag = value.charAt(SAMPLED_OFFSET);
            if (flag == '1') {
                sampled = Boolean.TRUE;
            } else if (flag == '0') {
                sampled = Boolean.FALSE;
            } else {
                logger.debug("Invalid sampled flag in sentry-trace header: {}", value);
                return null;
            }
        }
        return new TraceParent(value.substring(0, TRACE_ID_LENGTH),
            value.substring(SPAN_ID_OFFSET, LENGTH_WITHOUT_SAMPLED), sampled);
    }

    private static boolean hasDashAtPosition(String s, int index) {
        return s.charAt(index) == '-';
    }

    /**
     * Renders a {@code sentry-trace} header value.
     *
     * @param sampled the sampling decision, omitted from the value if {@code null}
     */
    public static String format(Id traceId, Id spanId, @Nullable Boolean sampled) {
        final StringBuilder sb = new StringBuilder(LENGTH_WITH_SAMPLED);
        traceId.writeAsHex(sb);
        sb.append('-');
        spanId.writeAsHex(sb);
        if (sampled != null) {
            sb.append('-').append(sampled ? '1' : '0');
        }
        return sb.toString();
    }

    public String getTraceId() {
        return traceId;
    }

    public String getParentSpanId() {
        return parentSpanId;
    }

    @Nullable
    public Boolean getParentSampled() {
        return parentSampled;
    }

    @Override
    public String toString() {
        return traceId + "-" + parentSpanId + (parentSampled == null ? "" : (parentSampled ? "-1" : "-0"));
    }
}
