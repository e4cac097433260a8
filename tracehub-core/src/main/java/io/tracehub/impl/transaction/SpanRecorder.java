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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps track of the spans of a {@link Transaction}, in the order they have been started.
 * <p>
 * The first entry is the transaction itself.
 * Once the recorder holds more than {@code maxLen} entries, further spans are dropped.
 * A dropped span loses its recorder so that its own children are not recorded either.
 * </p>
 */
public class SpanRecorder {

    public static final int DEFAULT_MAX_LEN = 1000;
    private static final Logger logger = LoggerFactory.getLogger(SpanRecorder.class);

    private final int maxLen;
    private final List<AbstractSpan<?>> spans = new ArrayList<>();
    private int dropped;

    public SpanRecorder() {
        this(DEFAULT_MAX_LEN);
    }

    public SpanRecorder(int maxLen) {
        this.maxLen = maxLen;
    }

    public void add(AbstractSpan<?> span) {
        if (spans.size() > maxLen) {
            span.clearSpanRecorder();
            if (dropped++ == 0) {
                logger.debug("Span limit of {} reached, dropping further spans", maxLen);
            }
        } else {
            spans.add(span);
        }
    }

    public List<AbstractSpan<?>> getSpans() {
        return Collections.unmodifiableList(spans);
    }

    /**
     * @return the number of spans which have not been recorded because the limit has been reached
     */
    public int getDropped() {
        return dropped;
    }

    public int getMaxLen() {
        return maxLen;
    }
}
