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

public class Span extends AbstractSpan<Span> {

    private static final Logger logger = LoggerFactory.getLogger(Span.class);

    private final Transaction transaction;

    Span(SpanContext context, AbstractSpan<?> parent) {
        super(context, parent);
        this.transaction = parent.getTransaction();
    }

    public void finish() {
        finish(clock.getEpochMicros());
    }

    /**
     * Finishes this span. Calling this method more than once has no effect.
     *
     * @param epochMicros the end timestamp in microseconds since epoch
     */
    public void finish(long epochMicros) {
        if (markFinished(epochMicros) && logger.isDebugEnabled()) {
            logger.debug("finish {}", this);
        }
    }

    @Override
    public Transaction getTransaction() {
        return transaction;
    }

    @Override
    public String toString() {
        return String.format("'%s %s' %s (%s)", getOp(), getDescription(), spanId, Integer.toHexString(System.identityHashCode(this)));
    }
}
