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

import io.tracehub.impl.transaction.TransactionContext;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;

/**
 * Everything a {@link TracesSampler} knows about the transaction which is about to be started.
 * Created for each decision.
 */
public class SamplingContext {

    private final TransactionContext transactionContext;
    @Nullable
    private final Boolean parentSampled;
    @Nullable
    private final RequestData request;
    @Nullable
    private final Map<String, String> location;
    private final Map<String, Object> custom;

    public SamplingContext(TransactionContext transactionContext, @Nullable RequestData request,
                           @Nullable Map<String, String> location, Map<String, Object> custom) {
        this.transactionContext = transactionContext;
        this.parentSampled = transactionContext.getParentSampled();
        this.request = request;
        this.location = location;
        this.custom = Collections.unmodifiableMap(custom);
    }

    public TransactionContext getTransactionContext() {
        return transactionContext;
    }

    /**
     * @return the sampling decision of the upstream caller, {@code null} if there is none
     */
    @Nullable
    public Boolean getParentSampled() {
        return parentSampled;
    }

    @Nullable
    public RequestData getRequest() {
        return request;
    }

    @Nullable
    public Map<String, String> getLocation() {
        return location;
    }

    /**
     * @return the entries passed to {@link io.tracehub.impl.Hub#startTransaction(TransactionContext, Map)}
     */
    public Map<String, Object> getCustom() {
        return custom;
    }

    @Nullable
    public Object get(String key) {
        return custom.get(key);
    }
}
