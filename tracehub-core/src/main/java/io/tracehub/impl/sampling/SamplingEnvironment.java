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
import java.util.Map;

/**
 * Supplies data about the runtime environment which is passed to the {@link TracesSampler}.
 * <p>
 * Implemented by integrations which know about the current request, for example a servlet filter.
 * The data is expected to be normalized already.
 * </p>
 */
public interface SamplingEnvironment {

    SamplingEnvironment NONE = new SamplingEnvironment() {
        @Nullable
        @Override
        public RequestData getRequest() {
            return null;
        }

        @Nullable
        @Override
        public Map<String, String> getLocation() {
            return null;
        }
    };

    /**
     * @return the server request currently being handled, {@code null} if there is none
     */
    @Nullable
    RequestData getRequest();

    /**
     * @return the location of a client side application, such as {@code href} or {@code pathname}, {@code null} if unknown
     */
    @Nullable
    Map<String, String> getLocation();
}
