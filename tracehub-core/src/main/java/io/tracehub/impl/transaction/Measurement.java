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

import javax.annotation.Nullable;

/**
 * A named numeric value attached to a {@link Transaction}, such as a web vital.
 */
public class Measurement {

    private final double value;
    @Nullable
    private final String unit;

    public Measurement(double value, @Nullable String unit) {
        this.value = value;
        this.unit = unit;
    }

    public double getValue() {
        return value;
    }

    @Nullable
    public String getUnit() {
        return unit;
    }

    @Override
    public String toString() {
        return unit == null ? Double.toString(value) : value + " " + unit;
    }
}
