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
 * The outcome of a span, named after the canonical gRPC status codes.
 */
public enum SpanStatus {

    OK("ok"),
    CANCELLED("cancelled"),
    UNKNOWN_ERROR("unknown_error"),
    INVALID_ARGUMENT("invalid_argument"),
    DEADLINE_EXCEEDED("deadline_exceeded"),
    NOT_FOUND("not_found"),
    ALREADY_EXISTS("already_exists"),
    PERMISSION_DENIED("permission_denied"),
    RESOURCE_EXHAUSTED("resource_exhausted"),
    FAILED_PRECONDITION("failed_precondition"),
    ABORTED("aborted"),
    OUT_OF_RANGE("out_of_range"),
    UNIMPLEMENTED("unimplemented"),
    INTERNAL_ERROR("internal_error"),
    UNAVAILABLE("unavailable"),
    DATA_LOSS("data_loss"),
    UNAUTHENTICATED("unauthenticated");

    private final String value;

    SpanStatus(String value) {
        this.value = value;
    }

    /**
     * @return the wire representation, for example {@code deadline_exceeded}
     */
    public String getValue() {
        return value;
    }

    /**
     * Maps an HTTP status code to a span status.
     *
     * @param httpStatus the HTTP status code
     * @return the matching status, {@link #UNKNOWN_ERROR} for unmapped error codes
     */
    public static SpanStatus fromHttpCode(int httpStatus) {
        if (httpStatus < 400 && httpStatus >= 100) {
            return OK;
        }
        if (httpStatus >= 400 && httpStatus < 500) {
            switch (httpStatus) {
                case 401:
                    return UNAUTHENTICATED;
                case 403:
                    return PERMISSION_DENIED;
                case 404:
                    return NOT_FOUND;
                case 409:
                    return ALREADY_EXISTS;
                case 413:
                    return FAILED_PRECONDITION;
                case 429:
                    return RESOURCE_EXHAUSTED;
                default:
                    return INVALID_ARGUMENT;
            }
        }
        if (httpStatus >= 500 && httpStatus < 600) {
            switch (httpStatus) {
                case 501:
                    return UNIMPLEMENTED;
                case 503:
                    return UNAVAILABLE;
                case 504:
                    return DEADLINE_EXCEEDED;
                default:
                    return INTERNAL_ERROR;
            }
        }
        return UNKNOWN_ERROR;
    }

    @Nullable
    public static SpanStatus fromValue(String value) {
        for (SpanStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
