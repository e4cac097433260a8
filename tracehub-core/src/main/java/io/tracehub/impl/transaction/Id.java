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

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A random identifier, rendered as lower case hex.
 * <p>
 * Trace ids are 128 bit (32 hex characters), span ids are 64 bit (16 hex characters).
 * </p>
 */
public class Id {

    private final byte[] data;
    private boolean empty = true;
    @Nullable
    private String cachedStringRepresentation;

    public static Id new128BitId() {
        return new Id(16);
    }

    public static Id new64BitId() {
        return new Id(8);
    }

    private Id(int idLengthBytes) {
        data = new byte[idLengthBytes];
    }

    public void setToRandomValue() {
        setToRandomValue(ThreadLocalRandom.current());
    }

    public void setToRandomValue(Random random) {
        do {
            random.nextBytes(data);
        } while (isAllZeros(data));
        onMutation(false);
    }

    /**
     * Reads {@link #getHexLength()} hex characters starting at {@code offset}.
     * The caller is responsible for validating the input, see {@link HexUtils#isLowerCaseHex(String, int, int)}.
     */
    public void fromHexString(String hexEncodedString, int offset) {
        HexUtils.nextBytes(hexEncodedString, offset, data);
        onMutation(isAllZeros(data));
    }

    public void copyFrom(Id other) {
        System.arraycopy(other.data, 0, data, 0, data.length);
        this.cachedStringRepresentation = other.cachedStringRepresentation;
        this.empty = other.empty;
    }

    private void onMutation(boolean empty) {
        cachedStringRepresentation = null;
        this.empty = empty;
    }

    private static boolean isAllZeros(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return empty;
    }

    /**
     * @return the length of the hex representation of this id
     */
    public int getHexLength() {
        return data.length * 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Id that = (Id) o;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        String s = cachedStringRepresentation;
        if (s == null) {
            s = cachedStringRepresentation = HexUtils.bytesToHex(data);
        }
        return s;
    }

    public void writeAsHex(StringBuilder sb) {
        HexUtils.writeBytesAsHex(data, sb);
    }
}
