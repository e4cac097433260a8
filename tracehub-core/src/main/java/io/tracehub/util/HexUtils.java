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
package io.tracehub.util;

public class HexUtils {

    private final static char[] hexArray = "0123456789abcdef".toCharArray();

    private HexUtils() {
        // only static utility methods, don't instantiate
    }

    /**
     * Converts a byte array to a hex encoded (aka base 16 encoded) string
     *
     * @param bytes The input byte array.
     * @return A lower case hex encoded string representation of the byte array.
     */
    public static String bytesToHex(byte[] bytes) {
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        writeBytesAsHex(bytes, sb);
        return sb.toString();
    }

    public static void writeBytesAsHex(byte[] bytes, StringBuilder sb) {
        for (int i = 0; i < bytes.length; i++) {
            writeByteAsHex(bytes[i], sb);
        }
    }

    public static void writeByteAsHex(byte b, StringBuilder sb) {
        int v = b & 0xFF;
        sb.append(hexArray[v >>> 4]);
        sb.append(hexArray[v & 0x0F]);
    }

    public static byte getNextByte(String hexEncodedString, int offset) {
        return (byte) ((Character.digit(hexEncodedString.charAt(offset), 16) << 4)
            + Character.digit(hexEncodedString.charAt(offset + 1), 16));
    }

    public static void nextBytes(String hexEncodedString, int offset, byte[] bytes) {
        for (int i = 0; i < bytes.length * 2; i += 2) {
            bytes[i / 2] = getNextByte(hexEncodedString, offset + i);
        }
    }

    /**
     * Checks that {@code length} characters starting at {@code offset} are lower case hex digits.
     * Upper case digits are rejected as ids are always rendered in lower case.
     */
    public static boolean isLowerCaseHex(String s, int offset, int length) {
        if (offset < 0 || offset + length > s.length()) {
            return false;
        }
        for (int i = offset; i < offset + length; i++) {
            final char c = s.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code true} if the whole string consists of exactly {@code length} lower case hex digits
     */
    public static boolean isLowerCaseHex(String s, int length) {
        return s.length() == length && isLowerCaseHex(s, 0, length);
    }
}
