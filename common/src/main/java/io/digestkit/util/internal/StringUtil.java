/*
 * Copyright 2026 The DigestKit Project
 *
 * The DigestKit Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.digestkit.util.internal;

import static io.digestkit.util.internal.ObjectUtil.checkNotNull;

/**
 * String utility class.
 */
public final class StringUtil {

    private static final String[] BYTE2HEX_PAD = new String[256];
    private static final char PACKAGE_SEPARATOR_CHAR = '.';

    static {
        // Generate the lookup table that converts a byte into a 2-digit hexadecimal integer.
        for (int i = 0; i < BYTE2HEX_PAD.length; i++) {
            String str = Integer.toHexString(i);
            BYTE2HEX_PAD[i] = i > 0xf ? str : ('0' + str);
        }
    }

    private StringUtil() {
        // Unused.
    }

    /**
     * Converts the specified byte value into a 2-digit lowercase hexadecimal integer.
     */
    public static String byteToHexStringPadded(int value) {
        return BYTE2HEX_PAD[value & 0xff];
    }

    /**
     * Converts the specified byte array into a lowercase hexadecimal value, two digits per byte,
     * high nibble first, with no separators.
     */
    public static String toHexStringPadded(byte[] src) {
        return toHexStringPadded(src, 0, checkNotNull(src, "src").length);
    }

    /**
     * Converts the specified byte array into a lowercase hexadecimal value, two digits per byte.
     */
    public static String toHexStringPadded(byte[] src, int offset, int length) {
        ObjectUtil.checkRange(src, offset, length, "src");
        StringBuilder dst = new StringBuilder(length << 1);
        final int end = offset + length;
        for (int i = offset; i < end; i++) {
            dst.append(byteToHexStringPadded(src[i]));
        }
        return dst.toString();
    }

    /**
     * The shortcut to {@link #simpleClassName(Class) simpleClassName(o.getClass())}.
     */
    public static String simpleClassName(Object o) {
        if (o == null) {
            return "null_object";
        } else {
            return simpleClassName(o.getClass());
        }
    }

    /**
     * Generates a simplified name from a {@link Class}.  Similar to {@link Class#getSimpleName()}, but it works fine
     * with anonymous classes.
     */
    public static String simpleClassName(Class<?> clazz) {
        String className = checkNotNull(clazz, "clazz").getName();
        final int lastDotIdx = className.lastIndexOf(PACKAGE_SEPARATOR_CHAR);
        if (lastDotIdx > -1) {
            return className.substring(lastDotIdx + 1);
        }
        return className;
    }
}
