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

/**
 * Argument checks shared by the DigestKit modules.
 */
public final class ObjectUtil {

    private static final int INT_ZERO = 0;

    private ObjectUtil() {
    }

    /**
     * Checks that the given argument is not null. If it is, throws {@link NullPointerException}.
     * Otherwise, returns the argument.
     */
    public static <T> T checkNotNull(T arg, String text) {
        if (arg == null) {
            throw new NullPointerException(text);
        }
        return arg;
    }

    /**
     * Checks that the given argument is strictly positive. If it is not, throws {@link IllegalArgumentException}.
     * Otherwise, returns the argument.
     */
    public static int checkPositive(int i, String name) {
        if (i <= INT_ZERO) {
            throw new IllegalArgumentException(name + " : " + i + " (expected: > 0)");
        }
        return i;
    }

    /**
     * Checks that the given argument is in range. If it is not, throws {@link IllegalArgumentException}.
     * Otherwise, returns the argument.
     */
    public static int checkInRange(int i, int start, int end, String name) {
        if (i < start || i > end) {
            throw new IllegalArgumentException(name + ": " + i + " (expected: " + start + "-" + end + ")");
        }
        return i;
    }

    /**
     * Checks that {@code array} is not null and that the range {@code [offset, offset + length)} lies
     * inside it. Throws {@link NullPointerException} or {@link IndexOutOfBoundsException} respectively.
     * Otherwise, returns the array.
     */
    public static byte[] checkRange(byte[] array, int offset, int length, String name) {
        checkNotNull(array, name);
        if (MathUtil.isOutOfBounds(offset, length, array.length)) {
            throw new IndexOutOfBoundsException(name + ": offset " + offset + ", length " + length
                    + " (expected: 0 <= offset <= offset + length <= " + array.length + ')');
        }
        return array;
    }
}
