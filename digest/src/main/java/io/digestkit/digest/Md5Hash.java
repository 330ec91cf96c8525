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
package io.digestkit.digest;

import io.digestkit.util.internal.ObjectUtil;
import io.digestkit.util.internal.StringUtil;

import java.util.Arrays;

/**
 * A finished 16-byte MD5 digest.
 * <p>
 * The bytes are A, B, C and D of the final chaining value, each little-endian. Instances are
 * immutable; {@link #toByteArray()} hands out copies.
 */
public final class Md5Hash {

    /**
     * Number of bytes in a digest.
     */
    public static final int LENGTH = Md5Constants.DIGEST_LENGTH;

    private final byte[] bytes;

    // Takes ownership of the array.
    Md5Hash(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a digest from a copy of {@code bytes}.
     *
     * @throws IllegalArgumentException if {@code bytes} is not exactly {@value #LENGTH} bytes long
     */
    public static Md5Hash wrap(byte[] bytes) {
        ObjectUtil.checkNotNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("bytes.length: " + bytes.length + " (expected: " + LENGTH + ')');
        }
        return new Md5Hash(bytes.clone());
    }

    /**
     * Returns a copy of the digest bytes.
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Renders the digest as 32 lowercase hexadecimal digits, two per byte, high nibble first, without
     * separators or prefix.
     */
    public String toHex() {
        return StringUtil.toHexStringPadded(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Md5Hash && Arrays.equals(bytes, ((Md5Hash) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
