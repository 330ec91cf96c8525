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

import java.nio.ByteBuffer;

/**
 * Static entry points for MD5.
 * <p>
 * The one-shot {@code hash} methods are plain compositions of {@link Md5Digest#update} and
 * {@link Md5Digest#finish()}, so they always agree with any incremental feeding of the same bytes.
 */
public final class Md5 {

    private Md5() {
        // Unused
    }

    /**
     * Creates an open {@link Md5Digest}.
     */
    public static Md5Digest newDigest() {
        return new Md5Digest();
    }

    public static Md5Hash hash(byte[] data) {
        return newDigest().update(data).finish();
    }

    public static Md5Hash hash(byte[] data, int offset, int length) {
        return newDigest().update(data, offset, length).finish();
    }

    /**
     * Hashes the remaining bytes of {@code data}, consuming them.
     */
    public static Md5Hash hash(ByteBuffer data) {
        return newDigest().update(data).finish();
    }

    /**
     * Renders {@code digest} as 32 lowercase hexadecimal digits.
     */
    public static String toHex(Md5Hash digest) {
        return ObjectUtil.checkNotNull(digest, "digest").toHex();
    }

    /**
     * Renders a raw 16-byte digest as 32 lowercase hexadecimal digits.
     *
     * @throws IllegalArgumentException if {@code digest} is not 16 bytes long
     */
    public static String toHex(byte[] digest) {
        return Md5Hash.wrap(digest).toHex();
    }
}
