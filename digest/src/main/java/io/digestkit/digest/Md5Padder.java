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

import static io.digestkit.digest.Md5Constants.BLOCK_LENGTH;
import static io.digestkit.digest.Md5Constants.LENGTH_OFFSET;

/**
 * Builds the trailer that closes an MD5 message: a single {@code 0x80} byte, zero fill up to offset 56
 * of a block, then the message length in bits as a little-endian 64-bit integer.
 */
final class Md5Padder {

    private static final int LENGTH_SUFFIX = BLOCK_LENGTH - LENGTH_OFFSET;

    private Md5Padder() {
        // Unused
    }

    /**
     * Returns the bytes to append after {@code pendingLength} buffered bytes so that the stream ends
     * on a block boundary. The result completes one block when {@code pendingLength <= 55}, two
     * otherwise.
     *
     * @param bitCount      total number of message bits, modulo 2<sup>64</sup>
     * @param pendingLength bytes of the message not yet compressed, {@code 0..63}
     */
    static byte[] padding(long bitCount, int pendingLength) {
        ObjectUtil.checkInRange(pendingLength, 0, BLOCK_LENGTH - 1, "pendingLength");

        final int fillLength = pendingLength < LENGTH_OFFSET
                ? LENGTH_OFFSET - pendingLength
                : BLOCK_LENGTH + LENGTH_OFFSET - pendingLength;
        final byte[] padding = new byte[fillLength + LENGTH_SUFFIX];
        padding[0] = (byte) 0x80;
        for (int i = 0; i < LENGTH_SUFFIX; i++) {
            padding[fillLength + i] = (byte) (bitCount >>> (i << 3));
        }
        return padding;
    }
}
