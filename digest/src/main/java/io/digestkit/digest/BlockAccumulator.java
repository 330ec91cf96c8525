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

import io.digestkit.util.internal.EmptyArrays;
import io.digestkit.util.internal.ObjectUtil;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static io.digestkit.digest.Md5Constants.BLOCK_LENGTH;

/**
 * Cuts an input stream of arbitrary chunks into 64-byte blocks.
 * <p>
 * Between calls at most 63 bytes are held back; everything that completes a block is handed to the
 * {@link BlockProcessor} immediately and in order. Blocks lying wholly inside the caller's array are
 * passed without copying. The accumulator also counts the message length in bits, modulo
 * 2<sup>64</sup>.
 */
final class BlockAccumulator {

    private final byte[] pending = new byte[BLOCK_LENGTH];
    private int pendingLength;
    private long bitCount;

    BlockAccumulator() {
    }

    private BlockAccumulator(BlockAccumulator other) {
        System.arraycopy(other.pending, 0, pending, 0, other.pendingLength);
        pendingLength = other.pendingLength;
        bitCount = other.bitCount;
    }

    /**
     * Returns an independent accumulator holding the same pending bytes and bit count.
     */
    BlockAccumulator copy() {
        return new BlockAccumulator(this);
    }

    void accumulate(byte value, BlockProcessor processor) {
        bitCount += Byte.SIZE;
        pending[pendingLength++] = value;
        if (pendingLength == BLOCK_LENGTH) {
            flushPending(processor);
        }
    }

    void accumulate(byte[] src, int offset, int length, BlockProcessor processor) {
        ObjectUtil.checkRange(src, offset, length, "src");
        bitCount += (long) length << 3;
        append(src, offset, length, processor);
    }

    /**
     * Consumes all remaining bytes of {@code src}, leaving its position at its limit.
     */
    void accumulate(ByteBuffer src, BlockProcessor processor) {
        ObjectUtil.checkNotNull(src, "src");
        final int length = src.remaining();
        if (src.hasArray()) {
            accumulate(src.array(), src.arrayOffset() + src.position(), length, processor);
            src.position(src.limit());
            return;
        }

        bitCount += (long) length << 3;
        while (src.hasRemaining()) {
            int n = Math.min(BLOCK_LENGTH - pendingLength, src.remaining());
            src.get(pending, pendingLength, n);
            pendingLength += n;
            if (pendingLength == BLOCK_LENGTH) {
                flushPending(processor);
            }
        }
    }

    /**
     * Appends the message trailer produced by {@link Md5Padder}. The trailer is not counted as message
     * bits and must leave no pending bytes behind.
     */
    void appendTrailer(byte[] trailer, BlockProcessor processor) {
        append(trailer, 0, trailer.length, processor);
        if (pendingLength != 0) {
            throw new IllegalStateException(
                    "trailer of " + trailer.length + " bytes left " + pendingLength + " bytes pending");
        }
    }

    private void append(byte[] src, int offset, int length, BlockProcessor processor) {
        if (pendingLength > 0) {
            int n = Math.min(BLOCK_LENGTH - pendingLength, length);
            System.arraycopy(src, offset, pending, pendingLength, n);
            pendingLength += n;
            offset += n;
            length -= n;
            if (pendingLength < BLOCK_LENGTH) {
                return;
            }
            flushPending(processor);
        }

        while (length >= BLOCK_LENGTH) {
            processor.processBlock(src, offset);
            offset += BLOCK_LENGTH;
            length -= BLOCK_LENGTH;
        }

        if (length > 0) {
            System.arraycopy(src, offset, pending, 0, length);
            pendingLength = length;
        }
    }

    private void flushPending(BlockProcessor processor) {
        processor.processBlock(pending, 0);
        pendingLength = 0;
    }

    int pendingLength() {
        return pendingLength;
    }

    byte[] pendingBytes() {
        return pendingLength == 0 ? EmptyArrays.EMPTY_BYTES : Arrays.copyOf(pending, pendingLength);
    }

    long bitCount() {
        return bitCount;
    }
}
