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

import java.nio.ByteBuffer;

/**
 * A streaming MD5 computation.
 * <p>
 * A new instance is open: it accepts any number of {@code update} calls, in any chunking, and the
 * result depends only on the concatenation of the bytes in call order. {@link #finish()} pads the
 * message, compresses the final block or blocks and closes the instance for good. The digest stays
 * available from {@link #result()}; any further {@code update}, {@code finish} or {@code copy} raises
 * an {@link IllegalDigestStateException} and leaves it untouched.
 * <p>
 * Instances are not thread-safe. Each one belongs to a single, ordered sequence of calls.
 *
 * <pre>
 * Md5Digest digest = new Md5Digest();
 * digest.update(header).update(body);
 * String hex = digest.finish().toHex();
 * </pre>
 */
public final class Md5Digest {

    private final BlockAccumulator accumulator;
    private final BlockProcessor compressor = new BlockProcessor() {
        @Override
        public void processBlock(byte[] block, int offset) {
            state = Md5BlockCompressor.compress(state, block, offset);
        }
    };

    private Md5State state;
    private Md5Hash result;

    /**
     * Creates an open digest with the standard initial chaining value and no input.
     */
    public Md5Digest() {
        this(Md5State.initial(), new BlockAccumulator());
    }

    private Md5Digest(Md5State state, BlockAccumulator accumulator) {
        this.state = state;
        this.accumulator = accumulator;
    }

    /**
     * Feeds a single byte.
     */
    public Md5Digest update(byte value) {
        ensureOpen("update");
        accumulator.accumulate(value, compressor);
        return this;
    }

    /**
     * Feeds all bytes of {@code data}.
     */
    public Md5Digest update(byte[] data) {
        ObjectUtil.checkNotNull(data, "data");
        return update(data, 0, data.length);
    }

    /**
     * Feeds {@code length} bytes of {@code data} starting at {@code offset}.
     *
     * @throws IndexOutOfBoundsException if the range does not lie inside {@code data}
     */
    public Md5Digest update(byte[] data, int offset, int length) {
        ensureOpen("update");
        accumulator.accumulate(data, offset, length, compressor);
        return this;
    }

    /**
     * Feeds the remaining bytes of {@code data}. On return its position equals its limit.
     */
    public Md5Digest update(ByteBuffer data) {
        ensureOpen("update");
        accumulator.accumulate(data, compressor);
        return this;
    }

    /**
     * Completes the computation and returns the digest. The instance is finished afterwards.
     *
     * @throws IllegalDigestStateException if this digest was already finished
     */
    public Md5Hash finish() {
        ensureOpen("finish");
        byte[] trailer = Md5Padder.padding(accumulator.bitCount(), accumulator.pendingLength());
        accumulator.appendTrailer(trailer, compressor);
        result = new Md5Hash(state.toDigest());
        return result;
    }

    /**
     * Returns the digest produced by {@link #finish()}.
     *
     * @throws IllegalDigestStateException if this digest is still open
     */
    public Md5Hash result() {
        if (result == null) {
            throw new IllegalDigestStateException("digest not finished yet");
        }
        return result;
    }

    /**
     * Returns {@code true} once {@link #finish()} has completed.
     */
    public boolean isFinished() {
        return result != null;
    }

    /**
     * Returns an open digest that has seen exactly the bytes this one has seen so far. The two evolve
     * independently afterwards, so a prefix digest can be taken without disturbing this instance.
     *
     * @throws IllegalDigestStateException if this digest was already finished
     */
    public Md5Digest copy() {
        ensureOpen("copy");
        return new Md5Digest(state, accumulator.copy());
    }

    /**
     * Number of message bits consumed so far, modulo 2<sup>64</sup>.
     */
    public long bitCount() {
        return accumulator.bitCount();
    }

    /**
     * Number of bytes buffered towards the next block, {@code 0..63}.
     */
    public int pendingLength() {
        return accumulator.pendingLength();
    }

    Md5State state() {
        return state;
    }

    private void ensureOpen(String operation) {
        if (result != null) {
            throw new IllegalDigestStateException(
                    operation + "() called on a finished digest (result: " + result + ')');
        }
    }

    @Override
    public String toString() {
        return StringUtil.simpleClassName(this) + "(bitCount: " + accumulator.bitCount()
                + ", pending: " + accumulator.pendingLength()
                + (result == null ? ", open)" : ", result: " + result + ')');
    }
}
