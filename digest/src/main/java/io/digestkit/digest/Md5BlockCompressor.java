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
import static io.digestkit.digest.Md5Constants.ROUND_CONSTANTS;
import static io.digestkit.digest.Md5Constants.SHIFTS;

/**
 * The MD5 compression function: folds one 64-byte block into a chaining value.
 * <p>
 * The block is read as sixteen little-endian words and run through 64 operations in four rounds of
 * sixteen. Each round has its own boolean function and its own order of visiting the message words.
 * The working registers are finally added back into the incoming state, which is what makes the
 * construction chain.
 */
final class Md5BlockCompressor {

    private static final int WORDS_PER_BLOCK = BLOCK_LENGTH / 4;
    private static final int OPERATIONS = 64;

    private Md5BlockCompressor() {
        // Unused
    }

    /**
     * Returns the chaining value obtained by compressing the block at
     * {@code block[offset .. offset + 64)} into {@code state}. Neither argument is modified.
     *
     * @throws IndexOutOfBoundsException if fewer than 64 bytes are available at {@code offset}
     */
    static Md5State compress(Md5State state, byte[] block, int offset) {
        ObjectUtil.checkNotNull(state, "state");
        ObjectUtil.checkRange(block, offset, BLOCK_LENGTH, "block");

        final int[] words = new int[WORDS_PER_BLOCK];
        for (int i = 0; i < WORDS_PER_BLOCK; i++) {
            words[i] = getIntLE(block, offset + (i << 2));
        }

        int a = state.a();
        int b = state.b();
        int c = state.c();
        int d = state.d();

        for (int i = 0; i < OPERATIONS; i++) {
            final int f;
            final int g;
            switch (i >>> 4) {
                case 0:
                    f = (b & c) | (~b & d);
                    g = i;
                    break;
                case 1:
                    f = (b & d) | (c & ~d);
                    g = (5 * i + 1) & 0xf;
                    break;
                case 2:
                    f = b ^ c ^ d;
                    g = (3 * i + 5) & 0xf;
                    break;
                default:
                    f = c ^ (b | ~d);
                    g = (7 * i) & 0xf;
                    break;
            }
            final int t = a + f + words[g] + ROUND_CONSTANTS[i];
            a = d;
            d = c;
            c = b;
            b += Integer.rotateLeft(t, SHIFTS[i]);
        }

        return new Md5State(state.a() + a, state.b() + b, state.c() + c, state.d() + d);
    }

    private static int getIntLE(byte[] block, int index) {
        return block[index] & 0xff
                | (block[index + 1] & 0xff) << 8
                | (block[index + 2] & 0xff) << 16
                | block[index + 3] << 24;
    }
}
