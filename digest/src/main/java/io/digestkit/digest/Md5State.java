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

/**
 * The 128-bit chaining value carried between MD5 blocks, held as four 32-bit words.
 * <p>
 * Instances are immutable. All arithmetic on the words wraps modulo 2<sup>32</sup>.
 */
final class Md5State {

    private static final Md5State INITIAL = new Md5State(
            Md5Constants.INIT_A, Md5Constants.INIT_B, Md5Constants.INIT_C, Md5Constants.INIT_D);

    private final int a;
    private final int b;
    private final int c;
    private final int d;

    Md5State(int a, int b, int c, int d) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /**
     * Returns the standard starting chaining value.
     */
    static Md5State initial() {
        return INITIAL;
    }

    int a() {
        return a;
    }

    int b() {
        return b;
    }

    int c() {
        return c;
    }

    int d() {
        return d;
    }

    /**
     * Serializes A, B, C and D in that order, each little-endian.
     */
    byte[] toDigest() {
        byte[] out = new byte[Md5Constants.DIGEST_LENGTH];
        setIntLE(out, 0, a);
        setIntLE(out, 4, b);
        setIntLE(out, 8, c);
        setIntLE(out, 12, d);
        return out;
    }

    private static void setIntLE(byte[] out, int index, int value) {
        out[index] = (byte) value;
        out[index + 1] = (byte) (value >>> 8);
        out[index + 2] = (byte) (value >>> 16);
        out[index + 3] = (byte) (value >>> 24);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Md5State)) {
            return false;
        }
        Md5State that = (Md5State) o;
        return a == that.a && b == that.b && c == that.c && d == that.d;
    }

    @Override
    public int hashCode() {
        int result = a;
        result = 31 * result + b;
        result = 31 * result + c;
        result = 31 * result + d;
        return result;
    }

    @Override
    public String toString() {
        return String.format("Md5State(a: %08x, b: %08x, c: %08x, d: %08x)", a, b, c, d);
    }
}
