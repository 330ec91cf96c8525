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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Md5Test {

    private static byte[] jdkMd5(byte[] data) throws NoSuchAlgorithmException {
        return MessageDigest.getInstance("MD5").digest(data);
    }

    private static byte[] sequence(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) i;
        }
        return bytes;
    }

    @Test
    public void testHashOfText() {
        assertThat(Md5.toHex(Md5.hash("Hello MD5".getBytes(StandardCharsets.UTF_8))))
                .isEqualTo("e5dadf6524624f79c3127e247f04b548");
        assertThat(Md5.hash(new byte[0]).toHex()).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 55, 56, 57, 63, 64, 65, 119, 120, 127, 128, 129, 1000})
    public void testPaddingBoundariesAgainstJdk(int length) throws Exception {
        byte[] data = sequence(length);
        assertThat(Md5.hash(data).toByteArray()).isEqualTo(jdkMd5(data));
    }

    @Test
    public void testKnownBoundaryDigests() {
        assertThat(Md5.hash(sequence(55)).toHex()).isEqualTo("6912ee65fff2d9f9ce2508cddf8bcda0");
        assertThat(Md5.hash(sequence(56)).toHex()).isEqualTo("51fdd1acda72405dfdfa03fcb85896d7");
        assertThat(Md5.hash(sequence(63)).toHex()).isEqualTo("48a6295221902e8e0938f773a7185e72");
        assertThat(Md5.hash(sequence(64)).toHex()).isEqualTo("b2d3f56bc197fd985d5965079b5e7148");
        assertThat(Md5.hash(sequence(65)).toHex()).isEqualTo("8bd7053801c768420faf816fadba971c");
    }

    @Test
    public void testRandomInputsAgainstJdk() throws Exception {
        Random random = new Random(0x5eed);
        for (int i = 0; i < 100; i++) {
            byte[] data = new byte[random.nextInt(2048)];
            random.nextBytes(data);
            assertThat(Md5.hash(data).toByteArray()).isEqualTo(jdkMd5(data));
        }
    }

    @Test
    public void testHashRangeAndBuffer() {
        byte[] data = sequence(200);
        byte[] middle = new byte[100];
        System.arraycopy(data, 50, middle, 0, 100);

        Md5Hash expected = Md5.hash(middle);
        assertThat(Md5.hash(data, 50, 100)).isEqualTo(expected);

        ByteBuffer buffer = ByteBuffer.wrap(data, 50, 100);
        assertThat(Md5.hash(buffer)).isEqualTo(expected);
        assertThat(buffer.position()).isEqualTo(150);
    }

    @Test
    public void testAvalanche() {
        Random random = new Random(42);
        long flippedBits = 0;
        int trials = 2000;
        for (int t = 0; t < trials; t++) {
            byte[] data = new byte[1 + random.nextInt(200)];
            random.nextBytes(data);
            byte[] before = Md5.hash(data).toByteArray();

            int bit = random.nextInt(data.length * 8);
            data[bit >>> 3] ^= (byte) (1 << (bit & 7));
            byte[] after = Md5.hash(data).toByteArray();

            int changed = 0;
            for (int i = 0; i < before.length; i++) {
                changed += Integer.bitCount((before[i] ^ after[i]) & 0xff);
            }
            assertThat(changed).isPositive();
            flippedBits += changed;
        }
        double mean = (double) flippedBits / trials;
        // 128 output bits, half of them expected to change; standard error of the mean is about 0.13
        assertThat(mean).isBetween(62.0, 66.0);
    }

    @Test
    public void testToHexOfRawDigest() {
        byte[] raw = new byte[16];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) (i * 17);
        }
        assertThat(Md5.toHex(raw)).isEqualTo("00112233445566778899aabbccddeeff");
        assertThatThrownBy(() -> Md5.toHex(new byte[15])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Md5.toHex((Md5Hash) null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void testNewDigestIsOpen() {
        Md5Digest digest = Md5.newDigest();
        assertThat(digest.isFinished()).isFalse();
        assertThat(digest.state()).isEqualTo(Md5State.initial());
    }
}
