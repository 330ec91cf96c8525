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
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Md5ChecksumsTest {

    private static final byte[] DATA = new byte[100003];

    static {
        ThreadLocalRandom.current().nextBytes(DATA);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 63, 64, 65, 4096, 1 << 20})
    public void testChunkSizeDoesNotMatter(int chunkSize) throws IOException {
        assertThat(Md5Checksums.checksum(new ByteArrayInputStream(DATA), chunkSize)).isEqualTo(Md5.hash(DATA));
    }

    @Test
    public void testShortReadsAreHandled() throws IOException {
        InputStream trickle = new FilterInputStream(new ByteArrayInputStream(DATA)) {
            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                return super.read(b, off, Math.min(len, 3));
            }
        };
        assertThat(Md5Checksums.checksum(trickle)).isEqualTo(Md5.hash(DATA));
    }

    @Test
    public void testEmptyStream() throws IOException {
        assertThat(Md5Checksums.checksum(new ByteArrayInputStream(new byte[0])).toHex())
                .isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    }

    @Test
    public void testFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("hello.txt");
        Files.write(file, "Hello MD5".getBytes(StandardCharsets.UTF_8));
        assertThat(Md5Checksums.checksumHex(file)).isEqualTo("e5dadf6524624f79c3127e247f04b548");

        Path big = dir.resolve("big.bin");
        Files.write(big, DATA);
        assertThat(Md5Checksums.checksum(big)).isEqualTo(Md5.hash(DATA));
    }

    @Test
    public void testMissingFilePropagates(@TempDir Path dir) {
        assertThatThrownBy(() -> Md5Checksums.checksum(dir.resolve("missing")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    public void testReadFailurePropagates() {
        final IOException failure = new IOException("truncated");
        InputStream broken = new InputStream() {
            private int remaining = 100;

            @Override
            public int read() throws IOException {
                if (remaining-- <= 0) {
                    throw failure;
                }
                return 'x';
            }
        };
        assertThatThrownBy(() -> Md5Checksums.checksum(broken, 16)).isSameAs(failure);
    }

    @Test
    public void testStreamIsNotClosed() throws IOException {
        final boolean[] closed = new boolean[1];
        InputStream in = new ByteArrayInputStream(DATA) {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };
        Md5Checksums.checksum(in);
        assertThat(closed[0]).isFalse();
    }

    @Test
    public void testInvalidArguments() {
        assertThatThrownBy(() -> Md5Checksums.checksum(new ByteArrayInputStream(DATA), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chunkSize");
        assertThatThrownBy(() -> Md5Checksums.checksum((InputStream) null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Md5Checksums.checksum((Path) null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    public void testDefaultChunkSize() {
        assertThat(Md5Checksums.defaultChunkSize()).isEqualTo(Md5Checksums.DEFAULT_CHUNK_SIZE);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, Integer.MIN_VALUE})
    public void testNonPositiveChunkSizeFallsBackToDefault(int configured) {
        assertThat(Md5Checksums.chunkSize(configured)).isEqualTo(Md5Checksums.DEFAULT_CHUNK_SIZE);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4096, 1 << 20})
    public void testPositiveChunkSizeIsKept(int configured) {
        assertThat(Md5Checksums.chunkSize(configured)).isEqualTo(configured);
    }
}
