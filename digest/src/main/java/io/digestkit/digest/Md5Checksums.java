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
import io.digestkit.util.internal.SystemPropertyUtil;
import io.digestkit.util.internal.logging.InternalLogger;
import io.digestkit.util.internal.logging.InternalLoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Computes MD5 checksums of streams and files by reading them in bounded chunks.
 * <p>
 * Only one chunk is held in memory at a time, so sources of any size can be hashed. The chunk size has
 * no influence on the result. {@link IOException}s raised by the source are propagated unchanged.
 * <p>
 * The default chunk size is read from the {@code io.digestkit.digest.chunkSize} system property.
 */
public final class Md5Checksums {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(Md5Checksums.class);

    static final int DEFAULT_CHUNK_SIZE = 8192;
    private static final int CHUNK_SIZE;

    static {
        CHUNK_SIZE = chunkSize(SystemPropertyUtil.getInt("io.digestkit.digest.chunkSize", DEFAULT_CHUNK_SIZE));

        if (logger.isDebugEnabled()) {
            logger.debug("-Dio.digestkit.digest.chunkSize: {}", CHUNK_SIZE);
        }
    }

    /**
     * Returns {@code configured} if it is a usable chunk size, {@link #DEFAULT_CHUNK_SIZE} otherwise.
     */
    static int chunkSize(int configured) {
        if (configured <= 0) {
            logger.warn("-Dio.digestkit.digest.chunkSize: {} (expected: > 0) - using the default value: {}",
                    configured, DEFAULT_CHUNK_SIZE);
            return DEFAULT_CHUNK_SIZE;
        }
        return configured;
    }

    private Md5Checksums() {
        // Unused
    }

    /**
     * Returns the chunk size used when none is given.
     */
    public static int defaultChunkSize() {
        return CHUNK_SIZE;
    }

    /**
     * Reads {@code in} to its end using the default chunk size. The stream is not closed.
     */
    public static Md5Hash checksum(InputStream in) throws IOException {
        return checksum(in, CHUNK_SIZE);
    }

    /**
     * Reads {@code in} to its end, {@code chunkSize} bytes at most per read. The stream is not closed.
     */
    public static Md5Hash checksum(InputStream in, int chunkSize) throws IOException {
        ObjectUtil.checkNotNull(in, "in");
        ObjectUtil.checkPositive(chunkSize, "chunkSize");

        final Md5Digest digest = new Md5Digest();
        final byte[] chunk = new byte[chunkSize];
        int read;
        while ((read = in.read(chunk, 0, chunkSize)) != -1) {
            digest.update(chunk, 0, read);
        }
        return digest.finish();
    }

    /**
     * Reads the whole of {@code file}.
     */
    public static Md5Hash checksum(Path file) throws IOException {
        ObjectUtil.checkNotNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return checksum(in, CHUNK_SIZE);
        }
    }

    /**
     * Reads the whole of {@code file} and renders its digest as 32 lowercase hexadecimal digits.
     */
    public static String checksumHex(Path file) throws IOException {
        return Md5.toHex(checksum(file));
    }
}
