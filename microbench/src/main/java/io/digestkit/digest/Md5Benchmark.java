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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

import java.nio.ByteBuffer;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

@Threads(1)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 8, time = 1)
@State(Scope.Benchmark)
public class Md5Benchmark {

    @Param({ "16", "64", "1024", "65536" })
    int size;

    @Param({ "0" })
    int seed;

    byte[] data;
    ByteBuffer direct;

    @Setup(Level.Trial)
    public void init() {
        final SplittableRandom random = new SplittableRandom(seed);
        data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) random.nextInt(256);
        }
        direct = ByteBuffer.allocateDirect(size);
        direct.put(data).flip();
    }

    @Benchmark
    public Md5Hash oneShot() {
        return Md5.hash(data);
    }

    @Benchmark
    public Md5Hash unalignedChunks() {
        Md5Digest digest = Md5.newDigest();
        for (int offset = 0; offset < size; offset += 37) {
            digest.update(data, offset, Math.min(37, size - offset));
        }
        return digest.finish();
    }

    @Benchmark
    public Md5Hash directBuffer() {
        return Md5.hash(direct.duplicate());
    }
}
