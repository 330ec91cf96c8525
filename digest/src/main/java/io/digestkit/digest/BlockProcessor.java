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
 * Receives complete blocks from a {@link BlockAccumulator}.
 */
interface BlockProcessor {

    /**
     * Processes the 64 bytes at {@code block[offset .. offset + 64)}. The array may belong to the caller
     * of the accumulator and must be neither retained nor modified.
     */
    void processBlock(byte[] block, int offset);
}
