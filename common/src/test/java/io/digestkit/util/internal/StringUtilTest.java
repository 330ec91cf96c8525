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
package io.digestkit.util.internal;

import org.junit.jupiter.api.Test;

import static io.digestkit.util.internal.StringUtil.byteToHexStringPadded;
import static io.digestkit.util.internal.StringUtil.simpleClassName;
import static io.digestkit.util.internal.StringUtil.toHexStringPadded;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StringUtilTest {

    @Test
    public void testByteToHexStringPadded() {
        assertThat(byteToHexStringPadded(0), is("00"));
        assertThat(byteToHexStringPadded(0x0f), is("0f"));
        assertThat(byteToHexStringPadded(0xab), is("ab"));
        assertThat(byteToHexStringPadded((byte) -1), is("ff"));
    }

    @Test
    public void testToHexStringPadded() {
        assertThat(toHexStringPadded(new byte[]{0}), is("00"));
        assertThat(toHexStringPadded(new byte[]{1}), is("01"));
        assertThat(toHexStringPadded(new byte[]{0, 0}), is("0000"));
        assertThat(toHexStringPadded(new byte[]{1, 0}), is("0100"));
        assertThat(toHexStringPadded(new byte[]{(byte) 0xd4, 0x1d, (byte) 0x8c}), is("d41d8c"));
        assertThat(toHexStringPadded(EmptyArrays.EMPTY_BYTES), is(""));
    }

    @Test
    public void testToHexStringPaddedRange() {
        byte[] src = {0x00, 0x12, 0x34, 0x56, 0x78};
        assertThat(toHexStringPadded(src, 1, 3), is("123456"));
        assertThat(toHexStringPadded(src, 5, 0), is(""));
        assertThrows(IndexOutOfBoundsException.class, () -> toHexStringPadded(src, 3, 3));
    }

    @Test
    public void testSimpleClassName() {
        assertEquals("StringUtilTest", simpleClassName(this));
        assertEquals("null_object", simpleClassName((Object) null));
        assertEquals("String", simpleClassName(String.class));
    }
}
