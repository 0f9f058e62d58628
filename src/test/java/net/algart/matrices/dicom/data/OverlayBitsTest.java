/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.dicom.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OverlayBitsTest {
    @Test
    public void testLeastSignificantBitFirst() {
        // bits 0, 2, 7 of the first byte, bit 0 of the second
        final byte[] packed = {(byte) 0b1000_0101, 0b0000_0001};
        final byte[] expanded = OverlayBits.expandBits(packed, 3, 3);
        assertArrayEquals(new byte[]{1, 0, 1, 0, 0, 0, 0, 1, 1}, expanded);
    }

    @Test
    public void testSingleByte() {
        assertArrayEquals(new byte[]{1, 0, 1, 1, 0, 0, 1, 0},
                OverlayBits.expandBits(new byte[]{0b0100_1101}, 8, 1));
        assertArrayEquals(new byte[]{1, 0, 1, 1, 0},
                OverlayBits.expandBits(new byte[]{0b0100_1101}, 5, 1));
    }

    @Test
    public void testUnalignedRows() {
        final byte[] pixels = {1, 0, 0, 1, 1, 0, 1, 0, 0, 0, 1, 1};
        final byte[] packed = pack(pixels);
        assertArrayEquals(new byte[]{0x59, 0x0C}, packed);
        // rows of 4 and 3 pixels do not start at byte boundaries
        assertArrayEquals(pixels, OverlayBits.expandBits(packed, 4, 3));
        assertArrayEquals(pixels, OverlayBits.expandBits(packed, 3, 4));
    }

    @Test
    public void testTooShort() {
        assertThrows(IllegalArgumentException.class, () -> OverlayBits.expandBits(new byte[1], 3, 3));
        assertThrows(IllegalArgumentException.class, () -> OverlayBits.expandBits(new byte[1], -1, 3));
        assertEquals(0, OverlayBits.expandBits(new byte[0], 0, 5).length);
    }

    private static byte[] pack(byte[] pixels) {
        final byte[] result = new byte[(pixels.length + 7) / 8];
        for (int k = 0; k < pixels.length; k++) {
            if (pixels[k] != 0) {
                result[k >>> 3] |= (byte) (1 << (k & 7));
            }
        }
        return result;
    }
}
