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

package net.algart.matrices.dicom;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BitDepthTest {
    @Test
    public void testValid() {
        final BitDepth bitDepth = BitDepth.of(16, 12);
        assertEquals(16, bitDepth.bitsAllocated());
        assertEquals(12, bitDepth.bitsStored());
        assertEquals(11, bitDepth.highBit());
        assertEquals(4, bitDepth.unusedBits());
        assertTrue(bitDepth.isStandardHighBit());
        assertEquals(BitDepth.of(16, 12, 11), bitDepth);
        assertEquals(BitDepth.of(16, 12, 11).hashCode(), bitDepth.hashCode());
        assertFalse(BitDepth.of(16, 12, 15).isStandardHighBit());
        assertEquals(BitDepth.of(32, 32, 31), BitDepth.full(32));
        assertEquals(BitDepth.of(1, 1, 0), BitDepth.full(1));
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> BitDepth.of(0, 0));
        assertThrows(IllegalArgumentException.class, () -> BitDepth.of(33, 16));
        assertThrows(IllegalArgumentException.class, () -> BitDepth.of(8, 9));
        assertThrows(IllegalArgumentException.class, () -> BitDepth.of(16, 12, 16));
        assertThrows(IllegalArgumentException.class, () -> BitDepth.of(16, 12, -1));
    }

    @Test
    public void testFrameDescription() throws UnsupportedPixelFormatException {
        final FrameDescription description = FrameDescription.newBuilder()
                .setSizes(10, 20)
                .setBits(16, 12)
                .setHighBit(15)
                .build();
        assertEquals(BitDepth.of(16, 12, 15), description.bitDepth());
        assertEquals(BitDepth.of(16, 12, 11), FrameDescription.monochrome(1, 1, 16, 12, true).bitDepth());
        assertEquals(FrameDescription.monochrome(3, 4, 8, 8, false),
                FrameDescription.newBuilder().setSizes(3, 4).build());
        assertThrows(IllegalArgumentException.class, () -> FrameDescription.newBuilder().setSizes(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> FrameDescription.newBuilder().setSamplesPerPixel(0));
        assertThrows(NullPointerException.class, () -> FrameDescription.newBuilder().setByteOrder(null));
    }
}
