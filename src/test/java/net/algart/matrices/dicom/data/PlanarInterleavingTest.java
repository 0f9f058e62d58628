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

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class PlanarInterleavingTest {
    @Test
    public void testPlanarToInterleaved() {
        final byte[] planar = {1, 2, 3, 4, 11, 12, 13, 14, 21, 22, 23, 24};
        final byte[] interleaved = PlanarInterleaving.planarToInterleaved24(planar, 4);
        assertArrayEquals(new byte[]{1, 11, 21, 2, 12, 22, 3, 13, 23, 4, 14, 24}, interleaved);
        assertArrayEquals(planar, toPlanar(interleaved, 3, 4));
    }

    @Test
    public void testExtraBytesIgnored() {
        final byte[] planar = {1, 2, 11, 12, 21, 22, 99, 99};
        assertArrayEquals(new byte[]{1, 11, 21, 2, 12, 22}, PlanarInterleaving.planarToInterleaved24(planar, 2));
    }

    @Test
    public void testSeveralChannels() {
        final Random rnd = new Random(11);
        for (int channels = 1; channels <= 5; channels++) {
            final byte[] bytes = new byte[channels * 1001];
            rnd.nextBytes(bytes);
            final byte[] interleaved = PlanarInterleaving.toInterleavedBytes(bytes, channels, 1001);
            for (int i = 0; i < 1001; i++) {
                for (int c = 0; c < channels; c++) {
                    assertEquals(bytes[c * 1001 + i], interleaved[i * channels + c]);
                }
            }
            assertArrayEquals(bytes, toPlanar(interleaved, channels, 1001));
        }
    }

    @Test
    public void testTooShort() {
        assertThrows(IllegalArgumentException.class,
                () -> PlanarInterleaving.planarToInterleaved24(new byte[8], 3));
        assertThrows(IllegalArgumentException.class,
                () -> PlanarInterleaving.toInterleavedBytes(new byte[8], 0, 3));
    }

    private static byte[] toPlanar(byte[] interleaved, int numberOfChannels, int numberOfPixels) {
        final byte[] result = new byte[numberOfChannels * numberOfPixels];
        for (int i = 0, disp = 0; i < numberOfPixels; i++) {
            for (int c = 0; c < numberOfChannels; c++, disp++) {
                result[c * numberOfPixels + i] = interleaved[disp];
            }
        }
        return result;
    }
}
