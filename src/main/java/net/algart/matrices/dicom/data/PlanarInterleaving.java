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

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatablePArray;

import java.util.Arrays;
import java.util.Objects;

/**
 * Reordering of byte samples from planar (color-by-plane) to interleaved (color-by-pixel) layout.
 */
public class PlanarInterleaving {
    private PlanarInterleaving() {
    }

    /**
     * Converts R1, R2, ..., G1, G2, ..., B1, B2, ... into R1, G1, B1, R2, G2, B2, ...
     *
     * @param planar         planar samples; may be longer than necessary (extra bytes are ignored).
     * @param numberOfPixels number of pixels.
     * @return new array of interleaved samples.
     */
    public static byte[] planarToInterleaved24(byte[] planar, long numberOfPixels) {
        return toInterleavedBytes(planar, 3, numberOfPixels);
    }

    public static byte[] toInterleavedBytes(byte[] bytes, int numberOfChannels, long numberOfPixels) {
        Objects.requireNonNull(bytes, "Null bytes");
        final int size = checkSizes(bytes, numberOfChannels, numberOfPixels);
        bytes = exactLength(bytes, size);
        final byte[] interleavedBytes = new byte[size];
        final Matrix<UpdatablePArray> mI = Matrix.as(interleavedBytes, numberOfChannels, numberOfPixels);
        final Matrix<UpdatablePArray> mS = Matrix.as(bytes, numberOfPixels, numberOfChannels);
        Matrices.interleave(null, mI, mS.asLayers());
        return interleavedBytes;
    }

    private static byte[] exactLength(byte[] bytes, int size) {
        return bytes.length == size ? bytes : Arrays.copyOf(bytes, size);
        // - AlgART matrix requires exact correspondence between array length and dimensions
    }

    private static int checkSizes(byte[] bytes, int numberOfChannels, long numberOfPixels) {
        if (numberOfChannels <= 0) {
            throw new IllegalArgumentException("Zero or negative numberOfChannels = " + numberOfChannels);
        }
        if (numberOfPixels < 0) {
            throw new IllegalArgumentException("Negative numberOfPixels = " + numberOfPixels);
        }
        final long size = numberOfPixels * numberOfChannels;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large number of pixels " + numberOfPixels +
                    " (" + numberOfChannels + " samples/pixel): it requires >= 2^31 bytes");
        }
        if (bytes.length < size) {
            throw new IllegalArgumentException("Too short samples array: " + bytes.length + " < " + size);
        }
        return (int) size;
    }
}
