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

import net.algart.arrays.PackedBitArraysPer8;

import java.util.Objects;

/**
 * Unpacking of DICOM overlay planes (60xx,3000).
 *
 * <p>Overlay data contain 1 bit per pixel without any alignment of rows; bit #k of the frame is
 * bit <code>k%8</code> (counting from the least significant) of byte <code>k/8</code>.
 * This is the "normal" bit order of {@link PackedBitArraysPer8}.</p>
 */
public class OverlayBits {
    public static final byte ZERO = 0;
    public static final byte ONE = 1;

    private OverlayBits() {
    }

    /**
     * Unpacks <code>width*height</code> bits into bytes, 0 or 1 per pixel.
     *
     * @param packed packed bits; may be longer than necessary (extra bits are ignored).
     * @param width  overlay columns.
     * @param height overlay rows.
     * @return new array of <code>width*height</code> bytes.
     * @throws IllegalArgumentException if <code>packed</code> contains less than <code>width*height</code> bits.
     */
    public static byte[] expandBits(byte[] packed, int width, int height) {
        Objects.requireNonNull(packed, "Null packed bits");
        final long numberOfPixels = checkSizes(width, height);
        if ((long) packed.length * 8 < numberOfPixels) {
            throw new IllegalArgumentException("Too short packed bits array byte[" + packed.length +
                    "]: it does not contain " + width + "x" + height + " = " + numberOfPixels + " bits");
        }
        return PackedBitArraysPer8.unpackBitsToBytes(packed, 0, numberOfPixels, ZERO, ONE);
    }

    private static long checkSizes(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or height = " + height);
        }
        final long result = (long) width * (long) height;
        if (result > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large overlay " + width + "x" + height + " >= 2^31 pixels");
        }
        return result;
    }
}
