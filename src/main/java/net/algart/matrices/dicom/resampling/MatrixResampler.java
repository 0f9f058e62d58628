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

package net.algart.matrices.dicom.resampling;

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.PArray;
import net.algart.arrays.UpdatablePArray;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resampler, based on {@link Matrices#asResized(Matrices.ResizingMethod, Matrix, long...)}.
 *
 * <p>AlgART matrices interpret <code>short</code> elements as unsigned and <code>int</code> elements as signed.
 * Other cases (signed 16-bit, unsigned 32-bit) are shifted into the AlgART range by inverting the highest bit,
 * which is a linear transformation and does not change the interpolation results.</p>
 */
public class MatrixResampler implements PixelResampler {
    /**
     * Polylinear interpolation: bilinear for 2-dimensional frames.
     */
    public static final MatrixResampler BILINEAR =
            new MatrixResampler(Matrices.ResizingMethod.POLYLINEAR_INTERPOLATION);

    private static final int NUMBER_OF_RGB_CHANNELS = 3;

    private final Matrices.ResizingMethod resizingMethod;

    public MatrixResampler(Matrices.ResizingMethod resizingMethod) {
        this.resizingMethod = Objects.requireNonNull(resizingMethod, "Null resizing method");
    }

    public Matrices.ResizingMethod resizingMethod() {
        return resizingMethod;
    }

    @Override
    public byte[] resizeUnsigned8(byte[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(samples, samples == null ? 0 : samples.length, 1, srcWidth, srcHeight, dstWidth, dstHeight);
        return (byte[]) resize(Matrix.as(samples, srcWidth, srcHeight), dstWidth, dstHeight);
    }

    @Override
    public short[] resizeInt16(short[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(samples, samples == null ? 0 : samples.length, 1, srcWidth, srcHeight, dstWidth, dstHeight);
        final short[] result = resizeUnsigned16(invertHighBit(samples), srcWidth, srcHeight, dstWidth, dstHeight);
        return invertHighBitInPlace(result);
    }

    @Override
    public short[] resizeUnsigned16(short[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(samples, samples == null ? 0 : samples.length, 1, srcWidth, srcHeight, dstWidth, dstHeight);
        return (short[]) resize(Matrix.as(samples, srcWidth, srcHeight), dstWidth, dstHeight);
    }

    @Override
    public int[] resizeInt32(int[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(samples, samples == null ? 0 : samples.length, 1, srcWidth, srcHeight, dstWidth, dstHeight);
        return (int[]) resize(Matrix.as(samples, srcWidth, srcHeight), dstWidth, dstHeight);
    }

    @Override
    public int[] resizeUnsigned32(int[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(samples, samples == null ? 0 : samples.length, 1, srcWidth, srcHeight, dstWidth, dstHeight);
        final int[] result = resizeInt32(invertHighBit(samples), srcWidth, srcHeight, dstWidth, dstHeight);
        return invertHighBitInPlace(result);
    }

    @Override
    public byte[] resizeInterleaved24(byte[] rgb, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        checkSizes(rgb, rgb == null ? 0 : rgb.length, NUMBER_OF_RGB_CHANNELS,
                srcWidth, srcHeight, dstWidth, dstHeight);
        final Matrix<UpdatablePArray> interleaved = Matrix.as(rgb, NUMBER_OF_RGB_CHANNELS, srcWidth, srcHeight);
        final List<Matrix<UpdatablePArray>> channels =
                Matrices.separate(null, interleaved, NUMBER_OF_RGB_CHANNELS);
        final List<Matrix<? extends PArray>> resized = new ArrayList<>(channels.size());
        for (Matrix<? extends PArray> m : channels) {
            resized.add(Matrices.asResized(resizingMethod, m, dstWidth, dstHeight).clone());
        }
        final Matrix<? extends PArray> result = Matrices.interleave(resized);
        return (byte[]) result.array().ja();
    }

    @Override
    public String toString() {
        return "AlgART matrix resampler (" + resizingMethod + ")";
    }

    private Object resize(Matrix<? extends PArray> source, int dstWidth, int dstHeight) {
        return Matrices.asResized(resizingMethod, source, dstWidth, dstHeight).clone().array().ja();
    }

    private static short[] invertHighBit(short[] samples) {
        return invertHighBitInPlace(samples.clone());
    }

    private static short[] invertHighBitInPlace(short[] samples) {
        for (int i = 0; i < samples.length; i++) {
            samples[i] ^= (short) 0x8000;
        }
        return samples;
    }

    private static int[] invertHighBit(int[] samples) {
        return invertHighBitInPlace(samples.clone());
    }

    private static int[] invertHighBitInPlace(int[] samples) {
        for (int i = 0; i < samples.length; i++) {
            samples[i] ^= Integer.MIN_VALUE;
        }
        return samples;
    }

    private static void checkSizes(
            Object samples,
            int length,
            int numberOfChannels,
            int srcWidth,
            int srcHeight,
            int dstWidth,
            int dstHeight) {
        Objects.requireNonNull(samples, "Null samples");
        if (srcWidth < 0 || srcHeight < 0) {
            throw new IllegalArgumentException("Negative srcWidth = " + srcWidth + " or srcHeight = " + srcHeight);
        }
        if (dstWidth < 0 || dstHeight < 0) {
            throw new IllegalArgumentException("Negative dstWidth = " + dstWidth + " or dstHeight = " + dstHeight);
        }
        final long required = (long) srcWidth * (long) srcHeight * numberOfChannels;
        if (length != required) {
            throw new IllegalArgumentException("Samples array length " + length + " does not match " +
                    srcWidth + "x" + srcHeight + "x" + numberOfChannels + " = " + required);
        }
        if ((long) dstWidth * (long) dstHeight * numberOfChannels > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large result " + dstWidth + "x" + dstHeight +
                    "x" + numberOfChannels + " >= 2^31 samples");
        }
    }
}
