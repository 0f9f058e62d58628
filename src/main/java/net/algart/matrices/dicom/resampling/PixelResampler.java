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

/**
 * Resampling of a frame to new dimensions, used by {@link net.algart.matrices.dicom.PixelData#rescale(double)}.
 *
 * <p>Every method is a pure function: it does not modify the source samples and returns a new array
 * with <code>dstWidth*dstHeight</code> samples (<code>3*dstWidth*dstHeight</code> bytes for
 * {@link #resizeInterleaved24}). Samples are stored in rows, as in DICOM. The element type of the samples
 * is encoded in the method name, because Java arrays do not keep the signedness.</p>
 */
public interface PixelResampler {
    byte[] resizeUnsigned8(byte[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    short[] resizeInt16(short[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    short[] resizeUnsigned16(short[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    int[] resizeInt32(int[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    int[] resizeUnsigned32(int[] samples, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    /**
     * Resizes RGB pixels, stored as R, G, B bytes per pixel; channels are resized independently.
     *
     * @param rgb       interleaved samples.
     * @param srcWidth  source width.
     * @param srcHeight source height.
     * @param dstWidth  result width.
     * @param dstHeight result height.
     * @return new interleaved samples.
     */
    byte[] resizeInterleaved24(byte[] rgb, int srcWidth, int srcHeight, int dstWidth, int dstHeight);

    static PixelResampler getDefault() {
        return MatrixResampler.BILINEAR;
    }
}
