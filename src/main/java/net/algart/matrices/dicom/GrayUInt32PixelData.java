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

import net.algart.matrices.dicom.data.BitDepthNormalizer;
import net.algart.matrices.dicom.resampling.PixelResampler;

import java.nio.ByteOrder;

/**
 * Grayscale or palette pixels with 16 &lt; Bits Allocated &le; 32 and unsigned Pixel Representation.
 *
 * <p>Samples are stored in <code>int</code> elements and rendered as is, i.e. values &ge;2<sup>31</sup>
 * become negative Java integers. Min/max calculation is not supported for this format.</p>
 */
public final class GrayUInt32PixelData extends PixelData {
    private final int[] samples;

    public GrayUInt32PixelData(int width, int height, BitDepth bitDepth, byte[] frame) {
        this(width, height, bitDepth, frame, ByteOrder.LITTLE_ENDIAN,
                ParallelLoop.getDefault(), PixelResampler.getDefault());
    }

    public GrayUInt32PixelData(
            int width,
            int height,
            BitDepth bitDepth,
            byte[] frame,
            ByteOrder byteOrder,
            ParallelLoop loop,
            PixelResampler resampler) {
        super(width, height, loop, resampler);
        final long t1 = debugTime();
        this.samples = BitDepthNormalizer.normalizeUnsigned32(
                decodeInts(frame, width, height, DicomPixelFormat.UINT32, byteOrder), bitDepth, loop);
        logNormalization(DicomPixelFormat.UINT32, width, height, bitDepth, t1);
    }

    private GrayUInt32PixelData(int width, int height, ParallelLoop loop, PixelResampler resampler, int[] samples) {
        super(width, height, loop, resampler);
        checkSamples(samples.length, width, height, DicomPixelFormat.UINT32);
        this.samples = samples;
    }

    @Override
    public DicomPixelFormat format() {
        return DicomPixelFormat.UINT32;
    }

    @Override
    public int[] samples() {
        return samples.clone();
    }

    @Override
    PixelRange scanMinMax(int padding) {
        throw new UnsupportedOperationException("Calculation of min/max pixel values is not supported for " +
                "32-bit unsigned integer data");
    }

    @Override
    PixelData resize(int newWidth, int newHeight) {
        final int[] resized = resampler.resizeUnsigned32(samples, width, height, newWidth, newHeight);
        return new GrayUInt32PixelData(newWidth, newHeight, loop, resampler, resized);
    }

    @Override
    void renderRow(int[] output, int y) {
        System.arraycopy(samples, y * width, output, y * width, width);
    }

    @Override
    void renderRow(LookupTable lut, int[] output, int y) {
        for (int i = y * width, to = i + width; i < to; i++) {
            output[i] = lut.get(samples[i]);
        }
    }
}
