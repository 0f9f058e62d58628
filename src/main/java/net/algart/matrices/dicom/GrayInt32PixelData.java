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
 * Grayscale pixels with 16 &lt; Bits Allocated &le; 32 and signed Pixel Representation.
 */
public final class GrayInt32PixelData extends PixelData {
    private final int[] samples;

    public GrayInt32PixelData(int width, int height, BitDepth bitDepth, byte[] frame) {
        this(width, height, bitDepth, frame, ByteOrder.LITTLE_ENDIAN,
                ParallelLoop.getDefault(), PixelResampler.getDefault());
    }

    public GrayInt32PixelData(
            int width,
            int height,
            BitDepth bitDepth,
            byte[] frame,
            ByteOrder byteOrder,
            ParallelLoop loop,
            PixelResampler resampler) {
        super(width, height, loop, resampler);
        final long t1 = debugTime();
        this.samples = BitDepthNormalizer.normalizeInt32(
                decodeInts(frame, width, height, DicomPixelFormat.INT32, byteOrder), bitDepth, loop);
        logNormalization(DicomPixelFormat.INT32, width, height, bitDepth, t1);
    }

    private GrayInt32PixelData(int width, int height, ParallelLoop loop, PixelResampler resampler, int[] samples) {
        super(width, height, loop, resampler);
        checkSamples(samples.length, width, height, DicomPixelFormat.INT32);
        this.samples = samples;
    }

    @Override
    public DicomPixelFormat format() {
        return DicomPixelFormat.INT32;
    }

    @Override
    public int[] samples() {
        return samples.clone();
    }

    @Override
    PixelRange scanMinMax(int padding) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int v : samples) {
            if (v == padding) {
                continue;
            }
            if (v < min) {
                min = v;
            }
            if (v > max) {
                max = v;
            }
        }
        return range(min, max);
    }

    @Override
    PixelData resize(int newWidth, int newHeight) {
        final int[] resized = resampler.resizeInt32(samples, width, height, newWidth, newHeight);
        return new GrayInt32PixelData(newWidth, newHeight, loop, resampler, resized);
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
