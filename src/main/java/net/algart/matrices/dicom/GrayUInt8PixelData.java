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

/**
 * Grayscale or palette pixels with Bits Allocated &le; 8, 1 unsigned byte per pixel.
 */
public sealed class GrayUInt8PixelData extends PixelData permits OverlayBitPixelData {
    final byte[] samples;

    public GrayUInt8PixelData(int width, int height, byte[] frame) {
        this(width, height, frame, BitDepth.full(8), ParallelLoop.getDefault(), PixelResampler.getDefault());
    }

    public GrayUInt8PixelData(
            int width,
            int height,
            byte[] frame,
            BitDepth bitDepth,
            ParallelLoop loop,
            PixelResampler resampler) {
        super(width, height, loop, resampler);
        final long t1 = debugTime();
        this.samples = BitDepthNormalizer.normalizeUnsigned8(
                copyBytes(frame, width, height, DicomPixelFormat.UINT8), bitDepth, loop);
        logNormalization(DicomPixelFormat.UINT8, width, height, bitDepth, t1);
    }

    GrayUInt8PixelData(int width, int height, ParallelLoop loop, PixelResampler resampler, byte[] ownedSamples) {
        super(width, height, loop, resampler);
        checkSamples(ownedSamples.length, width, height, DicomPixelFormat.UINT8);
        this.samples = ownedSamples;
    }

    @Override
    public DicomPixelFormat format() {
        return DicomPixelFormat.UINT8;
    }

    @Override
    public byte[] samples() {
        return samples.clone();
    }

    @Override
    PixelRange scanMinMax(int padding) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (byte sample : samples) {
            final int v = sample & 0xFF;
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
        final byte[] resized = resampler.resizeUnsigned8(samples, width, height, newWidth, newHeight);
        return new GrayUInt8PixelData(newWidth, newHeight, loop, resampler, resized);
    }

    @Override
    void renderRow(int[] output, int y) {
        for (int i = y * width, to = i + width; i < to; i++) {
            output[i] = samples[i] & 0xFF;
        }
    }

    @Override
    void renderRow(LookupTable lut, int[] output, int y) {
        for (int i = y * width, to = i + width; i < to; i++) {
            output[i] = lut.get(samples[i] & 0xFF);
        }
    }
}
