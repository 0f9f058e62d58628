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

import net.algart.matrices.dicom.resampling.PixelResampler;

/**
 * RGB or YBR_FULL pixels, 8 bits per channel, stored interleaved: R, G, B bytes for every pixel.
 * Planar frames should be interleaved before constructing, see
 * {@link net.algart.matrices.dicom.data.PlanarInterleaving}.
 *
 * <p>Min/max calculation is not supported for this format.</p>
 */
public final class Rgb24PixelData extends PixelData {
    private final byte[] samples;

    public Rgb24PixelData(int width, int height, byte[] interleavedFrame) {
        this(width, height, interleavedFrame, ParallelLoop.getDefault(), PixelResampler.getDefault());
    }

    public Rgb24PixelData(
            int width,
            int height,
            byte[] interleavedFrame,
            ParallelLoop loop,
            PixelResampler resampler) {
        super(width, height, loop, resampler);
        this.samples = copyBytes(interleavedFrame, width, height, DicomPixelFormat.RGB24);
    }

    private Rgb24PixelData(int width, int height, ParallelLoop loop, PixelResampler resampler, byte[] samples) {
        super(width, height, loop, resampler);
        checkSamples(samples.length, width, height, DicomPixelFormat.RGB24);
        this.samples = samples;
    }

    @Override
    public DicomPixelFormat format() {
        return DicomPixelFormat.RGB24;
    }

    /**
     * Returns a copy of the interleaved RGB bytes.
     *
     * @return <code>byte[3*width*height]</code>.
     */
    @Override
    public byte[] samples() {
        return samples.clone();
    }

    @Override
    PixelRange scanMinMax(int padding) {
        throw new UnsupportedOperationException("Calculation of min/max pixel values is not supported for " +
                "24-bit color pixel data");
    }

    @Override
    PixelData resize(int newWidth, int newHeight) {
        final byte[] resized = resampler.resizeInterleaved24(samples, width, height, newWidth, newHeight);
        return new Rgb24PixelData(newWidth, newHeight, loop, resampler, resized);
    }

    @Override
    void renderRow(int[] output, int y) {
        for (int i = y * width, to = i + width, p = 3 * i; i < to; i++, p += 3) {
            output[i] = (samples[p] & 0xFF) << 16 | (samples[p + 1] & 0xFF) << 8 | (samples[p + 2] & 0xFF);
        }
    }

    @Override
    void renderRow(LookupTable lut, int[] output, int y) {
        for (int i = y * width, to = i + width, p = 3 * i; i < to; i++, p += 3) {
            output[i] = lut.get(samples[p] & 0xFF) << 16
                    | lut.get(samples[p + 1] & 0xFF) << 8
                    | lut.get(samples[p + 2] & 0xFF);
        }
    }
}
