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

import net.algart.matrices.dicom.data.OverlayBits;
import net.algart.matrices.dicom.resampling.PixelResampler;

/**
 * Overlay plane: source bits are unpacked into bytes 0 and 1, then processed as 8-bit grayscale pixels.
 * Rescaling returns usual {@link GrayUInt8PixelData}.
 */
public final class OverlayBitPixelData extends GrayUInt8PixelData {
    public OverlayBitPixelData(int width, int height, byte[] packedBits) {
        this(width, height, packedBits, ParallelLoop.getDefault(), PixelResampler.getDefault());
    }

    public OverlayBitPixelData(
            int width,
            int height,
            byte[] packedBits,
            ParallelLoop loop,
            PixelResampler resampler) {
        super(width, height, loop, resampler, OverlayBits.expandBits(packedBits, width, height));
    }

    @Override
    public DicomPixelFormat format() {
        return DicomPixelFormat.OVERLAY_BIT;
    }
}
