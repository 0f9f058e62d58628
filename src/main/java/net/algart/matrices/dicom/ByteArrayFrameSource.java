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

import java.util.Arrays;
import java.util.Objects;

/**
 * Native (uncompressed) multi-frame pixel data: all frames are stored back-to-back in one byte array,
 * as in the Pixel Data element (7FE0,0010) of an uncompressed transfer syntax.
 */
public final class ByteArrayFrameSource implements FrameSource {
    private final FrameDescription description;
    private final byte[] pixelData;
    private final int frameLength;
    private final int numberOfFrames;

    /**
     * Creates a new source. The number of frames is <code>pixelData.length/frameLength</code>, where
     * <code>frameLength</code> is {@link PixelDataFactory#frameLengthInBytes(FrameDescription)};
     * the incomplete tail (for example, padding to even length) is ignored.
     *
     * @param description description of every frame.
     * @param pixelData   all frames; not copied.
     * @throws UnsupportedPixelFormatException if the description is not supported.
     */
    public ByteArrayFrameSource(FrameDescription description, byte[] pixelData)
            throws UnsupportedPixelFormatException {
        this.description = Objects.requireNonNull(description, "Null description");
        this.pixelData = Objects.requireNonNull(pixelData, "Null pixel data");
        this.frameLength = PixelDataFactory.frameLengthInBytes(description);
        this.numberOfFrames = frameLength == 0 ? 0 : pixelData.length / frameLength;
    }

    @Override
    public FrameDescription description() {
        return description;
    }

    @Override
    public int numberOfFrames() {
        return numberOfFrames;
    }

    public int frameLength() {
        return frameLength;
    }

    @Override
    public byte[] getFrame(int frameIndex) {
        if (frameIndex < 0 || frameIndex >= numberOfFrames) {
            throw new IndexOutOfBoundsException("Frame index " + frameIndex + " is out of range 0.." +
                    (numberOfFrames - 1));
        }
        final int offset = frameIndex * frameLength;
        return Arrays.copyOfRange(pixelData, offset, offset + frameLength);
    }

    @Override
    public String toString() {
        return "byte array source of " + numberOfFrames + " frames, " + description;
    }
}
