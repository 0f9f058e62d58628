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

import java.io.IOException;

/**
 * Supplier of raw (uncompressed) frames of one multi-frame DICOM image, usually implemented by
 * a data-set parser or a transfer-syntax decoder.
 *
 * <p>The returned array must not be modified by the source while {@link PixelDataFactory} is processing it.</p>
 */
public interface FrameSource {
    FrameDescription description();

    int numberOfFrames();

    /**
     * Returns the raw bytes of the frame <code>#frameIndex</code>. The array may be longer than
     * necessary; extra bytes are ignored.
     *
     * @param frameIndex index of the frame, <code>0..numberOfFrames()-1</code>.
     * @return raw frame.
     * @throws IOException in a case of any problem while reading or decoding the frame.
     */
    byte[] getFrame(int frameIndex) throws IOException;
}
