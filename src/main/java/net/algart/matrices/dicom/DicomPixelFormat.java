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

/**
 * Closed set of in-memory pixel representations; every {@link PixelData} has exactly one of them.
 */
public enum DicomPixelFormat {
    UINT8("uint8", 8, 1, byte.class, false, true),
    INT16("int16", 16, 1, short.class, true, true),
    UINT16("uint16", 16, 1, short.class, false, true),
    INT32("int32", 32, 1, int.class, true, true),
    UINT32("uint32", 32, 1, int.class, false, false),
    RGB24("rgb24", 8, 3, byte.class, false, false),
    /**
     * Overlay plane: 1 bit per pixel in the source, unpacked to one byte 0 or 1 per pixel in memory.
     */
    OVERLAY_BIT("bit", 1, 1, byte.class, false, true);

    private final String prettyName;
    private final int bitsPerSample;
    private final int numberOfComponents;
    private final Class<?> elementType;
    private final boolean signed;
    private final boolean minMaxSupported;

    DicomPixelFormat(
            String prettyName,
            int bitsPerSample,
            int numberOfComponents,
            Class<?> elementType,
            boolean signed,
            boolean minMaxSupported) {
        this.prettyName = prettyName;
        this.bitsPerSample = bitsPerSample;
        this.numberOfComponents = numberOfComponents;
        this.elementType = elementType;
        this.signed = signed;
        this.minMaxSupported = minMaxSupported;
    }

    public String prettyName() {
        return prettyName;
    }

    /**
     * Number of bits per sample in the raw DICOM buffer: 1 for overlays, 8 for every color channel.
     *
     * @return bits per one sample of one component.
     */
    public int bitsPerSample() {
        return bitsPerSample;
    }

    /**
     * Number of bytes, occupied by one sample of one component in memory and, besides overlays,
     * in the raw DICOM buffer.
     *
     * @return 1, 2 or 4.
     */
    public int bytesPerSample() {
        return elementType == byte.class ? 1 : elementType == short.class ? 2 : 4;
    }

    public int numberOfComponents() {
        return numberOfComponents;
    }

    public Class<?> elementType() {
        return elementType;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isBinary() {
        return this == OVERLAY_BIT;
    }

    public boolean isMinMaxSupported() {
        return minMaxSupported;
    }

    /**
     * Returns the minimal length of the raw buffer for a frame <code>width</code>x<code>height</code>.
     *
     * @param width  frame width (columns).
     * @param height frame height (rows).
     * @return the necessary number of bytes.
     * @throws IllegalArgumentException if sizes are negative or the result is &ge;2<sup>31</sup>.
     */
    public int frameLengthInBytes(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or height = " + height);
        }
        final long pixels = (long) width * (long) height;
        final long result = isBinary() ?
                (pixels + 7) >>> 3 :
                pixels * numberOfComponents * bytesPerSample();
        if (result > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large frame " + width + "x" + height + " of " +
                    prettyName + " samples: " + result + " bytes >= 2^31");
        }
        return (int) result;
    }
}
