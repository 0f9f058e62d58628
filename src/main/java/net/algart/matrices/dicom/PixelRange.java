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
 * Minimal and maximal sample values of a frame, found by {@link PixelData#getMinMax(int)}.
 *
 * <p>The range is <i>empty</i> ({@link #isEmpty()}) when min&gt;max. The only empty range returned by
 * pixel data is {@link #EMPTY}: it means that the frame contains no samples besides padding ones.</p>
 */
public final class PixelRange {
    /**
     * "No data" result: <code>min=Integer.MAX_VALUE</code>, <code>max=Integer.MIN_VALUE</code>.
     */
    public static final PixelRange EMPTY = new PixelRange(Integer.MAX_VALUE, Integer.MIN_VALUE);

    private final int min;
    private final int max;

    private PixelRange(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static PixelRange of(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min = " + min + " > max = " + max);
        }
        return new PixelRange(min, max);
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean isEmpty() {
        return min > max;
    }

    @Override
    public String toString() {
        return isEmpty() ? "empty range" : min + ".." + max;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PixelRange that && min == that.min && max == that.max);
    }

    @Override
    public int hashCode() {
        return 31 * min + max;
    }
}
