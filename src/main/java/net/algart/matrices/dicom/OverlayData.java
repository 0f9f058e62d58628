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

import java.util.Objects;

/**
 * DICOM overlay plane: Overlay Columns (60xx,0011), Overlay Rows (60xx,0010) and bit-packed
 * Overlay Data (60xx,3000).
 *
 * <p>The data array is stored by reference, without copying.</p>
 */
public final class OverlayData {
    private final int columns;
    private final int rows;
    private final byte[] data;

    private OverlayData(int columns, int rows, byte[] data) {
        if (columns < 0 || rows < 0) {
            throw new IllegalArgumentException("Negative overlay columns = " + columns + " or rows = " + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.data = Objects.requireNonNull(data, "Null overlay data");
    }

    public static OverlayData of(int columns, int rows, byte[] data) {
        return new OverlayData(columns, rows, data);
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    public byte[] data() {
        return data;
    }

    @Override
    public String toString() {
        return "overlay " + columns + "x" + rows + " (" + data.length + " bytes)";
    }
}
