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

package net.algart.matrices.dicom.tags;

/**
 * DICOM Planar Configuration (0028,0006) for multi-sample pixels.
 */
public enum PlanarConfiguration {
    /**
     * Color-by-pixel: R1, G1, B1, R2, G2, B2, ...
     */
    INTERLEAVED(0),
    /**
     * Color-by-plane: R1, R2, ..., G1, G2, ..., B1, B2, ...
     */
    PLANAR(1);

    private final int code;

    PlanarConfiguration(int code) {
        this.code = code;
    }

    public static PlanarConfiguration valueOfCode(int code) {
        return switch (code) {
            case 0 -> INTERLEAVED;
            case 1 -> PLANAR;
            default -> throw new IllegalArgumentException("Illegal DICOM planar configuration " + code +
                    " (0 or 1 expected)");
        };
    }

    public int code() {
        return code;
    }

    public boolean isPlanar() {
        return this == PLANAR;
    }
}
