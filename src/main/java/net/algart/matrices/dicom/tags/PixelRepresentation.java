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
 * DICOM Pixel Representation (0028,0103).
 */
public enum PixelRepresentation {
    UNSIGNED(0),
    SIGNED(1);

    private final int code;

    PixelRepresentation(int code) {
        this.code = code;
    }

    public static PixelRepresentation valueOfCode(int code) {
        return switch (code) {
            case 0 -> UNSIGNED;
            case 1 -> SIGNED;
            default -> throw new IllegalArgumentException("Illegal DICOM pixel representation " + code +
                    " (0 or 1 expected)");
        };
    }

    public int code() {
        return code;
    }

    public boolean isSigned() {
        return this == SIGNED;
    }
}
