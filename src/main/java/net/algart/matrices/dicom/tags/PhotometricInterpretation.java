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

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * DICOM Photometric Interpretation (0028,0004): how stored sample values map to visual meaning.
 */
public enum PhotometricInterpretation {
    MONOCHROME1("MONOCHROME1", "Monochrome 1 (white is zero)"),
    MONOCHROME2("MONOCHROME2", "Monochrome 2 (black is zero)"),
    PALETTE_COLOR("PALETTE COLOR", "Palette color"),
    RGB("RGB", "RGB"),
    YBR_FULL("YBR_FULL", "YCbCr full"),
    YBR_FULL_422("YBR_FULL_422", "YCbCr full 4:2:2"),
    YBR_PARTIAL_422("YBR_PARTIAL_422", "YCbCr partial 4:2:2"),
    YBR_PARTIAL_420("YBR_PARTIAL_420", "YCbCr partial 4:2:0"),
    YBR_ICT("YBR_ICT", "YCbCr irreversible color transform"),
    YBR_RCT("YBR_RCT", "YCbCr reversible color transform"),
    HSV("HSV", "HSV (retired)"),
    ARGB("ARGB", "ARGB (retired)"),
    CMYK("CMYK", "CMYK (retired)"),
    UNKNOWN(null, "unknown");

    private final String code;
    private final String name;

    private static final Map<String, PhotometricInterpretation> LOOKUP =
            Arrays.stream(values()).filter(v -> v.code != null)
                    .collect(Collectors.toMap(PhotometricInterpretation::code, v -> v));

    PhotometricInterpretation(String code, String name) {
        this.code = code;
        this.name = name;
    }

    /**
     * Returns the constant for the given DICOM defined term, for example <code>"MONOCHROME2"</code>.
     * Leading and trailing spaces are ignored: DICOM pads CS values to even length by a space.
     *
     * @param code value of Photometric Interpretation attribute.
     * @return the corresponding constant or {@link #UNKNOWN}.
     */
    public static PhotometricInterpretation valueOfCodeOrUnknown(String code) {
        Objects.requireNonNull(code, "Null photometric interpretation code");
        return LOOKUP.getOrDefault(code.trim(), UNKNOWN);
    }

    public String code() {
        checkUnknown();
        return code;
    }

    public String prettyName() {
        return name;
    }

    public boolean isGrayscale() {
        return this == MONOCHROME1 || this == MONOCHROME2 || this == PALETTE_COLOR;
    }

    public boolean isInvertedBrightness() {
        return this == MONOCHROME1;
    }

    /**
     * Returns <code>true</code> for color models stored as full-resolution 3-sample pixels,
     * that can be rendered directly as RGB triples.
     *
     * @return whether this is RGB or YBR_FULL.
     */
    public boolean isFullColor() {
        return this == RGB || this == YBR_FULL;
    }

    public PhotometricInterpretation checkUnknown() {
        if (this == UNKNOWN) {
            throw new IllegalArgumentException("Unknown DICOM photometric interpretation is not allowed");
        }
        return this;
    }
}
