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

import net.algart.matrices.dicom.tags.PhotometricInterpretation;
import net.algart.matrices.dicom.tags.PixelRepresentation;
import net.algart.matrices.dicom.tags.PlanarConfiguration;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Attributes of the DICOM image pixel module, necessary to interpret a raw frame:
 * Photometric Interpretation, Samples per Pixel, Rows, Columns, Bits Allocated, Bits Stored, High Bit,
 * Pixel Representation, Planar Configuration, and the byte order of the transfer syntax.
 *
 * <p>The values are not checked for consistency here: it is the job of {@link PixelDataFactory},
 * that reports unsupported combinations by {@link UnsupportedPixelFormatException}.
 * Only obviously illegal values (negative sizes, <code>null</code> enumerations) are rejected.</p>
 *
 * <p>This class is immutable; new instances are created by {@link #newBuilder()}.</p>
 */
public final class FrameDescription {
    private final PhotometricInterpretation photometric;
    private final int columns;
    private final int rows;
    private final int samplesPerPixel;
    private final int bitsAllocated;
    private final int bitsStored;
    private final int highBit;
    private final PixelRepresentation pixelRepresentation;
    private final PlanarConfiguration planarConfiguration;
    private final ByteOrder byteOrder;

    private FrameDescription(Builder builder) {
        this.photometric = builder.photometric;
        this.columns = builder.columns;
        this.rows = builder.rows;
        this.samplesPerPixel = builder.samplesPerPixel;
        this.bitsAllocated = builder.bitsAllocated;
        this.bitsStored = builder.bitsStored;
        this.highBit = builder.highBit == null ? builder.bitsStored - 1 : builder.highBit;
        this.pixelRepresentation = builder.pixelRepresentation;
        this.planarConfiguration = builder.planarConfiguration;
        this.byteOrder = builder.byteOrder;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Shortcut for the most popular case: little-endian single-sample grayscale frame.
     *
     * @param columns       width.
     * @param rows          height.
     * @param bitsAllocated Bits Allocated.
     * @param bitsStored    Bits Stored; High Bit is <code>bitsStored-1</code>.
     * @param signed        Pixel Representation.
     * @return new description with MONOCHROME2 interpretation.
     */
    public static FrameDescription monochrome(
            int columns,
            int rows,
            int bitsAllocated,
            int bitsStored,
            boolean signed) {
        return newBuilder()
                .setPhotometric(PhotometricInterpretation.MONOCHROME2)
                .setSizes(columns, rows)
                .setBits(bitsAllocated, bitsStored)
                .setPixelRepresentation(signed ? PixelRepresentation.SIGNED : PixelRepresentation.UNSIGNED)
                .build();
    }

    public static FrameDescription rgb(int columns, int rows, PlanarConfiguration planarConfiguration) {
        return newBuilder()
                .setPhotometric(PhotometricInterpretation.RGB)
                .setSizes(columns, rows)
                .setSamplesPerPixel(3)
                .setBits(8, 8)
                .setPlanarConfiguration(planarConfiguration)
                .build();
    }

    public PhotometricInterpretation photometric() {
        return photometric;
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    public int samplesPerPixel() {
        return samplesPerPixel;
    }

    public int bitsAllocated() {
        return bitsAllocated;
    }

    public int bitsStored() {
        return bitsStored;
    }

    public int highBit() {
        return highBit;
    }

    public PixelRepresentation pixelRepresentation() {
        return pixelRepresentation;
    }

    public PlanarConfiguration planarConfiguration() {
        return planarConfiguration;
    }

    public ByteOrder byteOrder() {
        return byteOrder;
    }

    public boolean isSigned() {
        return pixelRepresentation.isSigned();
    }

    /**
     * Returns Bits Allocated / Bits Stored / High Bit as {@link BitDepth}.
     *
     * @return bit depth of samples.
     * @throws UnsupportedPixelFormatException if this combination is not valid.
     */
    public BitDepth bitDepth() throws UnsupportedPixelFormatException {
        try {
            return BitDepth.of(bitsAllocated, bitsStored, highBit);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedPixelFormatException("Unsupported bit depth in " + this +
                    ": " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "frame " + columns + "x" + rows + ", " + photometric.prettyName() +
                ", " + samplesPerPixel + " samples/pixel" +
                ", " + bitsAllocated + "/" + bitsStored + "/" + highBit + " bits allocated/stored/high" +
                ", " + pixelRepresentation.name().toLowerCase() +
                (samplesPerPixel > 1 ? ", " + planarConfiguration.name().toLowerCase() : "") +
                ", " + (byteOrder == ByteOrder.BIG_ENDIAN ? "big" : "little") + "-endian";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FrameDescription that)) {
            return false;
        }
        return columns == that.columns && rows == that.rows && samplesPerPixel == that.samplesPerPixel &&
                bitsAllocated == that.bitsAllocated && bitsStored == that.bitsStored && highBit == that.highBit &&
                photometric == that.photometric &&
                pixelRepresentation == that.pixelRepresentation &&
                planarConfiguration == that.planarConfiguration &&
                byteOrder.equals(that.byteOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(photometric, columns, rows, samplesPerPixel, bitsAllocated, bitsStored, highBit,
                pixelRepresentation, planarConfiguration, byteOrder);
    }

    public static final class Builder {
        private PhotometricInterpretation photometric = PhotometricInterpretation.MONOCHROME2;
        private int columns = 0;
        private int rows = 0;
        private int samplesPerPixel = 1;
        private int bitsAllocated = 8;
        private int bitsStored = 8;
        private Integer highBit = null;
        private PixelRepresentation pixelRepresentation = PixelRepresentation.UNSIGNED;
        private PlanarConfiguration planarConfiguration = PlanarConfiguration.INTERLEAVED;
        private ByteOrder byteOrder = ByteOrder.LITTLE_ENDIAN;

        private Builder() {
        }

        public Builder setPhotometric(PhotometricInterpretation photometric) {
            this.photometric = Objects.requireNonNull(photometric, "Null photometric interpretation");
            return this;
        }

        public Builder setSizes(int columns, int rows) {
            if (columns < 0 || rows < 0) {
                throw new IllegalArgumentException("Negative columns = " + columns + " or rows = " + rows);
            }
            this.columns = columns;
            this.rows = rows;
            return this;
        }

        public Builder setSamplesPerPixel(int samplesPerPixel) {
            if (samplesPerPixel <= 0) {
                throw new IllegalArgumentException("Zero or negative samples per pixel = " + samplesPerPixel);
            }
            this.samplesPerPixel = samplesPerPixel;
            return this;
        }

        /**
         * Sets Bits Allocated and Bits Stored. High Bit, if not set explicitly by {@link #setHighBit(int)},
         * will be <code>bitsStored-1</code>.
         *
         * @param bitsAllocated Bits Allocated (0028,0100).
         * @param bitsStored    Bits Stored (0028,0101).
         * @return a reference to this object.
         */
        public Builder setBits(int bitsAllocated, int bitsStored) {
            if (bitsAllocated <= 0 || bitsStored <= 0) {
                throw new IllegalArgumentException("Zero or negative bits allocated = " + bitsAllocated +
                        " or bits stored = " + bitsStored);
            }
            this.bitsAllocated = bitsAllocated;
            this.bitsStored = bitsStored;
            return this;
        }

        public Builder setHighBit(int highBit) {
            if (highBit < 0) {
                throw new IllegalArgumentException("Negative high bit = " + highBit);
            }
            this.highBit = highBit;
            return this;
        }

        public Builder setPixelRepresentation(PixelRepresentation pixelRepresentation) {
            this.pixelRepresentation = Objects.requireNonNull(pixelRepresentation, "Null pixel representation");
            return this;
        }

        public Builder setPlanarConfiguration(PlanarConfiguration planarConfiguration) {
            this.planarConfiguration = Objects.requireNonNull(planarConfiguration, "Null planar configuration");
            return this;
        }

        public Builder setByteOrder(ByteOrder byteOrder) {
            this.byteOrder = Objects.requireNonNull(byteOrder, "Null byte order");
            return this;
        }

        public FrameDescription build() {
            return new FrameDescription(this);
        }
    }
}
