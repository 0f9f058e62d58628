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

import net.algart.matrices.dicom.data.PlanarInterleaving;
import net.algart.matrices.dicom.resampling.PixelResampler;

import java.io.IOException;
import java.util.Objects;

/**
 * Creates {@link PixelData} of a suitable format for a raw DICOM frame or overlay plane.
 *
 * <p>The format is chosen by Photometric Interpretation, Bits Allocated and Pixel Representation:</p>
 * <ul>
 *     <li>MONOCHROME1, MONOCHROME2, PALETTE COLOR, 1 sample per pixel:
 *     {@link DicomPixelFormat#UINT8} for Bits Allocated &le; 8 (always unsigned),
 *     {@link DicomPixelFormat#INT16}/{@link DicomPixelFormat#UINT16} for &le; 16,
 *     {@link DicomPixelFormat#INT32}/{@link DicomPixelFormat#UINT32} for &le; 32;</li>
 *     <li>RGB, YBR_FULL, 3 samples per pixel, 8 bits allocated: {@link DicomPixelFormat#RGB24};
 *     planar frames are interleaved first;</li>
 *     <li>all other combinations lead to {@link UnsupportedPixelFormatException}.</li>
 * </ul>
 *
 * <p>Note that YBR_FULL samples are not converted to RGB.</p>
 *
 * <p>This class is not thread-safe, but all created {@link PixelData} objects are.</p>
 */
public class PixelDataFactory {
    private static final System.Logger LOG = System.getLogger(PixelDataFactory.class.getName());

    private ParallelLoop loop = ParallelLoop.getDefault();
    private PixelResampler resampler = PixelResampler.getDefault();

    public PixelDataFactory() {
    }

    public static PixelDataFactory newInstance() {
        return new PixelDataFactory();
    }

    public ParallelLoop loop() {
        return loop;
    }

    /**
     * Sets the loop, that will be used by all created objects for normalization and rendering.
     * Default value is {@link ParallelLoop#getDefault()}.
     *
     * @param loop new loop.
     * @return a reference to this object.
     */
    public PixelDataFactory setLoop(ParallelLoop loop) {
        this.loop = Objects.requireNonNull(loop, "Null loop");
        return this;
    }

    public PixelResampler resampler() {
        return resampler;
    }

    public PixelDataFactory setResampler(PixelResampler resampler) {
        this.resampler = Objects.requireNonNull(resampler, "Null resampler");
        return this;
    }

    /**
     * Returns the format of {@link PixelData}, that {@link #forFrame(FrameDescription, byte[])} will create
     * for the given description.
     *
     * @param description frame attributes.
     * @return pixel format; never {@link DicomPixelFormat#OVERLAY_BIT}.
     * @throws UnsupportedPixelFormatException if no format corresponds to this description.
     */
    public static DicomPixelFormat selectFormat(FrameDescription description)
            throws UnsupportedPixelFormatException {
        Objects.requireNonNull(description, "Null description");
        final var photometric = description.photometric();
        final int bitsAllocated = description.bitsAllocated();
        if (photometric.isGrayscale()) {
            if (description.samplesPerPixel() != 1) {
                throw new UnsupportedPixelFormatException("Unsupported " + description +
                        ": " + photometric.prettyName() + " requires 1 sample per pixel");
            }
            if (bitsAllocated <= 8) {
                return DicomPixelFormat.UINT8;
            } else if (bitsAllocated <= 16) {
                return description.isSigned() ? DicomPixelFormat.INT16 : DicomPixelFormat.UINT16;
            } else if (bitsAllocated <= 32) {
                return description.isSigned() ? DicomPixelFormat.INT32 : DicomPixelFormat.UINT32;
            }
            throw new UnsupportedPixelFormatException("Unsupported " + description +
                    ": more than 32 bits allocated");
        }
        if (photometric.isFullColor()) {
            if (description.samplesPerPixel() != 3 || bitsAllocated != 8) {
                throw new UnsupportedPixelFormatException("Unsupported " + description +
                        ": " + photometric.prettyName() + " is supported for 3 samples per pixel, 8 bits only");
            }
            return DicomPixelFormat.RGB24;
        }
        throw new UnsupportedPixelFormatException("Unsupported pixel data photometric interpretation: " +
                photometric.prettyName());
    }

    /**
     * Returns the number of bytes occupied by one raw frame with the given description.
     *
     * @param description frame attributes.
     * @return frame length in bytes.
     * @throws UnsupportedPixelFormatException if the description is not supported or the frame is too large.
     */
    public static int frameLengthInBytes(FrameDescription description) throws UnsupportedPixelFormatException {
        final DicomPixelFormat format = selectFormat(description);
        try {
            return format.frameLengthInBytes(description.columns(), description.rows());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedPixelFormatException("Unsupported " + description + ": " + e.getMessage());
        }
    }

    public PixelData forFrame(FrameSource source, int frameIndex) throws IOException {
        Objects.requireNonNull(source, "Null frame source");
        final int numberOfFrames = source.numberOfFrames();
        if (frameIndex < 0 || frameIndex >= numberOfFrames) {
            throw new IllegalArgumentException("Frame index " + frameIndex + " is out of range 0.." +
                    (numberOfFrames - 1));
        }
        return forFrame(source.description(), source.getFrame(frameIndex));
    }

    /**
     * Creates pixel data for one raw frame. The frame is not modified; the result contains a normalized copy.
     *
     * @param description frame attributes.
     * @param frame       raw bytes; may be longer than necessary (extra bytes are ignored).
     * @return new pixel data.
     * @throws UnsupportedPixelFormatException if the description is not supported.
     * @throws MalformedPixelDataException     if the frame is too short.
     */
    public PixelData forFrame(FrameDescription description, byte[] frame) throws DicomPixelException {
        Objects.requireNonNull(description, "Null description");
        Objects.requireNonNull(frame, "Null frame");
        final DicomPixelFormat format = selectFormat(description);
        final int length = frameLengthInBytes(description);
        if (frame.length < length) {
            throw new MalformedPixelDataException("Too short frame: " + frame.length + " bytes instead of " +
                    length + " bytes, necessary for " + description);
        }
        final int w = description.columns();
        final int h = description.rows();
        final BitDepth bitDepth = description.bitDepth();
        LOG.log(System.Logger.Level.TRACE, () -> "Selected " + format.prettyName() + " pixel format for " +
                description);
        return switch (format) {
            case UINT8 -> new GrayUInt8PixelData(w, h, frame, bitDepth, loop, resampler);
            case INT16 -> new GrayInt16PixelData(w, h, bitDepth, frame, description.byteOrder(), loop, resampler);
            case UINT16 -> new GrayUInt16PixelData(w, h, bitDepth, frame, description.byteOrder(), loop, resampler);
            case INT32 -> new GrayInt32PixelData(w, h, bitDepth, frame, description.byteOrder(), loop, resampler);
            case UINT32 -> new GrayUInt32PixelData(w, h, bitDepth, frame, description.byteOrder(), loop, resampler);
            case RGB24 -> new Rgb24PixelData(w, h,
                    description.planarConfiguration().isPlanar() ?
                            PlanarInterleaving.planarToInterleaved24(frame, (long) w * (long) h) :
                            frame,
                    loop, resampler);
            case OVERLAY_BIT -> throw new AssertionError("Overlay format cannot be selected for a frame");
        };
    }

    /**
     * Creates pixel data for an overlay plane.
     *
     * @param overlay overlay attributes and bit-packed data.
     * @return new pixel data with bytes 0 and 1.
     * @throws MalformedPixelDataException if the overlay data is too short.
     */
    public OverlayBitPixelData forOverlay(OverlayData overlay) throws MalformedPixelDataException {
        Objects.requireNonNull(overlay, "Null overlay");
        final int length = DicomPixelFormat.OVERLAY_BIT.frameLengthInBytes(overlay.columns(), overlay.rows());
        if (overlay.data().length < length) {
            throw new MalformedPixelDataException("Too short overlay data: " + overlay.data().length +
                    " bytes instead of " + length + " bytes, necessary for " + overlay);
        }
        LOG.log(System.Logger.Level.TRACE, () -> "Unpacking " + overlay);
        return new OverlayBitPixelData(overlay.columns(), overlay.rows(), overlay.data(), loop, resampler);
    }

    @Override
    public String toString() {
        return "pixel data factory (" + loop + ", " + resampler + ")";
    }
}
