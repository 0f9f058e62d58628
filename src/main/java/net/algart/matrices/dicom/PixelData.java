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

import net.algart.arrays.JArrays;
import net.algart.matrices.dicom.resampling.PixelResampler;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Pixels of one DICOM frame, normalized and stored in memory in one of the {@link DicomPixelFormat formats}.
 *
 * <p>The set of implementations is closed; every implementation corresponds to one {@link DicomPixelFormat}.
 * Instances are usually created by {@link PixelDataFactory}.</p>
 *
 * <p>Sample values are normalized while constructing: unused high bits are cleared, and signed values are
 * sign-extended from the stored bits (see {@link net.algart.matrices.dicom.data.BitDepthNormalizer}).
 * After the constructor returns, the object is immutable: {@link #rescale(double)} creates a new instance.
 * So, all methods can be called from several threads simultaneously, if every call of
 * {@link #render(LookupTable, int[])} uses its own output array.</p>
 *
 * @author Daniel Alievsky
 */
public abstract sealed class PixelData
        permits GrayUInt8PixelData, GrayInt16PixelData, GrayUInt16PixelData,
        GrayInt32PixelData, GrayUInt32PixelData, Rgb24PixelData {
    /**
     * Whether {@link ParallelLoop#getDefault()} is parallel; can be disabled by the system property
     * <code>net.algart.matrices.dicom.parallel=false</code>.
     */
    public static final boolean DEFAULT_PARALLEL =
            net.algart.arrays.Arrays.SystemSettings.getBooleanProperty(
                    "net.algart.matrices.dicom.parallel", true);

    static final boolean BUILT_IN_TIMING =
            net.algart.arrays.Arrays.SystemSettings.getBooleanProperty(
                    "net.algart.matrices.dicom.timing", false);

    static final System.Logger LOG = System.getLogger(PixelData.class.getName());
    static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    final int width;
    final int height;
    final ParallelLoop loop;
    final PixelResampler resampler;

    PixelData(int width, int height, ParallelLoop loop, PixelResampler resampler) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or height = " + height);
        }
        this.width = width;
        this.height = height;
        this.loop = Objects.requireNonNull(loop, "Null loop");
        this.resampler = Objects.requireNonNull(resampler, "Null resampler");
    }

    public final int width() {
        return width;
    }

    public final int height() {
        return height;
    }

    /**
     * Returns the number of samples per pixel: 3 for RGB, 1 for other formats.
     *
     * @return number of components.
     */
    public final int components() {
        return format().numberOfComponents();
    }

    public final int numberOfPixels() {
        return width * height;
        // - cannot overflow: checked by checkFrame in all constructors
    }

    public abstract DicomPixelFormat format();

    public final ParallelLoop loop() {
        return loop;
    }

    public final PixelResampler resampler() {
        return resampler;
    }

    /**
     * Returns a copy of the normalized samples: <code>byte[]</code>, <code>short[]</code> or <code>int[]</code>
     * array, according to {@link DicomPixelFormat#elementType()}.
     *
     * @return Java array of <code>numberOfPixels()*components()</code> samples.
     */
    public abstract Object samples();

    public final boolean supportsMinMax() {
        return format().isMinMaxSupported();
    }

    /**
     * Finds minimal and maximal sample values, skipping all samples equal to <code>padding</code>.
     * Returns {@link PixelRange#EMPTY} if there are no other samples.
     *
     * @param padding value that is not considered as data (DICOM Pixel Padding Value).
     * @return range of values.
     * @throws UnsupportedOperationException if {@link #supportsMinMax()} is <code>false</code>
     *                                       (32-bit unsigned and color formats).
     */
    public final PixelRange getMinMax(int padding) {
        if (!supportsMinMax()) {
            throw new UnsupportedOperationException("Calculation of min/max pixel values is not supported for " +
                    format().prettyName() + " pixel data");
        }
        return scanMinMax(padding);
    }

    /**
     * Analog of {@link #getMinMax(int)}, that returns an empty optional instead of throwing an exception
     * for formats that do not support min/max calculation.
     *
     * @param padding value that is not considered as data.
     * @return range of values, if supported.
     */
    public final Optional<PixelRange> findMinMax(int padding) {
        return supportsMinMax() ? Optional.of(scanMinMax(padding)) : Optional.empty();
    }

    /**
     * Returns pixel data of the same format, scaled by the given factor.
     * New sizes are <code>floor(width*factor)</code> and <code>floor(height*factor)</code>.
     * If <code>factor==1.0</code>, returns this instance.
     *
     * <p>Note that a frame with a single row or a single column cannot be downscaled:
     * any <code>factor&lt;1.0</code> floors that dimension to 0, and this method throws
     * <code>IllegalArgumentException</code>.</p>
     *
     * @param factor scale.
     * @return scaled data.
     * @throws IllegalArgumentException if <code>factor</code> is not a positive finite number
     *                                  or if the result would be empty.
     */
    public final PixelData rescale(double factor) {
        if (factor == 1.0) {
            return this;
        }
        if (!(factor > 0.0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Illegal scale factor " + factor + ": must be positive and finite");
        }
        final double newWidth = Math.floor(width * factor);
        final double newHeight = Math.floor(height * factor);
        if (newWidth < 1.0 || newHeight < 1.0) {
            throw new IllegalArgumentException("Too small scale factor " + factor + " for " + this +
                    ": the result would be empty");
        }
        if (newWidth * newHeight * components() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too large scale factor " + factor + " for " + this +
                    ": the result would contain >= 2^31 samples");
        }
        LOG.log(System.Logger.Level.TRACE, () -> String.format(Locale.US,
                "Rescaling %s by %.5f to %dx%d with %s", this, factor, (int) newWidth, (int) newHeight, resampler));
        return resize((int) newWidth, (int) newHeight);
    }

    /**
     * Fills <code>output[0..width*height-1]</code> with display values, row by row:
     * <code>output[i]=lut.get(sample[i])</code>, or the sample itself if <code>lut==null</code>.
     * For RGB data every channel is transformed separately and packed as <code>(R&lt;&lt;16)|(G&lt;&lt;8)|B</code>.
     *
     * @param lut    lookup table; may be <code>null</code>.
     * @param output the result.
     * @throws NullPointerException     if <code>output</code> is <code>null</code>.
     * @throws IllegalArgumentException if <code>output.length &lt; width*height</code>.
     */
    public final void render(LookupTable lut, int[] output) {
        Objects.requireNonNull(output, "Null output");
        if (output.length < numberOfPixels()) {
            throw new IllegalArgumentException("Too short output array int[" + output.length +
                    "]: it cannot contain " + width + "x" + height + " pixels");
        }
        final long t1 = debugTime();
        if (lut == null) {
            loop.run(0, height, y -> renderRow(output, y));
        } else {
            loop.run(0, height, y -> renderRow(lut, output, y));
        }
        if (BUILT_IN_TIMING && LOGGABLE_DEBUG) {
            final long t2 = debugTime();
            LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                    "%s rendered %dx%d pixels %s in %.3f ms, %.3f MB/s",
                    getClass().getSimpleName(), width, height,
                    lut == null ? "without LUT" : "through LUT",
                    (t2 - t1) * 1e-6,
                    numberOfPixels() * 4.0 / 1048576.0 / ((t2 - t1) * 1e-9)));
        }
    }

    @Override
    public String toString() {
        return format().prettyName() + " pixel data " + width + "x" + height;
    }

    abstract PixelRange scanMinMax(int padding);

    abstract PixelData resize(int newWidth, int newHeight);

    abstract void renderRow(int[] output, int y);

    abstract void renderRow(LookupTable lut, int[] output, int y);

    static int checkFrame(byte[] frame, int width, int height, DicomPixelFormat format) {
        Objects.requireNonNull(frame, "Null frame");
        Objects.requireNonNull(format, "Null format");
        final int length = format.frameLengthInBytes(width, height);
        if (frame.length < length) {
            throw new IllegalArgumentException("Too short frame array byte[" + frame.length +
                    "]: it does not contain " + width + "x" + height + " pixels per " +
                    format.numberOfComponents() + " samples, " +
                    (format.isBinary() ? "1 bit/sample" : format.bytesPerSample() + " bytes/sample"));
        }
        return length;
    }

    static void checkSamples(int length, int width, int height, DicomPixelFormat format) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative width = " + width + " or height = " + height);
        }
        final long required = (long) width * (long) height * format.numberOfComponents();
        if (length != required) {
            throw new IllegalArgumentException("Number of samples " + length + " does not match " +
                    width + "x" + height + "x" + format.numberOfComponents() + " = " + required);
        }
    }

    static byte[] copyBytes(byte[] frame, int width, int height, DicomPixelFormat format) {
        final int length = checkFrame(frame, width, height, format);
        return Arrays.copyOf(frame, length);
    }

    static short[] decodeShorts(byte[] frame, int width, int height, DicomPixelFormat format, ByteOrder byteOrder) {
        Objects.requireNonNull(byteOrder, "Null byte order");
        final int length = checkFrame(frame, width, height, format);
        return JArrays.bytesToShortArray(frame.length == length ? frame : Arrays.copyOf(frame, length), byteOrder);
    }

    static int[] decodeInts(byte[] frame, int width, int height, DicomPixelFormat format, ByteOrder byteOrder) {
        Objects.requireNonNull(byteOrder, "Null byte order");
        final int length = checkFrame(frame, width, height, format);
        return JArrays.bytesToIntArray(frame.length == length ? frame : Arrays.copyOf(frame, length), byteOrder);
    }

    static PixelRange range(int min, int max) {
        return min > max ? PixelRange.EMPTY : PixelRange.of(min, max);
    }

    static long debugTime() {
        return BUILT_IN_TIMING && LOGGABLE_DEBUG ? System.nanoTime() : 0;
    }

    static void logNormalization(DicomPixelFormat format, int width, int height, BitDepth bitDepth, long t1) {
        if (BUILT_IN_TIMING && LOGGABLE_DEBUG) {
            final long t2 = debugTime();
            LOG.log(System.Logger.Level.DEBUG, String.format(Locale.US,
                    "%s %dx%d decoded and normalized (%s) in %.3f ms",
                    format.prettyName(), width, height, bitDepth, (t2 - t1) * 1e-6));
        }
    }
}
