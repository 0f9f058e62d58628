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

package net.algart.matrices.dicom.data;

import net.algart.matrices.dicom.BitDepth;
import net.algart.matrices.dicom.ParallelLoop;

import java.util.Objects;

/**
 * Reduces decoded samples to their stored bits: clears the unused high bits of unsigned samples
 * and sign-extends signed samples from the stored bit window to the whole Java type.
 *
 * <p>All methods process the passed array <b>in place</b> and return a reference to it.
 * They must be called for a private array only, before it becomes visible to other threads;
 * {@link net.algart.matrices.dicom.PixelData} calls them inside its constructors.</p>
 *
 * <p>Samples are processed independently, by blocks of {@link #BLOCK_LENGTH} elements,
 * via the passed {@link ParallelLoop}.</p>
 */
public class BitDepthNormalizer {
    public static final int BLOCK_LENGTH = 65536;

    private BitDepthNormalizer() {
    }

    public static byte[] normalizeUnsigned8(byte[] samples, BitDepth bitDepth, ParallelLoop loop) {
        checkArguments(samples, bitDepth, loop);
        if (bitDepth.bitsStored() >= 8) {
            return samples;
        }
        final byte mask = (byte) unsignedMask(0xFF, bitDepth);
        forEachBlock(samples.length, loop, (from, to) -> {
            for (int i = from; i < to; i++) {
                samples[i] &= mask;
            }
        });
        return samples;
    }

    public static short[] normalizeUnsigned16(short[] samples, BitDepth bitDepth, ParallelLoop loop) {
        checkArguments(samples, bitDepth, loop);
        if (bitDepth.bitsStored() >= 16) {
            return samples;
        }
        final short mask = (short) unsignedMask(0xFFFF, bitDepth);
        forEachBlock(samples.length, loop, (from, to) -> {
            for (int i = from; i < to; i++) {
                samples[i] &= mask;
            }
        });
        return samples;
    }

    public static short[] normalizeInt16(short[] samples, BitDepth bitDepth, ParallelLoop loop) {
        checkArguments(samples, bitDepth, loop);
        if (bitDepth.bitsStored() >= 16) {
            // - native short is already correct
            return samples;
        }
        final int mask = unsignedMask(0xFFFF, bitDepth);
        final int sign = 1 << bitDepth.highBit();
        forEachBlock(samples.length, loop, (from, to) -> {
            for (int i = from; i < to; i++) {
                samples[i] = (short) signExtend(samples[i], mask, sign);
            }
        });
        return samples;
    }

    public static int[] normalizeInt32(int[] samples, BitDepth bitDepth, ParallelLoop loop) {
        checkArguments(samples, bitDepth, loop);
        if (bitDepth.bitsStored() >= 32) {
            return samples;
        }
        final int mask = unsignedMask(-1, bitDepth);
        final int sign = 1 << bitDepth.highBit();
        forEachBlock(samples.length, loop, (from, to) -> {
            for (int i = from; i < to; i++) {
                samples[i] = signExtend(samples[i], mask, sign);
            }
        });
        return samples;
    }

    /**
     * Clears unused high bits of 32-bit unsigned samples. Unlike {@link #normalizeInt32}, no sign bit is analysed.
     *
     * @param samples  samples, interpreted as unsigned 32-bit values.
     * @param bitDepth bit depth.
     * @param loop     loop for parallel processing.
     * @return reference to <code>samples</code>.
     */
    public static int[] normalizeUnsigned32(int[] samples, BitDepth bitDepth, ParallelLoop loop) {
        checkArguments(samples, bitDepth, loop);
        if (bitDepth.bitsStored() >= 32) {
            return samples;
        }
        final int mask = unsignedMask(-1, bitDepth);
        forEachBlock(samples.length, loop, (from, to) -> {
            for (int i = from; i < to; i++) {
                samples[i] &= mask;
            }
        });
        return samples;
    }

    /**
     * Returns <code>maxValueForWidth &gt;&gt;&gt; (bitsAllocated - bitsStored)</code>.
     *
     * @param maxValueForWidth all bits of the storage type: 0xFF, 0xFFFF or -1 (0xFFFFFFFF).
     * @param bitDepth         bit depth.
     * @return mask of stored bits.
     */
    public static int unsignedMask(int maxValueForWidth, BitDepth bitDepth) {
        Objects.requireNonNull(bitDepth, "Null bit depth");
        return maxValueForWidth >>> bitDepth.unusedBits();
    }

    /**
     * Two's-complement reconstruction of a value within the stored bits window.
     * If the sign bit is set, the result is <code>-((~value &amp; mask) + 1)</code>,
     * that is <code>value | ~mask</code>; in other case it is <code>value &amp; mask</code>.
     *
     * @param value raw sample.
     * @param mask  mask of stored bits.
     * @param sign  <code>1 &lt;&lt; highBit</code>.
     * @return normalized sample.
     */
    public static int signExtend(int value, int mask, int sign) {
        return (value & sign) != 0 ? -((~value & mask) + 1) : value & mask;
    }

    private static void forEachBlock(int length, ParallelLoop loop, BlockBody body) {
        final int numberOfBlocks = (int) (((long) length + BLOCK_LENGTH - 1) / BLOCK_LENGTH);
        loop.run(0, numberOfBlocks, block -> {
            final int from = block * BLOCK_LENGTH;
            body.process(from, (int) Math.min((long) from + BLOCK_LENGTH, length));
        });
    }

    private static void checkArguments(Object samples, BitDepth bitDepth, ParallelLoop loop) {
        Objects.requireNonNull(samples, "Null samples");
        Objects.requireNonNull(bitDepth, "Null bit depth");
        Objects.requireNonNull(loop, "Null loop");
    }

    @FunctionalInterface
    private interface BlockBody {
        void process(int from, int to);
    }
}
