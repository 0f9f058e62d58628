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
 * DICOM bit-depth model of one sample: Bits Allocated (0028,0100), Bits Stored (0028,0101)
 * and High Bit (0028,0102).
 *
 * <p>The high bit is usually <code>bitsStored-1</code>, but it is stored independently
 * to support non-standard encodings.</p>
 *
 * <p>This class is immutable.</p>
 */
public final class BitDepth {
    public static final int MAX_BITS_ALLOCATED = 32;

    private final int bitsAllocated;
    private final int bitsStored;
    private final int highBit;

    private BitDepth(int bitsAllocated, int bitsStored, int highBit) {
        if (bitsAllocated <= 0 || bitsAllocated > MAX_BITS_ALLOCATED) {
            throw new IllegalArgumentException("Bits allocated " + bitsAllocated +
                    " is out of range 1.." + MAX_BITS_ALLOCATED);
        }
        if (bitsStored <= 0 || bitsStored > bitsAllocated) {
            throw new IllegalArgumentException("Bits stored " + bitsStored +
                    " is out of range 1..bitsAllocated=" + bitsAllocated);
        }
        if (highBit < 0 || highBit >= bitsAllocated) {
            throw new IllegalArgumentException("High bit " + highBit +
                    " is out of range 0..bitsAllocated-1=" + (bitsAllocated - 1));
        }
        this.bitsAllocated = bitsAllocated;
        this.bitsStored = bitsStored;
        this.highBit = highBit;
    }

    public static BitDepth of(int bitsAllocated, int bitsStored, int highBit) {
        return new BitDepth(bitsAllocated, bitsStored, highBit);
    }

    public static BitDepth of(int bitsAllocated, int bitsStored) {
        return new BitDepth(bitsAllocated, bitsStored, bitsStored - 1);
    }

    public static BitDepth full(int bits) {
        return new BitDepth(bits, bits, bits - 1);
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

    /**
     * Returns the number of unused high bits: <code>bitsAllocated-bitsStored</code>.
     */
    public int unusedBits() {
        return bitsAllocated - bitsStored;
    }

    public boolean isStandardHighBit() {
        return highBit == bitsStored - 1;
    }

    @Override
    public String toString() {
        return "bit depth " + bitsAllocated + "/" + bitsStored + "/" + highBit +
                " (allocated/stored/high bit)";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitDepth that)) {
            return false;
        }
        return bitsAllocated == that.bitsAllocated && bitsStored == that.bitsStored && highBit == that.highBit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitsAllocated, bitsStored, highBit);
    }
}
