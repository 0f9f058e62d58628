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

import net.algart.matrices.dicom.resampling.PixelResampler;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class PixelDataTest {
    static byte[] shortsToBytes(ByteOrder byteOrder, int... values) {
        final ByteBuffer buffer = ByteBuffer.allocate(2 * values.length).order(byteOrder);
        for (int v : values) {
            buffer.putShort((short) v);
        }
        return buffer.array();
    }

    static byte[] intsToBytes(ByteOrder byteOrder, int... values) {
        final ByteBuffer buffer = ByteBuffer.allocate(4 * values.length).order(byteOrder);
        for (int v : values) {
            buffer.putInt(v);
        }
        return buffer.array();
    }

    private static GrayInt16PixelData int16(int width, int height, BitDepth bitDepth, int... values) {
        return new GrayInt16PixelData(width, height, bitDepth, shortsToBytes(ByteOrder.LITTLE_ENDIAN, values),
                ByteOrder.LITTLE_ENDIAN, ParallelLoop.SEQUENTIAL, PixelResampler.getDefault());
    }

    private static int[] render(PixelData data, LookupTable lut) {
        final int[] output = new int[data.numberOfPixels()];
        data.render(lut, output);
        return output;
    }

    @Test
    public void testUInt8() {
        final GrayUInt8PixelData data = new GrayUInt8PixelData(2, 2, new byte[]{0, 1, (byte) 128, (byte) 255});
        assertEquals(DicomPixelFormat.UINT8, data.format());
        assertEquals(1, data.components());
        assertArrayEquals(new int[]{0, 1, 128, 255}, render(data, null));
        assertEquals(PixelRange.of(0, 255), data.getMinMax(-1));
        assertEquals(PixelRange.of(1, 255), data.getMinMax(0));
    }

    @Test
    public void testUInt8StoredBits() {
        final GrayUInt8PixelData data = new GrayUInt8PixelData(3, 1, new byte[]{(byte) 0xFF, 0x3C, 0x40},
                BitDepth.of(8, 6), ParallelLoop.SEQUENTIAL, PixelResampler.getDefault());
        assertArrayEquals(new byte[]{0x3F, 0x3C, 0x00}, data.samples());
    }

    @Test
    public void testInt16SignExtension() {
        final GrayInt16PixelData data = int16(3, 1, BitDepth.of(16, 12, 11), 0x0FFF, 0x07FF, 0x0800);
        assertArrayEquals(new short[]{-1, 2047, -2048}, data.samples());
        assertArrayEquals(new int[]{-1, 2047, -2048}, render(data, null));
        assertEquals(PixelRange.of(-2048, 2047), data.getMinMax(Integer.MIN_VALUE));
    }

    @Test
    public void testUInt16() {
        final GrayUInt16PixelData data = new GrayUInt16PixelData(2, 1, BitDepth.full(16),
                shortsToBytes(ByteOrder.LITTLE_ENDIAN, 0xFFFF, 0x8000));
        assertArrayEquals(new int[]{65535, 32768}, render(data, null));
        assertEquals(PixelRange.of(32768, 65535), data.getMinMax(0));
        assertEquals(PixelRange.of(32768, 32768), data.getMinMax(65535));
    }

    @Test
    public void testBigEndian() {
        final GrayUInt16PixelData data = new GrayUInt16PixelData(2, 1, BitDepth.full(16),
                shortsToBytes(ByteOrder.BIG_ENDIAN, 0x1234, 0xABCD),
                ByteOrder.BIG_ENDIAN, ParallelLoop.SEQUENTIAL, PixelResampler.getDefault());
        assertArrayEquals(new int[]{0x1234, 0xABCD}, render(data, null));
        final GrayInt32PixelData data32 = new GrayInt32PixelData(2, 1, BitDepth.full(32),
                intsToBytes(ByteOrder.BIG_ENDIAN, -7, 123456789),
                ByteOrder.BIG_ENDIAN, ParallelLoop.SEQUENTIAL, PixelResampler.getDefault());
        assertArrayEquals(new int[]{-7, 123456789}, data32.samples());
    }

    @Test
    public void testInt32AndUInt32() {
        final GrayInt32PixelData signed = new GrayInt32PixelData(3, 1, BitDepth.of(32, 20),
                intsToBytes(ByteOrder.LITTLE_ENDIAN, 0xFFFFF, 5, 0x80000));
        assertArrayEquals(new int[]{-1, 5, -524288}, render(signed, null));
        assertEquals(PixelRange.of(-524288, 5), signed.getMinMax(Integer.MAX_VALUE));

        final GrayUInt32PixelData unsigned = new GrayUInt32PixelData(2, 1, BitDepth.full(32),
                intsToBytes(ByteOrder.LITTLE_ENDIAN, 0xFFFFFFFF, 7));
        assertArrayEquals(new int[]{-1, 7}, render(unsigned, null));
        assertFalse(unsigned.supportsMinMax());
        for (int k = 0; k < 3; k++) {
            assertThrows(UnsupportedOperationException.class, () -> unsigned.getMinMax(0));
        }
        assertEquals(Optional.empty(), unsigned.findMinMax(0));
    }

    @Test
    public void testRgb24() {
        final Rgb24PixelData data = new Rgb24PixelData(2, 1, new byte[]{1, 2, 3, (byte) 255, (byte) 128, 0});
        assertEquals(3, data.components());
        assertArrayEquals(new int[]{0x010203, 0xFF8000}, render(data, null));
        assertArrayEquals(new int[]{0x020406, 0xFE0000}, render(data, v -> (2 * v) & 0xFF));
        assertFalse(data.supportsMinMax());
        assertThrows(UnsupportedOperationException.class, () -> data.getMinMax(0));
        assertTrue(data.findMinMax(0).isEmpty());
    }

    @Test
    public void testOverlay() {
        final OverlayBitPixelData data = new OverlayBitPixelData(4, 2, new byte[]{(byte) 0b1010_0001});
        assertEquals(DicomPixelFormat.OVERLAY_BIT, data.format());
        assertArrayEquals(new int[]{1, 0, 0, 0, 0, 1, 0, 1}, render(data, null));
        assertEquals(PixelRange.of(0, 1), data.getMinMax(-1));
        assertArrayEquals(new int[]{0, 255, 255, 255, 255, 0, 255, 0}, render(data, v -> v == 0 ? 255 : 0));
    }

    @Test
    public void testMinMaxEdgeCases() {
        // single sample: min and max must both be found
        assertEquals(PixelRange.of(7, 7), int16(1, 1, BitDepth.full(16), 7).getMinMax(0));
        // strictly increasing and decreasing frames
        assertEquals(PixelRange.of(1, 5), int16(5, 1, BitDepth.full(16), 1, 2, 3, 4, 5).getMinMax(0));
        assertEquals(PixelRange.of(1, 5), int16(5, 1, BitDepth.full(16), 5, 4, 3, 2, 1).getMinMax(0));
        // only padding
        final PixelRange empty = int16(3, 1, BitDepth.full(16), -2000, -2000, -2000).getMinMax(-2000);
        assertSame(PixelRange.EMPTY, empty);
        assertTrue(empty.isEmpty());
        assertEquals(Integer.MAX_VALUE, empty.min());
        assertEquals(Integer.MIN_VALUE, empty.max());
        // empty frame
        assertTrue(new GrayUInt8PixelData(0, 5, new byte[0]).getMinMax(0).isEmpty());
        // padding inside data
        assertEquals(PixelRange.of(-3, 10),
                int16(4, 1, BitDepth.full(16), -3, -2000, 10, -2000).getMinMax(-2000));
    }

    @Test
    public void testFindMinMax() {
        final GrayInt16PixelData data = int16(2, 1, BitDepth.full(16), -5, 5);
        assertTrue(data.supportsMinMax());
        assertEquals(Optional.of(PixelRange.of(-5, 5)), data.findMinMax(100));
    }

    @Test
    public void testRenderWithLut() {
        final GrayInt16PixelData data = int16(3, 1, BitDepth.of(16, 12), 0x0FFF, 0, 100);
        // lookup table receives raw normalized values
        assertArrayEquals(new int[]{999, 1000, 1100}, render(data, v -> v + 1000));
    }

    @Test
    public void testRenderTooShortOutput() {
        final GrayUInt8PixelData data = new GrayUInt8PixelData(3, 2, new byte[6]);
        final int[] output = new int[5];
        Arrays.fill(output, 77);
        assertThrows(IllegalArgumentException.class, () -> data.render(null, output));
        assertArrayEquals(new int[]{77, 77, 77, 77, 77}, output);
        assertThrows(NullPointerException.class, () -> data.render(null, null));
        final int[] longer = new int[8];
        data.render(null, longer);
        assertArrayEquals(new int[8], longer);
    }

    @Test
    public void testSequentialAndParallelRenderMatch() {
        final Random rnd = new Random(2024);
        final int width = 517;
        final int height = 311;
        final byte[] frame = new byte[2 * width * height];
        rnd.nextBytes(frame);
        final LookupTable lut = v -> v * 3 - 17;
        final PixelData sequential = new GrayInt16PixelData(width, height, BitDepth.of(16, 14), frame,
                ByteOrder.LITTLE_ENDIAN, ParallelLoop.SEQUENTIAL, PixelResampler.getDefault());
        final PixelData parallel = new GrayInt16PixelData(width, height, BitDepth.of(16, 14), frame,
                ByteOrder.LITTLE_ENDIAN, ParallelLoop.FORK_JOIN, PixelResampler.getDefault());
        assertArrayEquals(render(sequential, null), render(parallel, null));
        assertArrayEquals(render(sequential, lut), render(parallel, lut));

        final byte[] rgb = new byte[3 * width * height];
        rnd.nextBytes(rgb);
        assertArrayEquals(
                render(new Rgb24PixelData(width, height, rgb, ParallelLoop.SEQUENTIAL, PixelResampler.getDefault()),
                        lut),
                render(new Rgb24PixelData(width, height, rgb, ParallelLoop.FORK_JOIN, PixelResampler.getDefault()),
                        lut));
    }

    @Test
    public void testRescale() {
        final byte[] frame = new byte[5 * 3];
        Arrays.fill(frame, (byte) 99);
        final GrayUInt8PixelData data = new GrayUInt8PixelData(5, 3, frame);
        assertSame(data, data.rescale(1.0));

        final PixelData half = data.rescale(0.5);
        assertEquals(2, half.width());
        assertEquals(1, half.height());
        assertEquals(DicomPixelFormat.UINT8, half.format());
        assertArrayEquals(new int[]{99, 99}, render(half, null));

        final PixelData larger = data.rescale(2.5);
        assertEquals(12, larger.width());
        assertEquals(7, larger.height());
        for (int v : render(larger, null)) {
            assertEquals(99, v);
        }
        // source is unchanged
        assertArrayEquals(frame, data.samples());
    }

    @Test
    public void testRescaleEveryFormat() {
        final int w = 8;
        final int h = 6;
        final byte[] u8 = new byte[w * h];
        Arrays.fill(u8, (byte) 200);
        final int[] values16 = new int[w * h];
        Arrays.fill(values16, -1234);
        final int[] values32 = new int[w * h];
        Arrays.fill(values32, 0xF0000000);
        final byte[] rgb = new byte[3 * w * h];
        for (int i = 0; i < w * h; i++) {
            rgb[3 * i] = 1;
            rgb[3 * i + 1] = 2;
            rgb[3 * i + 2] = 3;
        }
        final PixelData[] all = {
                new GrayUInt8PixelData(w, h, u8),
                new GrayInt16PixelData(w, h, BitDepth.full(16), shortsToBytes(ByteOrder.LITTLE_ENDIAN, values16)),
                new GrayUInt16PixelData(w, h, BitDepth.full(16), shortsToBytes(ByteOrder.LITTLE_ENDIAN, values16)),
                new GrayInt32PixelData(w, h, BitDepth.full(32), intsToBytes(ByteOrder.LITTLE_ENDIAN, values32)),
                new GrayUInt32PixelData(w, h, BitDepth.full(32), intsToBytes(ByteOrder.LITTLE_ENDIAN, values32)),
                new Rgb24PixelData(w, h, rgb)
        };
        for (PixelData data : all) {
            final int[] expected = render(data, null);
            final PixelData scaled = data.rescale(0.75);
            assertEquals(data.format(), scaled.format(), data.toString());
            assertEquals(6, scaled.width());
            assertEquals(4, scaled.height());
            for (int v : render(scaled, null)) {
                assertEquals(expected[0], v, data.toString());
            }
        }
    }

    @Test
    public void testRescaleOverlayGivesUInt8() {
        final OverlayBitPixelData overlay = new OverlayBitPixelData(8, 2, new byte[]{(byte) 0xFF, (byte) 0xFF});
        final PixelData scaled = overlay.rescale(0.5);
        assertInstanceOf(GrayUInt8PixelData.class, scaled);
        assertEquals(DicomPixelFormat.UINT8, scaled.format());
        assertArrayEquals(new int[]{1, 1, 1, 1}, render(scaled, null));
    }

    @Test
    public void testIllegalRescale() {
        final GrayUInt8PixelData data = new GrayUInt8PixelData(5, 3, new byte[15]);
        assertThrows(IllegalArgumentException.class, () -> data.rescale(0.0));
        assertThrows(IllegalArgumentException.class, () -> data.rescale(-2.0));
        assertThrows(IllegalArgumentException.class, () -> data.rescale(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> data.rescale(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> data.rescale(0.2));
    }

    @Test
    public void testSingleRowCannotBeDownscaled() {
        final GrayUInt8PixelData row = new GrayUInt8PixelData(4, 1, new byte[]{1, 2, 3, 4});
        assertThrows(IllegalArgumentException.class, () -> row.rescale(0.5));
        assertThrows(IllegalArgumentException.class, () -> row.rescale(0.99));
        final GrayUInt8PixelData column = new GrayUInt8PixelData(1, 4, new byte[]{1, 2, 3, 4});
        assertThrows(IllegalArgumentException.class, () -> column.rescale(0.5));
        final PixelData larger = row.rescale(2.0);
        assertEquals(8, larger.width());
        assertEquals(2, larger.height());
    }

    @Test
    public void testSamplesAreCopies() {
        final GrayUInt8PixelData data = new GrayUInt8PixelData(2, 1, new byte[]{5, 6});
        final byte[] samples = data.samples();
        samples[0] = 100;
        assertArrayEquals(new byte[]{5, 6}, data.samples());
    }

    @Test
    public void testFrameIsNotModified() {
        final byte[] frame = shortsToBytes(ByteOrder.LITTLE_ENDIAN, 0xFFFF, 0x0800);
        final byte[] copy = frame.clone();
        new GrayInt16PixelData(2, 1, BitDepth.of(16, 12), frame);
        assertArrayEquals(copy, frame);
    }

    @Test
    public void testTooShortFrame() {
        assertThrows(IllegalArgumentException.class, () -> new GrayUInt8PixelData(3, 3, new byte[8]));
        assertThrows(IllegalArgumentException.class,
                () -> new GrayUInt16PixelData(2, 2, BitDepth.full(16), new byte[7]));
        assertThrows(IllegalArgumentException.class, () -> new Rgb24PixelData(2, 1, new byte[5]));
        assertThrows(NullPointerException.class, () -> new GrayUInt8PixelData(1, 1, null));
    }
}
