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
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Executes a loop body for every index of a range, maybe in parallel.
 *
 * <p>{@link PixelData} uses it for splitting rendering into rows and normalization into blocks of samples.
 * The body must not depend on the order of indexes.</p>
 */
@FunctionalInterface
public interface ParallelLoop {
    /**
     * Uses the common fork-join pool; no threads are created or owned by pixel data objects.
     */
    ParallelLoop FORK_JOIN = new ParallelLoop() {
        @Override
        public void run(int from, int to, IntConsumer body) {
            Objects.requireNonNull(body, "Null loop body");
            if (to - from <= 1) {
                SEQUENTIAL.run(from, to, body);
            } else {
                IntStream.range(from, to).parallel().forEach(body);
            }
        }

        @Override
        public String toString() {
            return "fork-join loop";
        }
    };

    /**
     * Simple loop in the current thread, in increasing order of indexes.
     */
    ParallelLoop SEQUENTIAL = new ParallelLoop() {
        @Override
        public void run(int from, int to, IntConsumer body) {
            Objects.requireNonNull(body, "Null loop body");
            for (int k = from; k < to; k++) {
                body.accept(k);
            }
        }

        @Override
        public String toString() {
            return "sequential loop";
        }
    };

    void run(int from, int to, IntConsumer body);

    /**
     * Returns {@link #FORK_JOIN}, or {@link #SEQUENTIAL} if the system property
     * <code>net.algart.matrices.dicom.parallel</code> is <code>false</code>.
     *
     * @return default loop for new pixel data.
     */
    static ParallelLoop getDefault() {
        return PixelData.DEFAULT_PARALLEL ? FORK_JOIN : SEQUENTIAL;
    }
}
