/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
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

package io.avery.pivot;

import java.util.Arrays;

/**
 * A growable list of the raw values collected for one (row, column, measure) combination, before reduction.
 */
final class Bucket {
    private static final double[] EMPTY = new double[0];

    private double[] values = EMPTY;
    private int size = 0;

    void add(double value) {
        if (size == values.length)
            values = Arrays.copyOf(values, Math.max(8, size * 2));
        values[size++] = value;
    }

    void addAll(Bucket other) {
        if (other.size == 0)
            return;
        if (size + other.size > values.length)
            values = Arrays.copyOf(values, Math.max(size + other.size, size * 2));
        System.arraycopy(other.values, 0, values, size, other.size);
        size += other.size;
    }

    int size() {
        return size;
    }

    double[] toArray() {
        return size == 0 ? EMPTY : Arrays.copyOf(values, size);
    }
}
