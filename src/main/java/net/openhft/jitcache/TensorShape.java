/*
 * Copyright 2014 Higher Frequency Trading
 *
 *       https://chronicle.software
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.openhft.jitcache;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * An immutable, fully known tensor shape.
 */
public final class TensorShape {
    private static final TensorShape SCALAR = new TensorShape(new long[0]);

    private final long[] dims;

    private TensorShape(long[] dims) {
        this.dims = dims;
    }

    @NotNull
    public static TensorShape scalar() {
        return SCALAR;
    }

    /**
     * @param dims the dimension sizes, outermost first
     * @throws IllegalArgumentException if any dimension is negative
     */
    @NotNull
    public static TensorShape of(@NotNull long... dims) {
        if (dims.length == 0)
            return SCALAR;
        for (int i = 0; i < dims.length; i++) {
            if (dims[i] < 0)
                throw new IllegalArgumentException("Dimension " + i + " of " + Arrays.toString(dims) + " is negative");
        }
        return new TensorShape(dims.clone());
    }

    public int rank() {
        return dims.length;
    }

    public long dim(int index) {
        return dims[index];
    }

    @NotNull
    public long[] dims() {
        return dims.clone();
    }

    /**
     * @return the product of the dimensions, 1 for a scalar
     */
    public long numElements() {
        long count = 1;
        for (long dim : dims)
            count = Math.multiplyExact(count, dim);
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorShape)) return false;
        return Arrays.equals(dims, ((TensorShape) o).dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < dims.length; i++) {
            if (i > 0)
                sb.append(',');
            sb.append(dims[i]);
        }
        return sb.append(']').toString();
    }
}
