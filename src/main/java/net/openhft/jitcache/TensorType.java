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

import java.util.Objects;

/**
 * The element type and shape of a non-constant argument.
 */
public final class TensorType {
    /** Stands in for a variable which has no value yet. */
    public static final TensorType UNINITIALIZED = new TensorType(DataType.INVALID, TensorShape.scalar());

    @NotNull
    private final DataType type;
    @NotNull
    private final TensorShape shape;

    public TensorType(@NotNull DataType type, @NotNull TensorShape shape) {
        this.type = Objects.requireNonNull(type, "type");
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    @NotNull
    public static TensorType of(@NotNull DataType type, @NotNull long... dims) {
        return new TensorType(type, TensorShape.of(dims));
    }

    @NotNull
    public static TensorType of(@NotNull Tensor tensor) {
        return new TensorType(tensor.type(), tensor.shape());
    }

    @NotNull
    public DataType type() {
        return type;
    }

    @NotNull
    public TensorShape shape() {
        return shape;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorType)) return false;
        TensorType other = (TensorType) o;
        return type == other.type && shape.equals(other.shape);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + shape.hashCode();
    }

    @Override
    public String toString() {
        return type.displayName() + shape;
    }
}
