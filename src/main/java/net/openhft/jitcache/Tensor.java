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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * An immutable tensor value held in host memory.
 * <p>
 * Elements are stored little-endian. Two tensors are equal when their type, shape and raw bytes are
 * equal, so floating point values compare by bit pattern rather than numerically.
 */
public final class Tensor {
    private static final int SUMMARIZE_MAX = 3;

    @NotNull
    private final DataType type;
    @NotNull
    private final TensorShape shape;
    @NotNull
    private final byte[] data;
    private final int hashCode;

    /**
     * @param type  element type, must be able to carry values
     * @param shape shape of the tensor
     * @param data  little-endian element bytes; copied
     * @throws IllegalArgumentException if the type has no values, {@code data} has the wrong length or the
     *                                  tensor would not fit in a byte array
     */
    public Tensor(@NotNull DataType type, @NotNull TensorShape shape, @NotNull byte[] data) {
        this(type, shape, data.clone(), true);
    }

    private Tensor(DataType type, TensorShape shape, byte[] data, boolean validate) {
        if (validate) {
            if (!type.hasValues())
                throw new IllegalArgumentException("Tensors of type " + type + " cannot hold values");
            int expected = byteCount(type, shape);
            if (data.length != expected)
                throw new IllegalArgumentException("Expected " + expected + " bytes for " + type + shape + " but got " + data.length);
        }
        this.type = type;
        this.shape = shape;
        this.data = data;
        int h = type.hashCode();
        h = 31 * h + shape.hashCode();
        h = 31 * h + Arrays.hashCode(data);
        this.hashCode = h;
    }

    @NotNull
    public static Tensor ofFloats(@NotNull TensorShape shape, @NotNull float... values) {
        ByteBuffer bb = allocate(DataType.FLOAT32, shape, values.length);
        for (float v : values)
            bb.putFloat(v);
        return new Tensor(DataType.FLOAT32, shape, bb.array(), false);
    }

    @NotNull
    public static Tensor ofDoubles(@NotNull TensorShape shape, @NotNull double... values) {
        ByteBuffer bb = allocate(DataType.FLOAT64, shape, values.length);
        for (double v : values)
            bb.putDouble(v);
        return new Tensor(DataType.FLOAT64, shape, bb.array(), false);
    }

    @NotNull
    public static Tensor ofInts(@NotNull TensorShape shape, @NotNull int... values) {
        ByteBuffer bb = allocate(DataType.INT32, shape, values.length);
        for (int v : values)
            bb.putInt(v);
        return new Tensor(DataType.INT32, shape, bb.array(), false);
    }

    @NotNull
    public static Tensor ofLongs(@NotNull TensorShape shape, @NotNull long... values) {
        ByteBuffer bb = allocate(DataType.INT64, shape, values.length);
        for (long v : values)
            bb.putLong(v);
        return new Tensor(DataType.INT64, shape, bb.array(), false);
    }

    @NotNull
    public static Tensor ofBooleans(@NotNull TensorShape shape, @NotNull boolean... values) {
        ByteBuffer bb = allocate(DataType.BOOL, shape, values.length);
        for (boolean v : values)
            bb.put((byte) (v ? 1 : 0));
        return new Tensor(DataType.BOOL, shape, bb.array(), false);
    }

    @NotNull
    public static Tensor scalar(float value) {
        return ofFloats(TensorShape.scalar(), value);
    }

    @NotNull
    public static Tensor scalar(int value) {
        return ofInts(TensorShape.scalar(), value);
    }

    private static ByteBuffer allocate(DataType type, TensorShape shape, int count) {
        int bytes = byteCount(type, shape);
        if (shape.numElements() != count)
            throw new IllegalArgumentException("Shape " + shape + " needs " + shape.numElements() + " values but got " + count);
        return ByteBuffer.allocate(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * @throws IllegalArgumentException if the tensor would not fit in a byte array
     */
    private static int byteCount(DataType type, TensorShape shape) {
        try {
            return Math.toIntExact(Math.multiplyExact(shape.numElements(), (long) type.byteSize()));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(type + shape.toString() + " does not fit in a byte array", e);
        }
    }

    @NotNull
    public DataType type() {
        return type;
    }

    @NotNull
    public TensorShape shape() {
        return shape;
    }

    /**
     * @return a copy of the little-endian element bytes
     */
    @NotNull
    public byte[] data() {
        return data.clone();
    }

    public int byteSize() {
        return data.length;
    }

    /**
     * Renders the type, shape and the first few values, e.g.
     * {@code Tensor<type: float32 shape: [2,2] values: 1.0 2.0 3.0...>}
     */
    @NotNull
    public String debugString() {
        StringBuilder sb = new StringBuilder("Tensor<type: ").append(type)
                .append(" shape: ").append(shape)
                .append(" values:");
        ByteBuffer bb = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        long count = shape.numElements();
        for (int i = 0; i < count && i < SUMMARIZE_MAX; i++) {
            sb.append(' ');
            appendValue(sb, bb, i * type.byteSize());
        }
        if (count > SUMMARIZE_MAX)
            sb.append("...");
        return sb.append('>').toString();
    }

    private void appendValue(StringBuilder sb, ByteBuffer bb, int offset) {
        switch (type) {
            case FLOAT32:
                sb.append(bb.getFloat(offset));
                break;
            case FLOAT64:
                sb.append(bb.getDouble(offset));
                break;
            case INT8:
                sb.append(bb.get(offset));
                break;
            case UINT8:
                sb.append(bb.get(offset) & 0xFF);
                break;
            case INT16:
                sb.append(bb.getShort(offset));
                break;
            case INT32:
                sb.append(bb.getInt(offset));
                break;
            case INT64:
                sb.append(bb.getLong(offset));
                break;
            case BOOL:
                sb.append(bb.get(offset) != 0);
                break;
            case FLOAT16:
            case BFLOAT16:
                sb.append(String.format("0x%04x", bb.getShort(offset) & 0xFFFF));
                break;
            default:
                throw new AssertionError("No values for " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor)) return false;
        Tensor other = (Tensor) o;
        return hashCode == other.hashCode
                && type == other.type
                && shape.equals(other.shape)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return debugString();
    }
}
