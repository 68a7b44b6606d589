package io.museg.metaimage.types;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.museg.metaimage.errors.ShapeMismatchException;
import io.museg.metaimage.errors.UnsupportedTypeException;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/// An immutable N-dimensional numeric array.
///
/// Values are stored flat in row-major order (the last axis varies fastest) as raw bytes of a
/// single {@link ElementKind}, in an explicit {@link ByteOrder}. The byte order is part of the
/// representation only: two arrays with the same kind, shape and values are equal whatever their
/// byte order.
///
/// Arrays never change after construction; {@link #reshape}, {@link #astype} and
/// {@link #withByteOrder} return new instances, sharing storage where the bytes are unchanged.
///
/// ```
/// shape (2, 3)          flat index
/// ┌───┬───┬───┐         0 1 2
/// │ a │ b │ c │   ──►   3 4 5
/// ├───┼───┼───┤
/// │ d │ e │ f │
/// └───┴───┴───┘
/// ```
public final class NdArray {

    /// Byte order used for arrays built from Java primitive arrays.
    public static final ByteOrder DEFAULT_ORDER = ByteOrder.LITTLE_ENDIAN;

    private final ElementKind kind;
    private final int[] shape;
    private final int size;
    private final ByteOrder order;
    private final ByteBuffer data;

    private NdArray(ElementKind kind, int[] shape, ByteOrder order, ByteBuffer data) {
        this.kind = kind;
        this.shape = shape;
        this.size = elementCount(shape);
        this.order = order;
        this.data = data.asReadOnlyBuffer().order(order);
        if ((long) size * kind.width() != this.data.capacity()) {
            throw new ShapeMismatchException(null, "Array of shape " + Arrays.toString(shape) + " and kind "
                + kind + " needs " + ((long) size * kind.width()) + " bytes, got " + this.data.capacity());
        }
    }

    /// Wrap a Java primitive array, using the signed element kind its class carries.
    /// @param values a primitive array, for example {@code short[]}
    /// @param shape the array shape; a one-dimensional shape of the value count if empty
    /// @return a new array holding a copy of the values
    /// @throws UnsupportedTypeException if the values are not a supported primitive array
    public static NdArray wrap(Object values, int... shape) {
        Objects.requireNonNull(values, "values cannot be null");
        return wrap(ElementKind.forCarrier(values.getClass()), values, shape);
    }

    /// Wrap a Java primitive array as values of the given kind, for example {@code short[]} as UINT16.
    /// @param kind the element kind; its carrier must match the class of the values
    /// @param values a primitive array
    /// @param shape the array shape; a one-dimensional shape of the value count if empty
    /// @return a new array holding a copy of the values
    public static NdArray wrap(ElementKind kind, Object values, int... shape) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        ElementKind.forCarrier(values.getClass());
        if (values.getClass() != kind.carrier()) {
            throw new IllegalArgumentException("Element kind " + kind + " is carried by "
                + kind.carrier().getSimpleName() + ", got " + values.getClass().getSimpleName());
        }
        int length = Array.getLength(values);
        int[] dims = shape.length == 0 ? new int[]{length} : checkShape(shape);
        if (elementCount(dims) != length) {
            throw new ShapeMismatchException(null,
                "Cannot view " + length + " values as shape " + Arrays.toString(dims));
        }

        ByteBuffer buffer = ByteBuffer.allocate(byteCount(length, kind)).order(DEFAULT_ORDER);
        switch (kind) {
            case INT8, UINT8 -> buffer.put((byte[]) values);
            case BOOL -> {
                for (boolean value : (boolean[]) values) {
                    buffer.put(value ? (byte) 1 : (byte) 0);
                }
            }
            case INT16, UINT16 -> buffer.asShortBuffer().put((short[]) values);
            case INT32, UINT32 -> buffer.asIntBuffer().put((int[]) values);
            case INT64, UINT64 -> buffer.asLongBuffer().put((long[]) values);
            case FLOAT32 -> buffer.asFloatBuffer().put((float[]) values);
            case FLOAT64 -> buffer.asDoubleBuffer().put((double[]) values);
        }
        buffer.clear();
        return new NdArray(kind, dims, DEFAULT_ORDER, buffer);
    }

    /// @param kind the element kind
    /// @param shape the array shape
    /// @return an array of zeros
    public static NdArray zeros(ElementKind kind, int... shape) {
        int[] dims = checkShape(shape);
        return new NdArray(kind, dims, DEFAULT_ORDER, ByteBuffer.allocate(byteCount(elementCount(dims), kind)));
    }

    /// Interpret raw bytes as a flat row-major buffer of the given kind and order.
    /// @param kind the element kind
    /// @param order the byte order of multi-byte elements in {@code bytes}
    /// @param bytes the raw element bytes; not copied
    /// @param shape the array shape
    /// @return a new array viewing the bytes
    /// @throws ShapeMismatchException if the byte count does not match the shape
    public static NdArray fromBytes(ElementKind kind, ByteOrder order, byte[] bytes, int... shape) {
        return new NdArray(kind, checkShape(shape), order, ByteBuffer.wrap(bytes));
    }

    public ElementKind kind() {
        return kind;
    }

    /// @return a copy of the shape
    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return shape.length;
    }

    /// @param axis an axis index; negative values count from the last axis
    /// @return the extent of that axis
    public int dim(int axis) {
        return shape[axis < 0 ? shape.length + axis : axis];
    }

    /// @return the number of elements
    public int size() {
        return size;
    }

    public ByteOrder byteOrder() {
        return order;
    }

    /// @param index one index per axis
    /// @return the row-major flat index of that position
    public int flatIndex(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException(
                    "Index " + index[axis] + " out of bounds for axis " + axis + " of size " + shape[axis]);
            }
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    /// Read an element as an integer. Unsigned kinds are zero-extended, except UINT64 which returns
    /// the raw 64 bits. Floating point values are truncated toward zero.
    /// @param flatIndex the row-major flat index
    /// @return the element value
    public long getLong(int flatIndex) {
        int offset = offsetOf(flatIndex);
        return switch (kind) {
            case INT8 -> data.get(offset);
            case UINT8 -> data.get(offset) & 0xFFL;
            case BOOL -> data.get(offset) != 0 ? 1L : 0L;
            case INT16 -> data.getShort(offset);
            case UINT16 -> data.getShort(offset) & 0xFFFFL;
            case INT32 -> data.getInt(offset);
            case UINT32 -> data.getInt(offset) & 0xFFFFFFFFL;
            case INT64, UINT64 -> data.getLong(offset);
            case FLOAT32 -> (long) data.getFloat(offset);
            case FLOAT64 -> (long) data.getDouble(offset);
        };
    }

    /// @param flatIndex the row-major flat index
    /// @return the element value as a double, UINT64 values read as unsigned
    public double getDouble(int flatIndex) {
        int offset = offsetOf(flatIndex);
        return switch (kind) {
            case FLOAT32 -> data.getFloat(offset);
            case FLOAT64 -> data.getDouble(offset);
            case UINT64 -> unsignedToDouble(data.getLong(offset));
            default -> getLong(flatIndex);
        };
    }

    /// @return the smallest element value, or NaN for an empty array
    public double min() {
        double min = Double.NaN;
        for (int i = 0; i < size; i++) {
            double value = getDouble(i);
            if (Double.isNaN(min) || value < min) {
                min = value;
            }
        }
        return min;
    }

    /// @return the largest element value, or NaN for an empty array
    public double max() {
        double max = Double.NaN;
        for (int i = 0; i < size; i++) {
            double value = getDouble(i);
            if (Double.isNaN(max) || value > max) {
                max = value;
            }
        }
        return max;
    }

    /// @param newShape the target shape, with the same element count
    /// @return an array viewing the same values with the new shape
    /// @throws ShapeMismatchException if the element counts differ
    public NdArray reshape(int... newShape) {
        int[] dims = checkShape(newShape);
        if (elementCount(dims) != size) {
            throw new ShapeMismatchException("DimSize", "Cannot reshape array of size " + size
                + " and shape " + Arrays.toString(shape) + " into shape " + Arrays.toString(dims));
        }
        if (Arrays.equals(dims, shape)) {
            return this;
        }
        return new NdArray(kind, dims, order, data);
    }

    /// Convert the values to another element kind. Integer narrowing wraps around, floating point
    /// to integer conversion truncates toward zero, and any non-zero value becomes 1 for BOOL.
    /// @param target the element kind to convert to
    /// @return this array if the kind is unchanged, else a converted copy in the same byte order
    public NdArray astype(ElementKind target) {
        Objects.requireNonNull(target, "target kind cannot be null");
        if (target == kind) {
            return this;
        }
        ByteBuffer out = ByteBuffer.allocate(byteCount(size, target)).order(order);
        for (int i = 0; i < size; i++) {
            int offset = i * target.width();
            switch (target) {
                case FLOAT32 -> out.putFloat(offset, (float) getDouble(i));
                case FLOAT64 -> out.putDouble(offset, getDouble(i));
                case BOOL -> out.put(offset, getDouble(i) != 0 ? (byte) 1 : (byte) 0);
                case INT8, UINT8 -> out.put(offset, (byte) getLong(i));
                case INT16, UINT16 -> out.putShort(offset, (short) getLong(i));
                case INT32, UINT32 -> out.putInt(offset, (int) getLong(i));
                case INT64, UINT64 -> out.putLong(offset, getLong(i));
            }
        }
        return new NdArray(target, shape, order, out);
    }

    /// @param target the byte order to store elements in
    /// @return this array if the order is unchanged, else a byte-swapped copy with identical values
    public NdArray withByteOrder(ByteOrder target) {
        Objects.requireNonNull(target, "target order cannot be null");
        if (target.equals(order)) {
            return this;
        }
        ByteBuffer out = ByteBuffer.allocate(byteCount(size, kind)).order(target);
        int width = kind.width();
        for (int i = 0; i < size; i++) {
            int offset = i * width;
            switch (width) {
                case 1 -> out.put(offset, data.get(offset));
                case 2 -> out.putShort(offset, data.getShort(offset));
                case 4 -> out.putInt(offset, data.getInt(offset));
                default -> out.putLong(offset, data.getLong(offset));
            }
        }
        return new NdArray(kind, shape, target, out);
    }

    /// @return a copy of the element bytes in this array's byte order
    public byte[] rawBytes() {
        byte[] bytes = new byte[data.capacity()];
        data.get(0, bytes);
        return bytes;
    }

    /// @param target the byte order to encode elements in
    /// @return a copy of the element bytes in the requested byte order
    public byte[] rawBytes(ByteOrder target) {
        return withByteOrder(target).rawBytes();
    }

    /// Copy the values out into a primitive array of this kind's carrier, for example {@code short[]}
    /// for UINT16.
    /// @return a new primitive array holding every value in row-major order
    public Object toArray() {
        ByteBuffer view = data.duplicate().order(order);
        switch (kind) {
            case INT8, UINT8 -> {
                byte[] out = new byte[size];
                view.get(out);
                return out;
            }
            case BOOL -> {
                boolean[] out = new boolean[size];
                for (int i = 0; i < size; i++) {
                    out[i] = view.get(i) != 0;
                }
                return out;
            }
            case INT16, UINT16 -> {
                short[] out = new short[size];
                view.asShortBuffer().get(out);
                return out;
            }
            case INT32, UINT32 -> {
                int[] out = new int[size];
                view.asIntBuffer().get(out);
                return out;
            }
            case INT64, UINT64 -> {
                long[] out = new long[size];
                view.asLongBuffer().get(out);
                return out;
            }
            case FLOAT32 -> {
                float[] out = new float[size];
                view.asFloatBuffer().get(out);
                return out;
            }
            default -> {
                double[] out = new double[size];
                view.asDoubleBuffer().get(out);
                return out;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NdArray)) {
            return false;
        }
        NdArray other = (NdArray) o;
        return kind == other.kind
            && Arrays.equals(shape, other.shape)
            && Arrays.equals(rawBytes(DEFAULT_ORDER), other.rawBytes(DEFAULT_ORDER));
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kind, Arrays.hashCode(shape));
        return 31 * result + Arrays.hashCode(rawBytes(DEFAULT_ORDER));
    }

    @Override
    public String toString() {
        return "NdArray{kind=" + kind + ", shape=" + Arrays.toString(shape) + ", order=" + order + "}";
    }

    private int offsetOf(int flatIndex) {
        if (flatIndex < 0 || flatIndex >= size) {
            throw new IndexOutOfBoundsException("Index " + flatIndex + " out of bounds for size " + size);
        }
        return flatIndex * kind.width();
    }

    private static double unsignedToDouble(long bits) {
        if (bits >= 0) {
            return bits;
        }
        return ((bits >>> 1) | (bits & 1L)) * 2.0;
    }

    private static int[] checkShape(int[] shape) {
        for (int extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    private static int byteCount(int elements, ElementKind kind) {
        long bytes = (long) elements * kind.width();
        if (bytes > Integer.MAX_VALUE) {
            throw new ShapeMismatchException("DimSize",
                elements + " elements of " + kind + " exceed the maximum in-memory buffer size");
        }
        return (int) bytes;
    }

    private static int elementCount(int[] shape) {
        long count = 1;
        for (int extent : shape) {
            count *= extent;
            if (count > Integer.MAX_VALUE) {
                throw new ShapeMismatchException("DimSize",
                    "Shape " + Arrays.toString(shape) + " exceeds the maximum in-memory array size");
            }
        }
        return (int) count;
    }
}
