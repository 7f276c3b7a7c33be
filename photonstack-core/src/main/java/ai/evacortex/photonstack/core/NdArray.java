/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Dense, C-ordered N-dimensional array of a fixed-width {@link SampleType}.
 *
 * <p>Axis 0 is the frame (time) axis for imaging data, so frame {@code i} occupies one
 * contiguous byte range. Storage is a little-endian heap buffer; {@link #frame(int)},
 * {@link #reshape(int...)} and {@link #squeeze()} share it, {@link #copy()} does not.</p>
 */
public final class NdArray {

    private final SampleType type;
    private final int[] shape;
    private final ByteBuffer data;

    private NdArray(SampleType type, int[] shape, ByteBuffer data) {
        this.type = type;
        this.shape = shape;
        this.data = data.order(ByteOrder.LITTLE_ENDIAN);
    }

    public static NdArray allocate(SampleType type, int... shape) {
        Objects.requireNonNull(type, "type must not be null");
        int[] dims = validateShape(shape);
        int bytes = Math.multiplyExact(elementCount(dims), type.byteSize());
        return new NdArray(type, dims, ByteBuffer.allocate(bytes));
    }

    /**
     * Wraps little-endian bytes. The buffer's remaining length must match the shape exactly.
     */
    public static NdArray wrap(SampleType type, int[] shape, ByteBuffer bytes) {
        Objects.requireNonNull(type, "type must not be null");
        int[] dims = validateShape(shape);
        long expected = (long) elementCount(dims) * type.byteSize();
        if (bytes.remaining() != expected) {
            throw new IllegalArgumentException("Byte length " + bytes.remaining()
                    + " does not match shape " + Arrays.toString(dims) + " of " + type + " (" + expected + " bytes)");
        }
        return new NdArray(type, dims, bytes.slice());
    }

    public static NdArray ofDoubles(int[] shape, double... values) {
        NdArray array = allocate(SampleType.FLOAT64, shape);
        if (values.length != array.size()) {
            throw new IllegalArgumentException("Expected " + array.size() + " values, got " + values.length);
        }
        for (int i = 0; i < values.length; i++) array.setDouble(i, values[i]);
        return array;
    }

    public static NdArray ofMatrix(double[][] rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        NdArray array = allocate(SampleType.FLOAT64, rows.length, cols);
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != cols) throw new IllegalArgumentException("Ragged matrix at row " + r);
            for (int c = 0; c < cols; c++) array.setDouble((long) r * cols + c, rows[r][c]);
        }
        return array;
    }

    public SampleType type() { return type; }
    public int rank()        { return shape.length; }
    public int[] shape()     { return shape.clone(); }
    public int dim(int axis) { return shape[axis]; }
    public int size()        { return elementCount(shape); }
    public int byteSize()    { return data.capacity(); }

    public double getDouble(long flatIndex) {
        return type.read(data, offsetOf(flatIndex));
    }

    public void setDouble(long flatIndex, double value) {
        type.write(data, offsetOf(flatIndex), value);
    }

    public double get(int... index) {
        return getDouble(flatten(index));
    }

    public void set(double value, int... index) {
        setDouble(flatten(index), value);
    }

    /** Number of elements along axis 0, or 1 for a scalar-shaped array. */
    public int frameCount() {
        return shape.length == 0 ? 1 : shape[0];
    }

    public int[] frameShape() {
        return Arrays.copyOfRange(shape, 1, shape.length);
    }

    public int frameByteSize() {
        return elementCount(frameShape()) * type.byteSize();
    }

    /** View of frame {@code index} along axis 0, with the leading axis dropped. */
    public NdArray frame(int index) {
        if (shape.length == 0) throw new IllegalStateException("Cannot take a frame of a rank-0 array");
        Objects.checkIndex(index, shape[0]);
        return frames(index, 1).reshape(frameShape());
    }

    /** View of {@code count} consecutive frames starting at {@code from}, leading axis kept. */
    public NdArray frames(int from, int count) {
        Objects.checkFromIndexSize(from, count, shape[0]);
        int frameBytes = frameByteSize();
        ByteBuffer view = data.duplicate();
        view.position(from * frameBytes).limit((from + count) * frameBytes);
        int[] dims = shape.clone();
        dims[0] = count;
        return new NdArray(type, dims, view.slice());
    }

    public NdArray reshape(int... newShape) {
        int[] dims = validateShape(newShape);
        if (elementCount(dims) != size()) {
            throw new IllegalArgumentException("Cannot reshape " + Arrays.toString(shape)
                    + " into " + Arrays.toString(dims));
        }
        return new NdArray(type, dims, data.duplicate());
    }

    /** Drops every axis of length one. */
    public NdArray squeeze() {
        return reshape(Arrays.stream(shape).filter(d -> d != 1).toArray());
    }

    public NdArray convertTo(SampleType target) {
        if (target == type) return copy();
        NdArray out = allocate(target, shape);
        int n = size();
        for (int i = 0; i < n; i++) out.setDouble(i, getDouble(i));
        return out;
    }

    public NdArray copy() {
        ByteBuffer copy = ByteBuffer.allocate(data.capacity());
        copy.put(data.duplicate().clear());
        copy.flip();
        return new NdArray(type, shape.clone(), copy);
    }

    /** Read-only little-endian view of the raw bytes. */
    public ByteBuffer bytes() {
        return data.duplicate().clear().asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public byte[] toByteArray() {
        byte[] out = new byte[data.capacity()];
        data.duplicate().clear().get(out);
        return out;
    }

    public double[] toDoubleArray() {
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) out[i] = getDouble(i);
        return out;
    }

    public boolean contentEquals(NdArray other) {
        return other != null
                && type == other.type
                && Arrays.equals(shape, other.shape)
                && data.duplicate().clear().equals(other.data.duplicate().clear());
    }

    private int offsetOf(long flatIndex) {
        Objects.checkIndex(flatIndex, (long) size());
        return (int) flatIndex * type.byteSize();
    }

    private long flatten(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        long flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            Objects.checkIndex(index[axis], shape[axis]);
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    public static int elementCount(int... dims) {
        int n = 1;
        for (int d : dims) n = Math.multiplyExact(n, d);
        return n;
    }

    private static int[] validateShape(int[] shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        for (int d : shape) {
            if (d < 0) throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
        }
        return shape.clone();
    }

    @Override
    public String toString() {
        return "NdArray[" + type + " " + Arrays.toString(shape) + "]";
    }
}
