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
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fixed-width sample types supported by the frame decoder and the canonical container.
 *
 * <p>Values are always laid out little-endian in memory. Conversions through {@code double}
 * truncate toward zero and clamp to the representable range of integer types.</p>
 */
public enum SampleType {

    UINT8("uint8", 1, true, false),
    INT8("int8", 1, true, true),
    UINT16("uint16", 2, true, false),
    INT16("int16", 2, true, true),
    UINT32("uint32", 4, true, false),
    INT32("int32", 4, true, true),
    INT64("int64", 8, true, true),
    FLOAT32("float32", 4, false, true),
    FLOAT64("float64", 8, false, true);

    private static final Map<String, SampleType> ALIASES = Map.of(
            "float", FLOAT32,
            "double", FLOAT64,
            "u1", UINT8,
            "u2", UINT16,
            "u4", UINT32,
            "i2", INT16,
            "i4", INT32,
            "f4", FLOAT32,
            "f8", FLOAT64
    );

    private final String typeName;
    private final int byteSize;
    private final boolean integral;
    private final boolean signed;

    SampleType(String typeName, int byteSize, boolean integral, boolean signed) {
        this.typeName = typeName;
        this.byteSize = byteSize;
        this.integral = integral;
        this.signed = signed;
    }

    public String typeName() { return typeName; }
    public int byteSize()    { return byteSize; }
    public boolean isIntegral() { return integral; }
    public boolean isSigned()   { return signed; }

    /**
     * Resolves a sample type from its canonical name ({@code uint16}), an OME pixel type
     * ({@code float}, {@code double}) or a short numpy-style code ({@code u2}).
     */
    public static SampleType fromName(String name) {
        if (name == null) throw new IllegalArgumentException("Sample type name must not be null");
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("<") || key.startsWith(">") || key.startsWith("=")) key = key.substring(1);
        for (SampleType type : values()) {
            if (type.typeName.equals(key)) return type;
        }
        SampleType alias = ALIASES.get(key);
        if (alias != null) return alias;
        throw new IllegalArgumentException("Unsupported sample type '" + name + "'. Valid types are: "
                + Arrays.stream(values()).map(SampleType::typeName).collect(Collectors.joining(", ")));
    }

    public double minValue() {
        return switch (this) {
            case UINT8, UINT16, UINT32 -> 0;
            case INT8 -> Byte.MIN_VALUE;
            case INT16 -> Short.MIN_VALUE;
            case INT32 -> Integer.MIN_VALUE;
            case INT64 -> Long.MIN_VALUE;
            case FLOAT32 -> -Float.MAX_VALUE;
            case FLOAT64 -> -Double.MAX_VALUE;
        };
    }

    public double maxValue() {
        return switch (this) {
            case UINT8 -> 0xFF;
            case INT8 -> Byte.MAX_VALUE;
            case UINT16 -> 0xFFFF;
            case INT16 -> Short.MAX_VALUE;
            case UINT32 -> 0xFFFF_FFFFL;
            case INT32 -> Integer.MAX_VALUE;
            case INT64 -> Long.MAX_VALUE;
            case FLOAT32 -> Float.MAX_VALUE;
            case FLOAT64 -> Double.MAX_VALUE;
        };
    }

    /** Reads the sample stored at {@code byteOffset}; the buffer must be little-endian. */
    public double read(ByteBuffer buf, int byteOffset) {
        return switch (this) {
            case UINT8 -> buf.get(byteOffset) & 0xFF;
            case INT8 -> buf.get(byteOffset);
            case UINT16 -> buf.getShort(byteOffset) & 0xFFFF;
            case INT16 -> buf.getShort(byteOffset);
            case UINT32 -> buf.getInt(byteOffset) & 0xFFFF_FFFFL;
            case INT32 -> buf.getInt(byteOffset);
            case INT64 -> buf.getLong(byteOffset);
            case FLOAT32 -> buf.getFloat(byteOffset);
            case FLOAT64 -> buf.getDouble(byteOffset);
        };
    }

    /** Writes {@code value} at {@code byteOffset}, truncating and clamping for integral types. */
    public void write(ByteBuffer buf, int byteOffset, double value) {
        switch (this) {
            case UINT8 -> buf.put(byteOffset, (byte) quantize(value));
            case INT8 -> buf.put(byteOffset, (byte) quantize(value));
            case UINT16 -> buf.putShort(byteOffset, (short) quantize(value));
            case INT16 -> buf.putShort(byteOffset, (short) quantize(value));
            case UINT32 -> buf.putInt(byteOffset, (int) quantize(value));
            case INT32 -> buf.putInt(byteOffset, (int) quantize(value));
            case INT64 -> buf.putLong(byteOffset, quantize(value));
            case FLOAT32 -> buf.putFloat(byteOffset, (float) value);
            case FLOAT64 -> buf.putDouble(byteOffset, value);
        }
    }

    private long quantize(double value) {
        if (Double.isNaN(value)) return 0L;
        double clamped = Math.max(minValue(), Math.min(maxValue(), value));
        return (long) clamped;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
