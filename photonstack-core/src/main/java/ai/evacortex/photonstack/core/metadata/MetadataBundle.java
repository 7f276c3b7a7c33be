/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.SampleType;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to decode and describe one recording. Immutable.
 *
 * @param shape            frame-major shape {@code (T, Y, X[, C])}
 * @param sampleType       on-disk sample type
 * @param byteOrder        on-disk byte order
 * @param metadata         typed INI key/values
 * @param descriptor       descriptor document the shape was read from, may be {@code null}
 * @param descriptorSource name of the source that supplied the descriptor, may be {@code null}
 */
public record MetadataBundle(int[] shape,
                             SampleType sampleType,
                             ByteOrder byteOrder,
                             Map<String, Object> metadata,
                             String descriptor,
                             String descriptorSource) {

    public MetadataBundle {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(sampleType, "sampleType");
        Objects.requireNonNull(byteOrder, "byteOrder");
        shape = shape.clone();
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    public int frameCount() {
        return shape[0];
    }

    public long expectedByteCount() {
        long n = sampleType.byteSize();
        for (int d : shape) n = Math.multiplyExact(n, (long) d);
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataBundle other)) return false;
        return Arrays.equals(shape, other.shape)
                && sampleType == other.sampleType
                && byteOrder.equals(other.byteOrder)
                && metadata.equals(other.metadata)
                && Objects.equals(descriptor, other.descriptor)
                && Objects.equals(descriptorSource, other.descriptorSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(shape), sampleType, byteOrder, metadata, descriptor, descriptorSource);
    }

    @Override
    public String toString() {
        return "MetadataBundle[shape=" + Arrays.toString(shape) + ", sampleType=" + sampleType
                + ", byteOrder=" + byteOrder + ", source=" + descriptorSource + "]";
    }
}
