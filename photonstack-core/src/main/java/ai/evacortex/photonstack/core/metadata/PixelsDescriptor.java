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

/**
 * The subset of an OME {@code Pixels} element the pipeline needs.
 */
public record PixelsDescriptor(int sizeT, int sizeZ, int sizeY, int sizeX, int sizeC,
                               SampleType sampleType, ByteOrder byteOrder) {

    /**
     * Frame-major shape {@code (T, Y, X)}, or {@code (T, Y, X, C)} for multichannel data.
     * Z planes are acquired as consecutive frames.
     */
    public int[] shape() {
        int frames = Math.multiplyExact(sizeT, sizeZ);
        return sizeC > 1 ? new int[]{frames, sizeY, sizeX, sizeC} : new int[]{frames, sizeY, sizeX};
    }
}
