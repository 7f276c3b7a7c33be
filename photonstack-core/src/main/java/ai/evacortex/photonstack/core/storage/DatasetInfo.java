/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.SampleType;

/**
 * Shape, type and storage layout of one dataset, without its data.
 */
public record DatasetInfo(String path,
                          SampleType sampleType,
                          int[] shape,
                          int[] chunkShape,
                          CompressionSpec compression,
                          int chunkCount,
                          long storedBytes) {

    public DatasetInfo {
        shape = shape.clone();
        chunkShape = chunkShape.clone();
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public int[] chunkShape() {
        return chunkShape.clone();
    }

    public boolean shuffle() {
        return compression.shuffle();
    }

    public int frameCount() {
        return shape.length == 0 ? 1 : shape[0];
    }
}
