/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.NdArray;

import java.util.Map;

/**
 * Mutations staged against a container and committed together.
 * Reads through {@link #exists(String)} see the staged state.
 */
public interface ContainerBatch {

    void create(String path, NdArray array, Chunking chunking, CompressionSpec compression);

    void delete(String path);

    void setAttributes(String path, Map<String, Object> attributes);

    boolean exists(String path);
}
