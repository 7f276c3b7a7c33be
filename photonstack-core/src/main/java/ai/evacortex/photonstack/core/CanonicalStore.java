/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core;

import ai.evacortex.photonstack.core.storage.Chunking;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import ai.evacortex.photonstack.core.storage.ContainerBatch;
import ai.evacortex.photonstack.core.storage.DatasetInfo;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Per-recording container of named datasets with attributes.
 *
 * <p>Every mutating call is its own commit; {@link #batch(Consumer)} groups several mutations
 * into one. A commit is all-or-nothing.</p>
 */
public interface CanonicalStore {

    boolean exists(String path);

    NdArray read(String path);

    /** Frame {@code index} along the leading axis of the dataset. */
    NdArray readFrame(String path, int index);

    DatasetInfo describe(String path);

    Map<String, Object> getAttributes(String path);

    Set<String> datasetPaths();

    /**
     * @throws ai.evacortex.photonstack.core.exceptions.DatasetAlreadyExistsException if {@code path} exists
     */
    void create(String path, NdArray array, Chunking chunking, CompressionSpec compression);

    /** Removes {@code path}; does nothing if it does not exist. */
    void delete(String path);

    /** Merges {@code attributes} into the existing ones of {@code path}. */
    void setAttributes(String path, Map<String, Object> attributes);

    void batch(Consumer<ContainerBatch> mutations);
}
