/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.stage;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.storage.ContainerBatch;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A transformation that reads a container and writes a fixed set of output datasets back to it.
 *
 * <p>A stage is complete when all of {@link #outputPaths()} exist and {@link #markerPath()}
 * carries {@link #markerAttribute()}. {@link StageRunner} writes that attribute last.</p>
 *
 * @param <R> in-memory result handed from {@link #compute} to {@link #writeOutputs}
 */
public interface ProcessingStage<R> {

    String name();

    /** Suffix of the scratch directory {@code .<container-file-name>.<suffix>}. */
    String scratchSuffix();

    List<String> outputPaths();

    String markerPath();

    String markerAttribute();

    /**
     * Runs the computation. May take arbitrarily long and must not mutate {@code store}.
     *
     * @param scratchDir working area for the computation; does not exist on entry and is removed afterwards
     */
    R compute(CanonicalStore store, Path scratchDir) throws IOException;

    /** Writes the result; all calls land in one commit together with the removal of old outputs. */
    void writeOutputs(ContainerBatch batch, R result);

    /** Attributes set on {@link #markerPath()}; must include {@link #markerAttribute()}. */
    Map<String, Object> completionAttributes(R result, Duration elapsed);
}
