/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.ingest;

import ai.evacortex.photonstack.core.storage.ContainerStore;

import java.nio.file.Path;

/**
 * A vendor binary recording, identified by its path.
 */
public record Recording(Path path) {

    public String stem() {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /** {@code <stem>.psc} in {@code outputDir}, or next to the recording when {@code outputDir} is null. */
    public Path containerPath(Path outputDir) {
        Path dir = outputDir != null ? outputDir : path.toAbsolutePath().getParent();
        return dir.resolve(stem() + ContainerStore.EXTENSION);
    }
}
