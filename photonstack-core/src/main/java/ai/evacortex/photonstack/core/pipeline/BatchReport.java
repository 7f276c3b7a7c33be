/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-path outcome of a batch command.
 *
 * @param failed failing path mapped to the message of its error
 */
public record BatchReport(List<Path> processed, List<Path> skipped, Map<Path, String> failed) {

    public BatchReport {
        processed = List.copyOf(processed);
        skipped = List.copyOf(skipped);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public int total() {
        return processed.size() + skipped.size() + failed.size();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
