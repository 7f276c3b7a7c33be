/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.pipeline;

import ai.evacortex.photonstack.core.exceptions.LocalProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a step to each path in turn.
 *
 * <p>A {@link LocalProcessingException} fails only the current path: it is logged with its
 * cause and the batch moves on. Any other exception aborts the batch.</p>
 */
public final class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    /** One unit of work; returns {@code false} when the path was skipped. */
    @FunctionalInterface
    public interface Step {
        boolean apply(Path path);
    }

    private BatchProcessor() {}

    public static BatchReport run(String command, List<Path> paths, Step step) {
        List<Path> processed = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        Map<Path, String> failed = new LinkedHashMap<>();

        log.info("{}: {} path(s)", command, paths.size());
        for (Path path : paths) {
            try {
                if (step.apply(path)) {
                    processed.add(path);
                } else {
                    skipped.add(path);
                }
            } catch (LocalProcessingException e) {
                log.error("{} failed for {}: {}", command, path, e.getMessage(), e);
                failed.put(path, e.getMessage());
            }
        }
        log.info("{}: {} processed, {} skipped, {} failed", command, processed.size(), skipped.size(), failed.size());
        return new BatchReport(processed, skipped, failed);
    }
}
