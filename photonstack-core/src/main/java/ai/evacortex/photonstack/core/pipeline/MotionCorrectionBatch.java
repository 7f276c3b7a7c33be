/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.pipeline;

import ai.evacortex.photonstack.core.io.PathCollector;
import ai.evacortex.photonstack.core.motion.MotionConfig;
import ai.evacortex.photonstack.core.motion.MotionCorrectionStage;
import ai.evacortex.photonstack.core.motion.MotionEstimator;
import ai.evacortex.photonstack.core.stage.StageRunner;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import ai.evacortex.photonstack.core.storage.ContainerStore;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch motion correction of every container under a source path.
 */
public final class MotionCorrectionBatch {

    public static final List<String> EXTENSIONS = List.of(ContainerStore.EXTENSION);

    private final MotionEstimator estimator;
    private final StageRunner runner;
    private final CompressionSpec compression;

    public MotionCorrectionBatch(MotionEstimator estimator, StageRunner runner, CompressionSpec compression) {
        this.estimator = estimator;
        this.runner = runner;
        this.compression = compression;
    }

    /**
     * @param settings TOML file with a {@code [motion-correction]} table
     * @throws ai.evacortex.photonstack.core.exceptions.MissingSettingsException if {@code settings} is absent
     */
    public BatchReport correct(Path source, Path settings, boolean recursive, String include, String exclude,
                               boolean force) {
        MotionConfig config = MotionConfig.fromFile(settings);
        MotionCorrectionStage stage = new MotionCorrectionStage(estimator, config, compression);
        List<Path> containers = PathCollector.findPaths(source, EXTENSIONS, recursive, true, include, exclude);
        return BatchProcessor.run("motion-correct", containers, path -> !runner.run(path, stage, force).isSkipped());
    }
}
