/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.exceptions.MotionEstimateMismatchException;
import ai.evacortex.photonstack.core.stage.ElapsedTime;
import ai.evacortex.photonstack.core.stage.ProcessingStage;
import ai.evacortex.photonstack.core.storage.Chunking;
import ai.evacortex.photonstack.core.storage.CompressionSpec;
import ai.evacortex.photonstack.core.storage.ContainerBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.evacortex.photonstack.core.storage.DatasetPaths.CORRECTED_IMAGING;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.DISPLACEMENTS;
import static ai.evacortex.photonstack.core.storage.DatasetPaths.RAW_IMAGING;

/**
 * Motion correction of {@code raw-imaging} into {@code corrected-imaging} and {@code displacements}.
 *
 * <p>The corrected frames are brought back to the raw shape and sample type (fractional values
 * truncated, out-of-range values clamped) and stored one frame per chunk. Displacements are
 * stored as a {@code (T, 2)} series of {@code (dy, dx)}.</p>
 */
public final class MotionCorrectionStage implements ProcessingStage<MotionEstimate> {

    private static final Logger log = LoggerFactory.getLogger(MotionCorrectionStage.class);

    public static final String STRATEGY = "STRATEGY";
    public static final String MAX_DISPLACEMENT = "MAX_DISPLACEMENT";
    public static final String PROCESSING_TIME = "PROCESSING_TIME";

    private final MotionEstimator estimator;
    private final MotionConfig config;
    private final CompressionSpec compression;

    public MotionCorrectionStage(MotionEstimator estimator, MotionConfig config) {
        this(estimator, config, CompressionSpec.lz4());
    }

    public MotionCorrectionStage(MotionEstimator estimator, MotionConfig config, CompressionSpec compression) {
        this.estimator = estimator;
        this.config = config;
        this.compression = compression;
    }

    @Override
    public String name() {
        return "motion-correction";
    }

    @Override
    public String scratchSuffix() {
        return "motion";
    }

    @Override
    public List<String> outputPaths() {
        return List.of(CORRECTED_IMAGING, DISPLACEMENTS);
    }

    @Override
    public String markerPath() {
        return CORRECTED_IMAGING;
    }

    @Override
    public String markerAttribute() {
        return PROCESSING_TIME;
    }

    @Override
    public MotionEstimate compute(CanonicalStore store, Path scratchDir) throws IOException {
        NdArray raw = store.read(RAW_IMAGING);
        log.debug("Estimating motion of {} with {} ({}), bounds {}", raw, config.strategy(),
                config.strategy().algorithm(), config.maxDisplacement());

        MotionEstimate estimate = estimator.correct(List.of(raw), config.strategy(), config.maxDisplacement(), scratchDir);
        if (estimate == null || estimate.correctedFrames() == null || estimate.displacements() == null) {
            throw new MotionEstimateMismatchException("estimator returned no result");
        }
        return new MotionEstimate(quantize(estimate.correctedFrames(), raw), flattenDisplacements(estimate.displacements(), raw.frameCount()));
    }

    @Override
    public void writeOutputs(ContainerBatch batch, MotionEstimate result) {
        batch.create(CORRECTED_IMAGING, result.correctedFrames(), Chunking.perFrame(), compression);
        batch.create(DISPLACEMENTS, result.displacements(), Chunking.contiguous(), compression);
    }

    @Override
    public Map<String, Object> completionAttributes(MotionEstimate result, Duration elapsed) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(STRATEGY, config.strategy().name());
        attributes.put(MAX_DISPLACEMENT, config.maxDisplacement().toList());
        attributes.put(PROCESSING_TIME, ElapsedTime.format(elapsed));
        return attributes;
    }

    /** Squeezes the estimator's extra axes away and converts back to the raw sample type. */
    static NdArray quantize(NdArray corrected, NdArray raw) {
        int frames = raw.frameCount();
        if (corrected.size() != raw.size() || leadingFrames(corrected, frames) != frames) {
            throw new MotionEstimateMismatchException("corrected frames " + Arrays.toString(corrected.shape())
                    + " do not match raw imaging " + Arrays.toString(raw.shape()));
        }
        return corrected.reshape(raw.shape()).convertTo(raw.type());
    }

    static NdArray flattenDisplacements(NdArray displacements, int frames) {
        if (displacements.size() != frames * 2 || leadingFrames(displacements, frames) != frames) {
            throw new MotionEstimateMismatchException("displacements " + Arrays.toString(displacements.shape())
                    + " are not one (dy, dx) pair per frame for " + frames + " frames");
        }
        return displacements.reshape(frames, 2);
    }

    private static int leadingFrames(NdArray array, int expected) {
        if (expected == 1) return 1;
        if (array.rank() > 0 && array.dim(0) == expected) return expected;
        NdArray squeezed = array.squeeze();
        if (squeezed.rank() == 0) return 1;
        return squeezed.dim(0);
    }
}
