/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import ai.evacortex.photonstack.core.NdArray;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * External motion-estimation capability. Implementations may run for hours and may use
 * {@code scratchDir}, which they must create themselves.
 */
@FunctionalInterface
public interface MotionEstimator {

    MotionEstimate correct(List<NdArray> sequences, Strategy strategy, MaxDisplacement maxDisplacement,
                           Path scratchDir) throws IOException;
}
