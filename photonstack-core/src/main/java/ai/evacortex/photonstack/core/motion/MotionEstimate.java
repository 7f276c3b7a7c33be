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

/**
 * Output of a {@link MotionEstimator}.
 *
 * @param correctedFrames one corrected frame per input frame, possibly with extra singleton axes
 * @param displacements   {@code (dy, dx)} per frame, possibly with singleton batch axes
 */
public record MotionEstimate(NdArray correctedFrames, NdArray displacements) {}
