/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.report;

import ai.evacortex.photonstack.core.CanonicalStore;
import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.SampleType;

import java.util.Arrays;

/**
 * Per-pixel projections over the time axis, for report figures.
 */
public final class Projections {

    private Projections() {}

    /**
     * Mean over axis 0 of {@code frames}, as float64 of the frame shape.
     *
     * @throws IllegalArgumentException if {@code frames} has no frames
     */
    public static NdArray meanIntensity(NdArray frames) {
        if (frames.rank() < 2 || frames.dim(0) == 0) {
            throw new IllegalArgumentException("Need at least one frame for a projection, got shape "
                    + Arrays.toString(frames.shape()));
        }
        double[] sums = new double[NdArray.elementCount(frames.frameShape())];
        for (int t = 0; t < frames.dim(0); t++) accumulate(sums, frames.frame(t));
        return average(sums, frames.dim(0), frames.frameShape());
    }

    /** Same as {@link #meanIntensity(NdArray)}, reading {@code datasetPath} one frame at a time. */
    public static NdArray meanIntensity(CanonicalStore store, String datasetPath) {
        int[] shape = store.describe(datasetPath).shape();
        if (shape.length < 2 || shape[0] == 0) {
            throw new IllegalArgumentException("'" + datasetPath + "' has no frames to project");
        }
        int[] frameShape = Arrays.copyOfRange(shape, 1, shape.length);
        double[] sums = new double[NdArray.elementCount(frameShape)];
        for (int t = 0; t < shape[0]; t++) accumulate(sums, store.readFrame(datasetPath, t));
        return average(sums, shape[0], frameShape);
    }

    private static void accumulate(double[] sums, NdArray frame) {
        for (int i = 0; i < sums.length; i++) sums[i] += frame.getDouble(i);
    }

    private static NdArray average(double[] sums, int frames, int[] frameShape) {
        NdArray out = NdArray.allocate(SampleType.FLOAT64, frameShape);
        for (int i = 0; i < sums.length; i++) out.setDouble(i, sums[i] / frames);
        return out;
    }
}
