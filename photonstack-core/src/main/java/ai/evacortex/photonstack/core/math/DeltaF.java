/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.math;

import ai.evacortex.photonstack.core.NdArray;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.ArrayDimensionNotSupportedException;

import java.util.Arrays;

/**
 * ΔF/F0 normalisation: {@code (F - F0) / F0}, element-wise.
 */
public final class DeltaF {

    private DeltaF() {}

    /**
     * @param signals rank-2 signals, time x channel
     * @param f0      baseline, either time x channel (rolling) or channel (global, broadcast over time)
     */
    public static NdArray compute(NdArray signals, NdArray f0) {
        if (signals.rank() != 2) throw new ArrayDimensionNotSupportedException(signals.rank());
        int length = signals.dim(0);
        int channels = signals.dim(1);
        boolean global = f0.rank() == 1;
        if (global ? f0.dim(0) != channels : !Arrays.equals(f0.shape(), signals.shape())) {
            throw new IllegalArgumentException("Baseline shape " + Arrays.toString(f0.shape())
                    + " does not fit signals of shape " + Arrays.toString(signals.shape()));
        }

        NdArray out = NdArray.allocate(SampleType.FLOAT64, length, channels);
        for (int t = 0; t < length; t++) {
            for (int c = 0; c < channels; c++) {
                double baseline = global ? f0.get(c) : f0.get(t, c);
                out.set((signals.get(t, c) - baseline) / baseline, t, c);
            }
        }
        return out;
    }
}
