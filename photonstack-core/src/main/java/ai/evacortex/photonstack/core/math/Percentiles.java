/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.math;

import java.util.Arrays;

final class Percentiles {

    private Percentiles() {}

    /**
     * Percentile of {@code values[from, to)} with linear interpolation between the two
     * closest ranks. NaN samples propagate.
     */
    static double percentile(double[] values, int from, int to, double percentile) {
        int n = to - from;
        if (n <= 0) return Double.NaN;
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        if (Double.isNaN(sorted[n - 1])) return Double.NaN;

        double rank = percentile / 100.0 * (n - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, n - 1);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
