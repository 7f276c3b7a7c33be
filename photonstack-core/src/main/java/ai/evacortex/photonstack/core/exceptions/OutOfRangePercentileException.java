/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

public class OutOfRangePercentileException extends LocalProcessingException {

    private final double percentile;

    public OutOfRangePercentileException(double percentile) {
        super("Percentile should be between 0 and 100. Found: " + percentile + ".");
        this.percentile = percentile;
    }

    public double percentile() {
        return percentile;
    }
}
