/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import java.util.List;

/**
 * Largest shift, in pixels, the estimator may report along each axis.
 */
public record MaxDisplacement(int y, int x) {

    public static final MaxDisplacement DEFAULT = new MaxDisplacement(50, 50);

    public MaxDisplacement {
        if (y < 0 || x < 0) {
            throw new IllegalArgumentException("Displacement bounds must be non-negative, were (" + y + ", " + x + ")");
        }
    }

    public List<Integer> toList() {
        return List.of(y, x);
    }
}
