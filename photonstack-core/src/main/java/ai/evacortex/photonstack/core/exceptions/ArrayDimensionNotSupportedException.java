/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

public class ArrayDimensionNotSupportedException extends LocalProcessingException {

    private final int dimension;

    public ArrayDimensionNotSupportedException(int dimension) {
        super("Only 2D arrays are supported. Found: " + dimension + "D.");
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }
}
