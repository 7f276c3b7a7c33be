/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

public class RollingWindowTooLargeException extends LocalProcessingException {

    private final int windowWidth;
    private final int maximum;

    public RollingWindowTooLargeException(int windowWidth, int arrayLength) {
        super("Rolling window width should be at most twice the length of the first dimension of the "
                + "input minus 1. Got '" + windowWidth + "' which is larger than " + (2 * arrayLength - 1) + ".");
        this.windowWidth = windowWidth;
        this.maximum = 2 * arrayLength - 1;
    }

    public int windowWidth() { return windowWidth; }
    public int maximum()     { return maximum; }
}
