/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

public class MotionEstimateMismatchException extends LocalProcessingException {
    public MotionEstimateMismatchException(String message) {
        super("Motion estimate does not match the input: " + message);
    }
}
