/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

public class InvalidDescriptorException extends LocalProcessingException {
    public InvalidDescriptorException(String message) {
        super("Invalid descriptor: " + message);
    }

    public InvalidDescriptorException(String message, Throwable cause) {
        super("Invalid descriptor: " + message, cause);
    }
}
