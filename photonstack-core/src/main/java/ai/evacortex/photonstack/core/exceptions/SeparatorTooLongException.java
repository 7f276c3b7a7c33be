/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

/**
 * Raised when a list separator is configured with more than one character.
 * This is a configuration error and aborts the whole invocation.
 */
public class SeparatorTooLongException extends RuntimeException {
    public SeparatorTooLongException(String separator) {
        super("Separator should be a single character. Found: " + separator + ".");
    }
}
