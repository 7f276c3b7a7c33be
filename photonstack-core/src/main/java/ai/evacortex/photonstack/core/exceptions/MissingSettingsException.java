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
 * Raised when a stage is invoked without its required settings. Aborts the invocation.
 */
public class MissingSettingsException extends RuntimeException {
    public MissingSettingsException(String message) {
        super(message);
    }
}
