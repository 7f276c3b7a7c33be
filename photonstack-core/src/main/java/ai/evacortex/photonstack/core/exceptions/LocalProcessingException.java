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
 * Base type for failures that abort the current recording or stage but not the batch.
 * Batch drivers catch this type, log the cause and continue with the next recording.
 */
public abstract class LocalProcessingException extends RuntimeException {

    protected LocalProcessingException(String message) {
        super(message);
    }

    protected LocalProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
