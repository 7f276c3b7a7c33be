/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

import java.util.List;

public class UnknownMethodException extends LocalProcessingException {
    public UnknownMethodException(String method, List<String> known) {
        super("Unknown method: '" + method + "'. Valid methods are: " + String.join(", ", known));
    }
}
