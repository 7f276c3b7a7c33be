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

public class UnknownPaddingModeException extends LocalProcessingException {
    public UnknownPaddingModeException(String paddingMode, List<String> known) {
        super("Unknown padding mode '" + paddingMode + "'. Valid modes are: " + String.join(", ", known) + ".");
    }
}
