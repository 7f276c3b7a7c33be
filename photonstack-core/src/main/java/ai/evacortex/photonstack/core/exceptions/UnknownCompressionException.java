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

public class UnknownCompressionException extends LocalProcessingException {
    public UnknownCompressionException(String compression, List<String> known) {
        super("Unknown compression: '" + compression + "'. Valid compression algorithms are: "
                + String.join(", ", known));
    }
}
