/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.exceptions;

import java.nio.file.Path;

public class MissingMetadataFileException extends LocalProcessingException {
    public MissingMetadataFileException(Path recording, Path expected, String kind) {
        super("Failed to retrieve " + kind + " for '" + recording + "': '" + expected + "' does not exist.");
    }
}
