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

public class NoSectionsFoundException extends LocalProcessingException {
    public NoSectionsFoundException(Path path) {
        super("Failed to parse INI metadata: no sections found. (" + path + ")");
    }
}
