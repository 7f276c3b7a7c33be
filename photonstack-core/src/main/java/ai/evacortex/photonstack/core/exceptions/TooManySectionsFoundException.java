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
import java.util.List;

public class TooManySectionsFoundException extends LocalProcessingException {
    public TooManySectionsFoundException(Path path, List<String> sections) {
        super("Failed to parse INI metadata: too many sections found. Only a single section "
                + "(other than [DEFAULT]) is supported. Found: " + String.join(" ", sections) + ". (" + path + ")");
    }
}
