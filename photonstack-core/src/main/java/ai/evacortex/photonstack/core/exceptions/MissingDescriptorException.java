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

public class MissingDescriptorException extends LocalProcessingException {

    private final List<String> failures;

    public MissingDescriptorException(Path recording, List<String> failures) {
        super("Failed to resolve the shape/type descriptor for '" + recording + "'. Tried: "
                + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> failures() {
        return failures;
    }
}
