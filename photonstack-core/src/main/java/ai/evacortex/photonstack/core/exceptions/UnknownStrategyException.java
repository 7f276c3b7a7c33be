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

public class UnknownStrategyException extends InvalidSettingsException {
    public UnknownStrategyException(String strategy, List<String> known) {
        super("Could not parse '" + strategy + "' as a valid strategy. Valid options: "
                + String.join(", ", known) + ".");
    }
}
