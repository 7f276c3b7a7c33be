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

public class NotesEntryMatchException extends LocalProcessingException {

    private final int matchCount;

    public NotesEntryMatchException(Path recording, int matchCount) {
        super(matchCount == 0
                ? "Could not find a notes entry matching '" + recording.getFileName() + "'."
                : "Found " + matchCount + " notes entries matching '" + recording.getFileName()
                        + "', expected exactly one.");
        this.matchCount = matchCount;
    }

    public int matchCount() {
        return matchCount;
    }
}
