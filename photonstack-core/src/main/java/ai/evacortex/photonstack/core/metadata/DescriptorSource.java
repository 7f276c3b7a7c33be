/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import java.nio.file.Path;

/**
 * One place the shape/type descriptor of a recording may come from.
 * Sources are tried in a fixed order by {@link MetadataResolver}.
 */
public interface DescriptorSource {

    String name();

    DescriptorLookup lookup(Path recording, IniMetadata metadata);
}
