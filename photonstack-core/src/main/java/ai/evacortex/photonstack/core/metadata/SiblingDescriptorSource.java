/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.exceptions.ContainerIOException;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a standalone OME-XML file next to the recording, or an explicitly supplied one.
 * The derived name replaces the {@code XYT} token of the recording's stem with {@code OME}.
 */
public final class SiblingDescriptorSource implements DescriptorSource {

    private final Path override;

    public SiblingDescriptorSource() {
        this(null);
    }

    public SiblingDescriptorSource(Path override) {
        this.override = override;
    }

    @Override
    public String name() {
        return override == null ? "sibling OME-XML file" : "OME-XML file " + override;
    }

    @Override
    public DescriptorLookup lookup(Path recording, IniMetadata metadata) {
        Path path = override != null ? override : siblingPath(recording);
        if (!Files.isRegularFile(path)) {
            return DescriptorLookup.failed(name(), "'" + path + "' does not exist");
        }
        try {
            return DescriptorLookup.found(name(), TypedIniParser.readText(path));
        } catch (ContainerIOException e) {
            return DescriptorLookup.failed(name(), e.getMessage());
        }
    }

    public static Path siblingPath(Path recording) {
        String stem = MetadataResolver.stem(recording);
        return recording.resolveSibling(stem.replace("XYT", "OME") + ".xml");
    }
}
