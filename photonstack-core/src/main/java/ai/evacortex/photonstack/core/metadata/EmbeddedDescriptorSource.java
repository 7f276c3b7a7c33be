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
 * Reads the OME-XML document stored as a string value in the INI metadata.
 */
public final class EmbeddedDescriptorSource implements DescriptorSource {

    private final String key;

    public EmbeddedDescriptorSource() {
        this(MetadataResolver.EMBEDDED_DESCRIPTOR_KEY);
    }

    public EmbeddedDescriptorSource(String key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "embedded '" + key + "'";
    }

    @Override
    public DescriptorLookup lookup(Path recording, IniMetadata metadata) {
        Object value = metadata.get(key);
        if (value == null) return DescriptorLookup.failed(name(), "key not present");
        if (!(value instanceof String text) || text.isBlank()) {
            return DescriptorLookup.failed(name(), "value is not a document string");
        }
        return DescriptorLookup.found(name(), text);
    }
}
