/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.storage;

import ai.evacortex.photonstack.core.exceptions.UnknownCompressionException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Chunk compression algorithms understood by the container.
 */
public enum Compression {

    /** Stored as-is. */
    NONE("none"),
    /** Fast with a modest ratio; takes the place of the LZF filter used by earlier tools. */
    LZ4("lz4", "lzf", "fast"),
    /** Deflate, levels 0 to 9. */
    GZIP("gzip", "deflate");

    private final String canonicalName;
    private final List<String> aliases;

    Compression(String canonicalName, String... aliases) {
        this.canonicalName = canonicalName;
        this.aliases = List.of(aliases);
    }

    public String canonicalName() {
        return canonicalName;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Compression::canonicalName).toList();
    }

    /**
     * Case-insensitive lookup by canonical name or alias.
     *
     * @throws UnknownCompressionException listing the canonical names
     */
    public static Compression parse(String name) {
        if (name != null) {
            String key = name.strip().toLowerCase(Locale.ROOT);
            for (Compression c : values()) {
                if (c.canonicalName.equals(key) || c.aliases.contains(key)) return c;
            }
        }
        throw new UnknownCompressionException(name, names());
    }
}
