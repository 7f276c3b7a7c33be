/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import ai.evacortex.photonstack.core.exceptions.InvalidSettingsException;
import ai.evacortex.photonstack.core.exceptions.MissingSettingsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Motion-correction settings, read from the {@code [motion-correction]} table of a TOML file:
 *
 * <pre>
 * [motion-correction]
 * strategy = "markov"
 * displacement = [50, 50]
 * </pre>
 */
public record MotionConfig(Strategy strategy, MaxDisplacement maxDisplacement) {

    public static final String SECTION = "motion-correction";

    private static final TomlMapper TOML = new TomlMapper();

    /**
     * @throws MissingSettingsException if {@code settings} is null or does not exist
     * @throws InvalidSettingsException if the table, the strategy or the displacement is missing or malformed
     */
    public static MotionConfig fromFile(Path settings) {
        if (settings == null) throw new MissingSettingsException("No settings file was provided for motion correction.");
        if (!Files.isRegularFile(settings)) {
            throw new MissingSettingsException("Settings file '" + settings + "' does not exist.");
        }
        JsonNode root;
        try {
            root = TOML.readTree(settings.toFile());
        } catch (IOException e) {
            throw new InvalidSettingsException("Settings file '" + settings + "' is not valid TOML: " + e.getMessage(), e);
        }
        return fromTree(root, settings);
    }

    static MotionConfig fromTree(JsonNode root, Path origin) {
        JsonNode section = root.get(SECTION);
        if (section == null || !section.isObject()) {
            throw new InvalidSettingsException("Settings '" + origin + "' have no [" + SECTION + "] table.");
        }
        JsonNode strategy = section.get("strategy");
        if (strategy == null || !strategy.isTextual()) {
            throw new InvalidSettingsException("[" + SECTION + "] needs a 'strategy' string.");
        }

        MaxDisplacement displacement = MaxDisplacement.DEFAULT;
        JsonNode bounds = section.get("displacement");
        if (bounds != null) {
            if (!bounds.isArray() || bounds.size() != 2 || !bounds.get(0).canConvertToInt()
                    || !bounds.get(1).canConvertToInt() || !bounds.get(0).isIntegralNumber()
                    || !bounds.get(1).isIntegralNumber()) {
                throw new InvalidSettingsException("[" + SECTION + "] 'displacement' must be two integers, was " + bounds);
            }
            try {
                displacement = new MaxDisplacement(bounds.get(0).intValue(), bounds.get(1).intValue());
            } catch (IllegalArgumentException e) {
                throw new InvalidSettingsException(e.getMessage(), e);
            }
        }
        return new MotionConfig(Strategy.parse(strategy.asText()), displacement);
    }
}
