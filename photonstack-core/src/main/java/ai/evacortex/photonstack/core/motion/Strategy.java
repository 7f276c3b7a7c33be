/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.motion;

import ai.evacortex.photonstack.core.exceptions.UnknownStrategyException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Motion-estimation strategies an estimator may implement.
 */
public enum Strategy {

    MARKOV("HiddenMarkov2D"),
    PLANE("PlaneTranslation2D"),
    FOURIER("DiscreteFourier2D");

    private static final Map<String, Strategy> ALIASES = Map.of(
            "hiddenmarkov2d", MARKOV,
            "hmm", MARKOV,
            "planetranslation2d", PLANE,
            "translation", PLANE,
            "discretefourier2d", FOURIER,
            "dft", FOURIER);

    private final String algorithm;

    Strategy(String algorithm) {
        this.algorithm = algorithm;
    }

    /** Name of the estimation algorithm the strategy selects. */
    public String algorithm() {
        return algorithm;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }

    /**
     * Case-folds {@code name}, drops separators and maps aliases onto enum names.
     */
    public static String normalize(String name) {
        String folded = name.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]", "");
        Strategy alias = ALIASES.get(folded);
        return alias != null ? alias.name() : folded.toUpperCase(Locale.ROOT);
    }

    /**
     * @throws UnknownStrategyException if the normalised name matches no strategy
     */
    public static Strategy parse(String name) {
        if (name != null) {
            String normalized = normalize(name);
            for (Strategy s : values()) {
                if (s.name().equals(normalized)) return s;
            }
        }
        throw new UnknownStrategyException(name, names());
    }
}
