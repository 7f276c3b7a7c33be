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
import ai.evacortex.photonstack.core.exceptions.UnknownStrategyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MotionConfigTest {

    @TempDir
    Path tempDir;

    private Path settings(String toml) throws Exception {
        Path file = tempDir.resolve("settings.toml");
        Files.writeString(file, toml);
        return file;
    }

    @Test
    void testReadsStrategyAndDisplacement() throws Exception {
        MotionConfig config = MotionConfig.fromFile(settings(
                "[motion-correction]\nstrategy = \"Hidden_Markov-2D\"\ndisplacement = [20, 30]\n"));
        assertEquals(Strategy.MARKOV, config.strategy());
        assertEquals(new MaxDisplacement(20, 30), config.maxDisplacement());
        assertEquals(List.of(20, 30), config.maxDisplacement().toList());
    }

    @Test
    void testDisplacementDefaults() throws Exception {
        MotionConfig config = MotionConfig.fromFile(settings("[motion-correction]\nstrategy = \"plane\"\n"));
        assertEquals(Strategy.PLANE, config.strategy());
        assertEquals(MaxDisplacement.DEFAULT, config.maxDisplacement());
    }

    @Test
    void testMissingSettings() {
        assertThrows(MissingSettingsException.class, () -> MotionConfig.fromFile(null));
        assertThrows(MissingSettingsException.class, () -> MotionConfig.fromFile(tempDir.resolve("absent.toml")));
    }

    @Test
    void testInvalidSettings() throws Exception {
        assertThrows(InvalidSettingsException.class, () -> MotionConfig.fromFile(settings("strategy = = 1")));
        assertThrows(InvalidSettingsException.class, () -> MotionConfig.fromFile(settings("[other]\nstrategy = \"plane\"\n")));
        assertThrows(InvalidSettingsException.class, () -> MotionConfig.fromFile(settings("[motion-correction]\ndisplacement = [1, 2]\n")));
        assertThrows(InvalidSettingsException.class,
                () -> MotionConfig.fromFile(settings("[motion-correction]\nstrategy = \"plane\"\ndisplacement = [1, 2, 3]\n")));
        assertThrows(InvalidSettingsException.class,
                () -> MotionConfig.fromFile(settings("[motion-correction]\nstrategy = \"plane\"\ndisplacement = [1.5, 2]\n")));
        assertThrows(InvalidSettingsException.class,
                () -> MotionConfig.fromFile(settings("[motion-correction]\nstrategy = \"plane\"\ndisplacement = [-1, 2]\n")));
    }

    @Test
    void testUnknownStrategyListsChoices() throws Exception {
        Path file = settings("[motion-correction]\nstrategy = \"optical-flow\"\n");
        UnknownStrategyException e = assertThrows(UnknownStrategyException.class, () -> MotionConfig.fromFile(file));
        assertTrue(e.getMessage().contains("MARKOV"), e.getMessage());
    }

    @ParameterizedTest
    @CsvSource({
            "markov, MARKOV",
            "HMM, MARKOV",
            "Plane Translation 2D, PLANE",
            "translation, PLANE",
            "fourier, FOURIER",
            "DFT, FOURIER",
            "discrete_fourier_2d, FOURIER"
    })
    void testStrategyAliases(String name, Strategy expected) {
        assertEquals(expected, Strategy.parse(name));
    }
}
