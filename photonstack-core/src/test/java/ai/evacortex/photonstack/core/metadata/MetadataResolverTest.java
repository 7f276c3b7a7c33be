/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.RecordingFixtures;
import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.MissingDescriptorException;
import ai.evacortex.photonstack.core.exceptions.MissingMetadataFileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MetadataResolverTest {

    @TempDir
    Path tempDir;

    private final MetadataResolver resolver = new MetadataResolver();

    @Test
    void testEmbeddedDescriptorWins() throws Exception {
        Path raw = RecordingFixtures.writeRecording(tempDir, "mouse1_XYT", 5, 3, 4);
        Files.writeString(tempDir.resolve("mouse1_OME.xml"), RecordingFixtures.omeXml(9, 9, 9, "uint8", false));

        MetadataBundle bundle = resolver.resolve(raw);

        assertArrayEquals(new int[]{5, 3, 4}, bundle.shape());
        assertEquals(SampleType.UINT16, bundle.sampleType());
        assertEquals(ByteOrder.LITTLE_ENDIAN, bundle.byteOrder());
        assertEquals(5L, bundle.metadata().get("frame.count"));
        assertEquals("embedded 'ome.xml.string'", bundle.descriptorSource());
        assertEquals(120L, bundle.expectedByteCount());
    }

    @Test
    void testSiblingDescriptorUsedWhenNothingEmbedded() throws Exception {
        Path raw = tempDir.resolve("mouse1_XYT.raw");
        Files.write(raw, new byte[0]);
        RecordingFixtures.writeIni(tempDir.resolve("mouse1_XYT.ini"), "[Acquisition]\nframe.count = 7\n");
        Files.writeString(tempDir.resolve("mouse1_OME.xml"), RecordingFixtures.omeXml(7, 2, 2, "float", true));

        MetadataBundle bundle = resolver.resolve(raw);

        assertArrayEquals(new int[]{7, 2, 2}, bundle.shape());
        assertEquals(SampleType.FLOAT32, bundle.sampleType());
        assertEquals(ByteOrder.BIG_ENDIAN, bundle.byteOrder());
        assertEquals("sibling OME-XML file", bundle.descriptorSource());
    }

    @Test
    void testUnparseableEmbeddedDescriptorFallsThrough() throws Exception {
        Path raw = tempDir.resolve("rec_XYT.raw");
        Files.write(raw, new byte[0]);
        RecordingFixtures.writeIni(tempDir.resolve("rec_XYT.ini"), "[A]\nome.xml.string = <OME><broken\n");
        Files.writeString(tempDir.resolve("rec_OME.xml"), RecordingFixtures.omeXml(2, 2, 2, "uint16", false));

        MetadataBundle bundle = resolver.resolve(raw);
        assertEquals("sibling OME-XML file", bundle.descriptorSource());
    }

    @Test
    void testOverridesReplaceDerivedPaths() throws Exception {
        Path raw = tempDir.resolve("rec.raw");
        Files.write(raw, new byte[0]);
        Path ini = tempDir.resolve("elsewhere.ini");
        RecordingFixtures.writeIni(ini, "[A]\nx = 1\n");
        Path descriptor = tempDir.resolve("custom.xml");
        Files.writeString(descriptor, RecordingFixtures.omeXml(3, 1, 1, "uint8", false));

        MetadataBundle bundle = resolver.resolve(raw, ini, descriptor);
        assertArrayEquals(new int[]{3, 1, 1}, bundle.shape());
        assertEquals("OME-XML file " + descriptor, bundle.descriptorSource());
    }

    @Test
    void testMissingDescriptorNamesEverySource() throws Exception {
        Path raw = tempDir.resolve("rec_XYT.raw");
        Files.write(raw, new byte[0]);
        RecordingFixtures.writeIni(tempDir.resolve("rec_XYT.ini"), "[A]\nx = 1\n");

        MissingDescriptorException e = assertThrows(MissingDescriptorException.class, () -> resolver.resolve(raw));
        assertEquals(2, e.failures().size());
        assertTrue(e.failures().get(0).startsWith("embedded"), e.failures().get(0));
        assertTrue(e.failures().get(1).contains("rec_OME.xml"), e.failures().get(1));
    }

    @Test
    void testMissingIniFile() throws Exception {
        Path raw = tempDir.resolve("lonely.raw");
        Files.write(raw, new byte[0]);

        MissingMetadataFileException e = assertThrows(MissingMetadataFileException.class, () -> resolver.resolve(raw));
        assertTrue(e.getMessage().contains("lonely.ini"), e.getMessage());
    }

    @Test
    void testMultichannelShape() {
        String xml = "<OME><Image><Pixels Type=\"uint16\" SizeX=\"4\" SizeY=\"3\" SizeC=\"2\" SizeT=\"5\"/></Image></OME>";
        assertArrayEquals(new int[]{5, 3, 4, 2}, OmeXmlParser.parse(xml).shape());
    }

    @Test
    void testSiblingPathReplacesAcquisitionToken() {
        assertEquals(Path.of("/data/m1_OME.xml"), SiblingDescriptorSource.siblingPath(Path.of("/data/m1_XYT.raw")));
    }
}
