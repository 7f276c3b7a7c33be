/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.exceptions.InvalidDescriptorException;
import ai.evacortex.photonstack.core.exceptions.MissingDescriptorException;
import ai.evacortex.photonstack.core.exceptions.MissingMetadataFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link MetadataBundle} of a recording from its INI sidecar and descriptor, and
 * derives per-frame timestamps from the session notes.
 */
public final class MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(MetadataResolver.class);

    public static final String EMBEDDED_DESCRIPTOR_KEY = "ome.xml.string";
    public static final String FRAME_COUNT_KEY = "frame.count";

    private final TypedIniParser iniParser;

    public MetadataResolver() {
        this(new TypedIniParser());
    }

    public MetadataResolver(TypedIniParser iniParser) {
        this.iniParser = iniParser;
    }

    public MetadataBundle resolve(Path recording) {
        return resolve(recording, null, null);
    }

    /**
     * @param iniOverride        INI file to use instead of {@code <stem>.ini}, may be {@code null}
     * @param descriptorOverride descriptor file to use instead of the sibling OME-XML, may be {@code null}
     * @throws MissingMetadataFileException if the INI file does not exist
     * @throws MissingDescriptorException   if no descriptor source yields a usable document
     */
    public MetadataBundle resolve(Path recording, Path iniOverride, Path descriptorOverride) {
        Path iniPath = iniOverride != null ? iniOverride : iniPathFor(recording);
        if (!Files.isRegularFile(iniPath)) {
            throw new MissingMetadataFileException(recording, iniPath, "INI metadata");
        }
        IniMetadata ini = iniParser.parse(iniPath);
        log.debug("Parsed {} keys from [{}] of {}", ini.values().size(), ini.section(), iniPath);

        List<String> failures = new ArrayList<>();
        for (DescriptorSource source : descriptorSources(descriptorOverride)) {
            DescriptorLookup lookup = source.lookup(recording, ini);
            if (!lookup.isFound()) {
                failures.add(lookup.source() + ": " + lookup.failure());
                continue;
            }
            try {
                PixelsDescriptor pixels = OmeXmlParser.parse(lookup.document());
                log.debug("Descriptor for {} taken from {}", recording.getFileName(), lookup.source());
                return new MetadataBundle(pixels.shape(), pixels.sampleType(), pixels.byteOrder(),
                        ini.values(), lookup.document(), lookup.source());
            } catch (InvalidDescriptorException e) {
                log.debug("Descriptor from {} rejected: {}", lookup.source(), e.getMessage());
                failures.add(lookup.source() + ": " + e.getMessage());
            }
        }
        throw new MissingDescriptorException(recording, failures);
    }

    /** Embedded string first, then the sibling (or overriding) file. */
    public List<DescriptorSource> descriptorSources(Path descriptorOverride) {
        return List.of(new EmbeddedDescriptorSource(), new SiblingDescriptorSource(descriptorOverride));
    }

    /**
     * Timestamps for {@code frameCount} frames of {@code recording} from {@code <stem>.notes.txt}.
     */
    public double[] timestamps(Path recording, int frameCount) {
        return timestamps(recording, notesPathFor(recording), frameCount);
    }

    public double[] timestamps(Path recording, Path notesFile, int frameCount) {
        return TimestampGenerator.generate(notesEntry(recording, notesFile), frameCount);
    }

    /**
     * The single entry of {@code notesFile} describing {@code recording}.
     *
     * @throws MissingMetadataFileException if the notes file does not exist
     */
    public NotesEntry notesEntry(Path recording, Path notesFile) {
        if (!Files.isRegularFile(notesFile)) {
            throw new MissingMetadataFileException(recording, notesFile, "notes");
        }
        NotesEntry entry = TimestampGenerator.findEntry(NotesParser.parse(notesFile), recording);
        log.debug("Notes entry for {}: {} ms", recording.getFileName(), entry.durationMs());
        return entry;
    }

    public static Path iniPathFor(Path recording) {
        return recording.resolveSibling(stem(recording) + ".ini");
    }

    public static Path notesPathFor(Path recording) {
        return recording.resolveSibling(stem(recording) + ".notes.txt");
    }

    static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
