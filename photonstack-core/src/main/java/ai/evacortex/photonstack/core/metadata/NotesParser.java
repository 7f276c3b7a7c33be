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
import ai.evacortex.photonstack.core.exceptions.InvalidNotesException;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a session notes file into {@link NotesEntry} blocks.
 *
 * <p>Blocks are separated by blank lines. A block holds {@code Start time:}, {@code End time:}
 * and {@code File path:} lines in any order. Blocks carrying none of these keys are free text
 * and ignored; blocks carrying only some of them are rejected.</p>
 */
public final class NotesParser {

    private static final String START = "starttime";
    private static final String END = "endtime";
    private static final String FILE = "filepath";

    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter(Locale.ROOT);

    private NotesParser() {}

    public static List<NotesEntry> parse(Path notesFile) {
        try {
            return parse(TypedIniParser.readText(notesFile));
        } catch (ContainerIOException e) {
            throw new InvalidNotesException("cannot read " + notesFile, e);
        }
    }

    public static List<NotesEntry> parse(String content) {
        List<NotesEntry> entries = new ArrayList<>();
        Map<String, String> block = new LinkedHashMap<>();
        for (String line : content.split("\\R", -1)) {
            if (line.isBlank()) {
                flush(block, entries);
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String key = line.substring(0, colon).replaceAll("[\\s_]", "").toLowerCase(Locale.ROOT);
            if (!key.equals(START) && !key.equals(END) && !key.equals(FILE)) continue;
            if (block.containsKey(key)) {
                // a repeated key starts the next entry even without a blank line
                flush(block, entries);
            }
            block.put(key, line.substring(colon + 1).strip());
        }
        flush(block, entries);
        return entries;
    }

    private static void flush(Map<String, String> block, List<NotesEntry> entries) {
        if (block.isEmpty()) return;
        if (!block.containsKey(START) || !block.containsKey(END) || !block.containsKey(FILE)) {
            throw new InvalidNotesException("incomplete entry " + block);
        }
        LocalDateTime start = parseTime(block.get(START));
        LocalDateTime end = parseTime(block.get(END));
        if (end.isBefore(start)) {
            throw new InvalidNotesException("end time " + end + " precedes start time " + start);
        }
        entries.add(new NotesEntry(start, end, block.get(FILE)));
        block.clear();
    }

    static LocalDateTime parseTime(String text) {
        try {
            return LocalDateTime.parse(text.strip(), TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new InvalidNotesException("unparseable time '" + text + "'", e);
        }
    }
}
