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
import ai.evacortex.photonstack.core.exceptions.NoSectionsFoundException;
import ai.evacortex.photonstack.core.exceptions.SeparatorTooLongException;
import ai.evacortex.photonstack.core.exceptions.TooManySectionsFoundException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parser for the acquisition tool's INI sidecar.
 *
 * <p>The file must hold exactly one named section; a {@code [DEFAULT]} section is merged into
 * it. Keys are case-folded. Values are coerced in order to {@link Long}, {@link Double},
 * {@link Boolean} and finally {@link String}. A value holding the list separator (not escaped
 * by a backslash) becomes a {@code List<Object>} of coerced elements. Markup values (starting
 * with {@code <}) are never split since entities such as {@code &amp;} contain {@code ;}.</p>
 *
 * <pre>
 * [DEFAULT]
 * frame.rate = 30.0
 *
 * [Acquisition]
 * frame.count = 1200
 * channels = green;red
 * </pre>
 */
public final class TypedIniParser {

    public static final String DEFAULT_SECTION = "DEFAULT";
    public static final String DEFAULT_LIST_SEPARATOR = ";";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?|nan|inf|infinity)",
            Pattern.CASE_INSENSITIVE);

    private final Character separator;

    public TypedIniParser() {
        this(DEFAULT_LIST_SEPARATOR);
    }

    /**
     * @param separator single-character list separator, or {@code null}/empty to disable list splitting
     * @throws SeparatorTooLongException if {@code separator} has more than one character
     */
    public TypedIniParser(String separator) {
        if (separator != null && separator.length() > 1) throw new SeparatorTooLongException(separator);
        this.separator = separator == null || separator.isEmpty() ? null : separator.charAt(0);
    }

    public IniMetadata parse(Path path) {
        return parse(readText(path), path);
    }

    public IniMetadata parse(String content, Path origin) {
        Map<String, String> defaults = new LinkedHashMap<>();
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> current = defaults;
        String lastKey = null;

        for (String line : content.split("\\R", -1)) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                lastKey = null;
                continue;
            }
            if (lastKey != null && Character.isWhitespace(line.charAt(0))) {
                current.merge(lastKey, "\n" + stripped, String::concat);
                continue;
            }
            if (stripped.startsWith("#") || stripped.startsWith(";")) continue;

            if (stripped.startsWith("[") && stripped.endsWith("]")) {
                String name = stripped.substring(1, stripped.length() - 1).strip();
                current = DEFAULT_SECTION.equals(name)
                        ? defaults
                        : sections.computeIfAbsent(name, k -> new LinkedHashMap<>());
                lastKey = null;
                continue;
            }

            int delimiter = firstDelimiter(stripped);
            String key = (delimiter < 0 ? stripped : stripped.substring(0, delimiter)).strip().toLowerCase(Locale.ROOT);
            String value = delimiter < 0 ? "" : stripped.substring(delimiter + 1).strip();
            current.put(key, value);
            lastKey = key;
        }

        if (sections.isEmpty()) throw new NoSectionsFoundException(origin);
        if (sections.size() > 1) throw new TooManySectionsFoundException(origin, new ArrayList<>(sections.keySet()));

        Map.Entry<String, Map<String, String>> section = sections.entrySet().iterator().next();
        Map<String, String> merged = new LinkedHashMap<>(defaults);
        merged.putAll(section.getValue());

        Map<String, Object> typed = new LinkedHashMap<>();
        merged.forEach((key, raw) -> typed.put(key, typedValue(raw)));
        return new IniMetadata(section.getKey(), typed);
    }

    private Object typedValue(String raw) {
        String value = unquote(raw);
        if (separator != null && !value.startsWith("<") && containsUnescaped(value, separator)) {
            List<Object> items = new ArrayList<>();
            for (String item : splitString(value, separator)) {
                items.add(coerce(unquote(item.strip())));
            }
            return items;
        }
        return coerce(value);
    }

    /**
     * Coerces a raw value to Long, then Double, then Boolean, falling back to the string itself.
     */
    public static Object coerce(String raw) {
        String value = raw.strip();
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException overflow) {
                // falls through to the floating-point attempt
            }
        }
        if (FLOAT.matcher(value).matches()) {
            String lower = value.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) return Double.NaN;
            if (lower.endsWith("inf") || lower.endsWith("infinity")) {
                return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            return Double.parseDouble(value);
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> { return Boolean.TRUE; }
            case "false", "no", "off" -> { return Boolean.FALSE; }
            default -> { return raw; }
        }
    }

    /**
     * Splits {@code value} on {@code separator}, leaving backslash-escaped separators in place
     * (the backslash is kept). Empty items are dropped.
     *
     * @throws SeparatorTooLongException if {@code separator} is longer than one character
     */
    public static List<String> splitString(String value, String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Separator must not be empty");
        }
        if (separator.length() > 1) throw new SeparatorTooLongException(separator);
        return splitString(value, separator.charAt(0));
    }

    static List<String> splitString(String value, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == separator && (i == 0 || value.charAt(i - 1) != '\\')) {
                if (token.length() > 0) parts.add(token.toString());
                token.setLength(0);
            } else {
                token.append(ch);
            }
        }
        if (token.length() > 0) parts.add(token.toString());
        return parts;
    }

    private static boolean containsUnescaped(String value, char separator) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == separator && (i == 0 || value.charAt(i - 1) != '\\')) return true;
        }
        return false;
    }

    private static int firstDelimiter(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) return colon;
        if (colon < 0) return eq;
        return Math.min(eq, colon);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    static String readText(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ContainerIOException("Failed to read metadata file " + path, e);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // vendor tools on Windows write Latin-1
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        return text.startsWith("﻿") ? text.substring(1) : text;
    }
}
