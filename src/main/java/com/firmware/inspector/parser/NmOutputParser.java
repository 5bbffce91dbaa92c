package com.firmware.inspector.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.model.SourceLocation;

/**
 * Parser for the output of {@code nm --print-size [--demangle] [--line-numbers]}.
 *
 * Format of a symbol row:
 * <pre>
 *   00001234 00000010 T Foo&lt;int&gt;::bar()	src/foo.cpp:42
 * </pre>
 * - Undefined symbols (type U) are dropped
 * - Archive headers and .debug rows are skipped
 * - A location may trail the name, or sit alone on the following line
 * - Anything else is ignored
 */
public class NmOutputParser {
    private static final Logger log = LoggerFactory.getLogger(NmOutputParser.class);

    private static final Pattern ROW_PATTERN = Pattern.compile(
            "^([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)\\s+(\\S)\\s+(.+)$");

    private static final Pattern LOCATION_PATTERN = Pattern.compile(
            "^(.*?):(\\d+)(?::\\d+)?(?:\\s+\\(.*\\))?$");

    private static final Pattern UNKNOWN_LOCATION_PATTERN = Pattern.compile("^\\?\\?:(\\d+|\\?)$");

    public List<NmSymbol> parse(Path nmOutputFile) throws IOException {
        return parse(Files.readAllLines(nmOutputFile));
    }

    public List<NmSymbol> parse(String nmOutput) {
        return parse(nmOutput.lines().toList());
    }

    public List<NmSymbol> parse(List<String> lines) {
        List<NmSymbol> symbols = new ArrayList<>();
        boolean lastRowLacksLocation = false;
        int skipped = 0;

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("Archive ") || trimmed.contains(" .debug")) {
                continue;
            }

            Matcher row = ROW_PATTERN.matcher(trimmed);
            if (!row.matches()) {
                SourceLocation location = lastRowLacksLocation ? parseLocation(trimmed) : null;
                if (location != null) {
                    int last = symbols.size() - 1;
                    symbols.set(last, symbols.get(last).toBuilder().source(location).build());
                    lastRowLacksLocation = false;
                } else {
                    skipped++;
                    log.debug("Skipping unrecognized nm line: {}", trimmed);
                }
                continue;
            }

            char typeCode = row.group(3).charAt(0);
            if (Character.toUpperCase(typeCode) == 'U') {
                lastRowLacksLocation = false;
                continue;
            }

            NmSymbol symbol = toSymbol(row, typeCode);
            symbols.add(symbol);
            lastRowLacksLocation = symbol.getSource() == null;
        }

        log.debug("Parsed {} nm symbols ({} lines skipped)", symbols.size(), skipped);
        return symbols;
    }

    private NmSymbol toSymbol(Matcher row, char typeCode) {
        String nameAndLocation = row.group(4).stripTrailing();
        String name = nameAndLocation;
        SourceLocation source = null;

        int boundary = locationBoundary(nameAndLocation);
        if (boundary > 0) {
            String suffix = nameAndLocation.substring(boundary).trim();
            String prefix = nameAndLocation.substring(0, boundary).stripTrailing();
            if (UNKNOWN_LOCATION_PATTERN.matcher(suffix).matches()) {
                name = prefix;
            } else {
                source = parseLocation(suffix);
                if (source != null) {
                    name = prefix;
                }
            }
        }

        return NmSymbol.builder()
                .address(Long.parseUnsignedLong(row.group(1), 16))
                .size(Long.parseUnsignedLong(row.group(2), 16))
                .typeCode(typeCode)
                .name(name)
                .rawName(name)
                .source(source)
                .build();
    }

    /**
     * nm separates the location with a tab; fall back to the last run of whitespace.
     */
    private static int locationBoundary(String text) {
        int tab = text.lastIndexOf('\t');
        if (tab > 0) {
            return tab;
        }
        for (int i = text.length() - 1; i > 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    static SourceLocation parseLocation(String text) {
        Matcher matcher = LOCATION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }

        String file = matcher.group(1).trim();
        int line;
        try {
            line = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }

        if (file.isEmpty() || (file.equals("??") && line == 0)) {
            return null;
        }

        return SourceLocation.builder()
                .file(Path.of(file).normalize().toString())
                .line(line)
                .build();
    }
}
