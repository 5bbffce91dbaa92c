package com.firmware.inspector.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts section load addresses (LMA) from {@code objdump -h} output.
 *
 * <pre>
 *   Idx Name          Size      VMA       LMA       File off  Algn
 *     2 .data         00000010  20000000  08000390  00020000  2**2
 * </pre>
 * Flag lines and headers are skipped. Returns LMA by section name.
 */
public class ObjdumpSectionParser {

    private static final Pattern SECTION_PATTERN = Pattern.compile(
            "^\\d+\\s+(\\S+)\\s+([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)\\s+(\\S+)$");

    public Map<String, Long> parse(Path objdumpOutputFile) throws IOException {
        return parse(Files.readAllLines(objdumpOutputFile));
    }

    public Map<String, Long> parse(String objdumpOutput) {
        return parse(objdumpOutput.lines().toList());
    }

    public Map<String, Long> parse(List<String> lines) {
        Map<String, Long> lmaByName = new LinkedHashMap<>();
        for (String line : lines) {
            Matcher matcher = SECTION_PATTERN.matcher(line.trim());
            if (matcher.matches()) {
                lmaByName.put(matcher.group(1), Long.parseUnsignedLong(matcher.group(4), 16));
            }
        }
        return lmaByName;
    }
}
