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

import com.firmware.inspector.model.Section;
import com.firmware.inspector.model.SectionFlags;

/**
 * Parser for the section header table printed by {@code readelf -S -W}.
 *
 * Only rows of the form
 * <pre>
 *   [ 1] .text  PROGBITS  00000000 001000 0001f4 00  AX  0   0  4
 * </pre>
 * are recognised; the NULL entry and legend lines are skipped.
 */
public class ReadelfSectionParser {
    private static final Logger log = LoggerFactory.getLogger(ReadelfSectionParser.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile(
            "^\\[\\s*(\\d+)]\\s+(\\S+)\\s+(\\S+)\\s+([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)\\s+([0-9a-fA-F]+)"
                    + "\\s+([0-9a-fA-F]+)\\s+([A-Za-z]*)\\s*(\\d+)\\s+(\\d+)\\s+(\\d+)$");

    public List<Section> parse(Path readelfOutputFile) throws IOException {
        return parse(Files.readAllLines(readelfOutputFile));
    }

    public List<Section> parse(String readelfOutput) {
        return parse(readelfOutput.lines().toList());
    }

    public List<Section> parse(List<String> lines) {
        List<Section> sections = new ArrayList<>();

        for (String line : lines) {
            Matcher matcher = SECTION_PATTERN.matcher(line.trim());
            if (!matcher.matches()) {
                continue;
            }

            Section section = Section.builder()
                    .id("sec_" + matcher.group(1))
                    .name(matcher.group(2))
                    .vmaStart(Long.parseUnsignedLong(matcher.group(4), 16))
                    .size(Long.parseUnsignedLong(matcher.group(6), 16))
                    .flags(SectionFlags.parse(matcher.group(8)))
                    .build();
            sections.add(section);
            log.debug("Parsed section {} ({}) at 0x{} size {}", section.getName(), section.getId(),
                    Long.toHexString(section.getVmaStart()), section.getSize());
        }

        return sections;
    }
}
