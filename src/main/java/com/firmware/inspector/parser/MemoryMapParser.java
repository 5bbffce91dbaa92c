package com.firmware.inspector.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.model.AddressType;
import com.firmware.inspector.model.LogicalBlock;
import com.firmware.inspector.model.MemoryMap;
import com.firmware.inspector.model.SectionRule;

/**
 * Parser for memory map files.
 *
 * Format:
 * - Block: block flash_code code flash exec   (id, category, window, optional role load|exec|runtime)
 * - Rule: rule prefix .text code             (equals|prefix|suffix|regex, pattern, category)
 * - Comments: # comment
 */
public class MemoryMapParser {
    private static final Logger log = LoggerFactory.getLogger(MemoryMapParser.class);

    private static final Pattern BLOCK_PATTERN = Pattern.compile(
            "^block\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)(?:\\s+(load|exec|runtime))?$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern RULE_PATTERN = Pattern.compile(
            "^rule\\s+(equals|prefix|suffix|regex)\\s+(\\S+)\\s+(\\S+)$",
            Pattern.CASE_INSENSITIVE
    );

    public MemoryMap parse(Path memoryMapFile) throws IOException {
        return parse(Files.readAllLines(memoryMapFile));
    }

    public MemoryMap parse(List<String> lines) {
        MemoryMap map = new MemoryMap();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                parseLine(trimmed, map);
            } catch (IllegalArgumentException e) {
                map.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse memory map line {}: {}", lineNum, e.getMessage());
            }
        }

        checkRuleCategories(map);
        log.debug("Parsed memory map: {} blocks, {} rules", map.getBlocks().size(), map.getRules().size());
        return map;
    }

    private void parseLine(String line, MemoryMap map) {
        Matcher block = BLOCK_PATTERN.matcher(line);
        if (block.matches()) {
            String id = block.group(1);
            if (map.hasBlock(id)) {
                throw new IllegalArgumentException("Duplicate block id: " + id);
            }
            map.addBlock(LogicalBlock.builder()
                    .id(id)
                    .categoryId(block.group(2))
                    .windowId(block.group(3))
                    .role(AddressType.fromRole(block.group(4)))
                    .build());
            return;
        }

        Matcher rule = RULE_PATTERN.matcher(line);
        if (rule.matches()) {
            SectionRule.MatchKind kind = SectionRule.MatchKind.valueOf(rule.group(1).toUpperCase(Locale.ROOT));
            try {
                map.addRule(SectionRule.of(kind, rule.group(2), rule.group(3)));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex '" + rule.group(2) + "': " + e.getDescription());
            }
            return;
        }

        throw new IllegalArgumentException("Invalid memory map entry: " + line);
    }

    // A rule without blocks only fails once a section actually hits it
    private void checkRuleCategories(MemoryMap map) {
        Set<String> categories = new LinkedHashSet<>();
        for (SectionRule rule : map.getRules()) {
            categories.add(rule.getCategoryId());
        }
        for (String category : categories) {
            if (map.blocksFor(category).isEmpty()) {
                map.addWarning("No logical blocks defined for category " + category + ".");
            }
        }
    }
}
