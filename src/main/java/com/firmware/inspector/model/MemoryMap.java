package com.firmware.inspector.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Data;

/**
 * Parsed memory map: logical blocks plus the rules that put sections into categories.
 * Rules are tried in file order; the first match wins.
 */
@Data
public class MemoryMap {
    private final List<LogicalBlock> blocks = new ArrayList<>();
    private final List<SectionRule> rules = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addBlock(LogicalBlock block) {
        blocks.add(block);
    }

    public void addRule(SectionRule rule) {
        rules.add(rule);
    }

    public boolean hasBlock(String blockId) {
        return blocks.stream().anyMatch(b -> b.getId().equals(blockId));
    }

    public List<LogicalBlock> blocksFor(String categoryId) {
        return blocks.stream()
                .filter(b -> b.getCategoryId().equals(categoryId))
                .toList();
    }

    public Optional<SectionRule> ruleFor(String sectionName) {
        return rules.stream()
                .filter(r -> r.matches(sectionName))
                .findFirst();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
