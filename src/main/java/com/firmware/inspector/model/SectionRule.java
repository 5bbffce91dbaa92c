package com.firmware.inspector.model;

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Maps section names to a section category.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SectionRule {

    public enum MatchKind {
        EQUALS, PREFIX, SUFFIX, REGEX
    }

    MatchKind kind;
    String pattern;
    String categoryId;

    // only set for REGEX rules
    Pattern regex;

    /**
     * @throws java.util.regex.PatternSyntaxException for an invalid REGEX pattern
     */
    public static SectionRule of(MatchKind kind, String pattern, String categoryId) {
        Pattern regex = kind == MatchKind.REGEX ? Pattern.compile(pattern) : null;
        return new SectionRule(kind, pattern, categoryId, regex);
    }

    public boolean matches(String sectionName) {
        return switch (kind) {
            case EQUALS -> sectionName.equals(pattern);
            case PREFIX -> sectionName.startsWith(pattern);
            case SUFFIX -> sectionName.endsWith(pattern);
            case REGEX -> regex.matcher(sectionName).find();
        };
    }
}
