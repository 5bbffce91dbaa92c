package com.firmware.inspector.grouping;

import java.util.Optional;

/**
 * Detects C++ template instantiations in demangled symbol names.
 *
 * This is a single-pass heuristic, not a demangler:
 * <ul>
 *   <li>the text before the first {@code '<'} is the template family;</li>
 *   <li>the family must end in an identifier character or one of {@code > ] )},
 *       otherwise the {@code '<'} is assumed to be an operator or similar token;</li>
 *   <li>the specialization is the text between the first {@code '<'} and its matching
 *       {@code '>'}, honouring nesting.</li>
 * </ul>
 * Malformed or ambiguous names yield {@link Optional#empty()}; the parser never throws.
 */
public class SignatureParser {

    public Optional<TemplateSignature> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }

        int open = name.indexOf('<');
        if (open < 0) {
            return Optional.empty();
        }

        String groupName = name.substring(0, open).trim();
        if (groupName.isEmpty()) {
            return Optional.empty();
        }

        if (!isTemplateNameTerminator(groupName.charAt(groupName.length() - 1))) {
            return Optional.empty();
        }

        int depth = 0;
        for (int i = open; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    String specialization = name.substring(open + 1, i).trim();
                    return Optional.of(new TemplateSignature(
                            groupName, specialization.isEmpty() ? null : specialization));
                }
            }
        }

        // unbalanced
        return Optional.empty();
    }

    private static boolean isTemplateNameTerminator(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '_'
                || c == '>'
                || c == ']'
                || c == ')';
    }
}
