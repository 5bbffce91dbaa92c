package com.firmware.inspector.model;

/**
 * Coarse classification of a symbol derived from its nm type code.
 */
public enum SymbolKind {
    FUNCTION,
    OBJECT,
    SECTION,
    OTHER;

    /**
     * Maps an nm type code (case-insensitive) to a kind.
     * T/W are code, D/B/R/G/S are data, N is a debug/section symbol.
     */
    public static SymbolKind fromTypeCode(char typeCode) {
        return switch (Character.toUpperCase(typeCode)) {
            case 'T', 'W' -> FUNCTION;
            case 'D', 'B', 'R', 'G', 'S' -> OBJECT;
            case 'N' -> SECTION;
            default -> OTHER;
        };
    }
}
