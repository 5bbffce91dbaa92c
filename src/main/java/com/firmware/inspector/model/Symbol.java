package com.firmware.inspector.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A linked symbol of the inspected image.
 *
 * Pure structure only. {@code size} and {@code addr} are nullable: a missing value means the
 * upstream tool did not report one.
 */
@Value
@Builder(toBuilder = true)
public class Symbol {

    @NonNull
    String id;

    /** Display (demangled) name. */
    String name;

    String mangledName;

    @Builder.Default
    SymbolKind kind = SymbolKind.OTHER;

    Long size;
    Long addr;

    String sectionId;
    String blockId;
    String windowId;

    SymbolLocation primaryLocation;

    @Singular
    List<SymbolLocation> locations;

    SourceLocation source;

    boolean weak;
    boolean staticBinding;

    @Singular
    List<String> aliases;
}
