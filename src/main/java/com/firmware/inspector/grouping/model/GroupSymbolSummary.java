package com.firmware.inspector.grouping.model;

import com.firmware.inspector.model.SymbolLocation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A member symbol as seen from a template group.
 */
@Value
@Builder(toBuilder = true)
public class GroupSymbolSummary {

    @NonNull
    String symbolId;

    String name;
    String mangledName;
    long sizeBytes;
    String specializationKey;
    String sectionId;
    String blockId;
    String windowId;
    Long addr;
    SymbolLocation primaryLocation;
}
