package com.firmware.inspector.model;

import lombok.Builder;
import lombok.Value;

/**
 * A concrete placement of a symbol inside a logical memory block.
 */
@Value
@Builder(toBuilder = true)
public class SymbolLocation {

    String windowId;
    String blockId;
    AddressType addressType;

    /** Absolute address of the symbol at this location, if known. */
    Long addr;
}
