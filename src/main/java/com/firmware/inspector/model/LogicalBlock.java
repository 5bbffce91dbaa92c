package com.firmware.inspector.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A named slice of an address window that sections of one category are accounted to.
 */
@Value
@Builder
public class LogicalBlock {

    @NonNull
    String id;

    @NonNull
    String categoryId;

    @NonNull
    String windowId;

    @Builder.Default
    AddressType role = AddressType.RUNTIME;
}
