package com.firmware.inspector.parser;

import com.firmware.inspector.model.SourceLocation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One defined symbol row of {@code nm --print-size} output.
 */
@Value
@Builder(toBuilder = true)
public class NmSymbol {

    long address;
    long size;
    char typeCode;

    @NonNull
    String name;

    @NonNull
    String rawName;

    SourceLocation source;
}
