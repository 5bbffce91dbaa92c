package com.firmware.inspector.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * File and line a symbol was defined at, as reported by {@code nm --line-numbers}.
 */
@Value
@Builder
public class SourceLocation {

    @NonNull
    String file;

    int line;
}
