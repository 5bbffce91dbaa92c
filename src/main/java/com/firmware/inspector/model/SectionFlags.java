package com.firmware.inspector.model;

import lombok.Builder;
import lombok.Value;

/**
 * Subset of ELF section header flags relevant for size accounting.
 */
@Value
@Builder
public class SectionFlags {
    boolean alloc;
    boolean exec;
    boolean write;
    boolean tls;

    public static SectionFlags parse(String raw) {
        String flags = raw == null ? "" : raw;
        return SectionFlags.builder()
                .alloc(flags.indexOf('A') >= 0)
                .exec(flags.indexOf('X') >= 0)
                .write(flags.indexOf('W') >= 0)
                .tls(flags.indexOf('T') >= 0)
                .build();
    }
}
