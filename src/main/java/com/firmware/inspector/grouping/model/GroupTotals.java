package com.firmware.inspector.grouping.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregates of a template group.
 *
 * {@code sizeBytes} counts every member; {@code uniqueSizeBytes} counts each
 * (section, address) location once, so it never exceeds {@code sizeBytes}.
 */
@Value
@Builder
public class GroupTotals {
    int symbolCount;
    int specializationCount;
    long sizeBytes;
    long uniqueSizeBytes;
    long largestSymbolSizeBytes;
    long smallestSymbolSizeBytes;
}
