package com.firmware.inspector.grouping.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpecializationTotals {
    int symbolCount;
    long sizeBytes;
    long uniqueSizeBytes;
}
