package com.firmware.inspector.report;

import lombok.Builder;
import lombok.Value;

/**
 * What to include when presenting an inspection result.
 */
@Value
@Builder(toBuilder = true)
public class ReportOptions {

    @Builder.Default
    int topGroups = 20;

    @Builder.Default
    int topSpecializations = 5;

    boolean templatesOnly;
}
