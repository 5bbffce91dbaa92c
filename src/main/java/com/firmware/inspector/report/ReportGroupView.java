package com.firmware.inspector.report;

import java.util.List;

import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;

import lombok.NonNull;
import lombok.Value;

/**
 * A ranked group together with the specializations selected for display.
 */
@Value
public class ReportGroupView {

    int rank;

    @NonNull
    TemplateGroupSummary group;

    @NonNull
    List<SpecializationSummary> specializations;

    /** Number of specializations left out of {@link #specializations}. */
    int hiddenSpecializations;
}
