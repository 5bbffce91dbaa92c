package com.firmware.inspector.grouping.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Finalized rollup of one template family (or of one non-template symbol name).
 */
@Value
@Builder
public class TemplateGroupSummary {

    @NonNull
    String id;

    String displayName;

    boolean template;

    @NonNull
    List<GroupSymbolSummary> symbols;

    /** In order of first appearance. */
    @NonNull
    List<SpecializationSummary> specializations;

    @NonNull
    GroupTotals totals;
}
