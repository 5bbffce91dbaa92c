package com.firmware.inspector.grouping.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One specialization bucket of a template group. The key is null for non-template symbols
 * and for templates with an empty argument list.
 */
@Value
@Builder
public class SpecializationSummary {

    String key;

    @NonNull
    List<GroupSymbolSummary> symbols;

    @NonNull
    SpecializationTotals totals;
}
