package com.firmware.inspector.analysis;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and informational notes accumulated during one inspection run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class InspectionDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
