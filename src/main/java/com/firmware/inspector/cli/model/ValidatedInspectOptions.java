package com.firmware.inspector.cli.model;

import java.nio.file.Path;
import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps InspectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    String imageName;
    Duration commandTimeout;
    Path normalizedReportPath;
}
