package com.firmware.inspector.model;

/**
 * Which address of a section a logical block accounts for.
 */
public enum AddressType {
    /** Load address (LMA): where the initial image is stored. */
    LOAD,
    /** Execution address of code placed in the block. */
    EXEC,
    /** Run-time address of data. */
    RUNTIME;

    public static AddressType fromRole(String role) {
        if (role == null) {
            return RUNTIME;
        }
        return switch (role.toLowerCase()) {
            case "load" -> LOAD;
            case "exec" -> EXEC;
            default -> RUNTIME;
        };
    }
}
