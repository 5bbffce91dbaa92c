package com.firmware.inspector.toolchain;

/**
 * Binutils executables the inspector drives.
 */
public enum ToolchainTool {
    NM("nm"),
    READELF("readelf"),
    OBJDUMP("objdump");

    private final String executable;

    ToolchainTool(String executable) {
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }
}
