package com.firmware.inspector;

import com.firmware.inspector.cli.InspectCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Firmware Symbol Inspector.
 * This CLI tool reads the symbol table of a linked ELF image through the binutils of a cross
 * toolchain and reports how much space each C++ template family takes.
 */
public class InspectorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new InspectCommand()).execute(args);
        System.exit(exitCode);
    }
}
