package com.firmware.inspector.analysis;

/**
 * The memory map does not cover the sections of the inspected image.
 */
public class MemoryMapException extends Exception {

    private static final long serialVersionUID = 1L;

    public MemoryMapException(String message) {
        super(message);
    }
}
