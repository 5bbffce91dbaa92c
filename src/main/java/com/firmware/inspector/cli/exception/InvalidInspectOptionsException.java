package com.firmware.inspector.cli.exception;

import java.util.List;

/**
 * Carries every problem found in the inspect command line, so all of them can be reported at once.
 */
public class InvalidInspectOptionsException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public InvalidInspectOptionsException(List<String> errors) {
		super(errors.size() + " invalid option(s):" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
