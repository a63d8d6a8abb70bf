package com.assetpack.exporter.cli.exception;

import java.util.List;

/**
 * Every option error found for one command invocation, reported together.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String command;
	private final List<String> errors;

	public OptionsValidationException(String command, List<String> errors) {
		super("Invalid options for '" + command + "': " + String.join("; ", errors));
		this.command = command;
		this.errors = List.copyOf(errors);
	}

	/** Name of the command whose options were rejected. */
	public String getCommand() {
		return command;
	}

	public List<String> getErrors() {
		return errors;
	}
}
