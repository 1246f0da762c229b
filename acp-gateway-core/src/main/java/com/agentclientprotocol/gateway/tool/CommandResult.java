/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

/**
 * Outcome of a {@link Command}.
 *
 * @param stdout Captured standard output
 * @param stderr Captured standard error
 * @param exitCode The exit code, -1 when the process was killed
 * @param timedOut Whether the process was killed on timeout
 * @author Mark Pollack
 */
public record CommandResult(
		String stdout,
		String stderr,
		int exitCode,
		boolean timedOut
) {

	public static CommandResult timeout() {
		return new CommandResult("", "", -1, true);
	}

	/**
	 * Returns true if the command completed successfully (exit code 0).
	 * @return true if exit code is 0 and command did not time out
	 */
	public boolean success() {
		return exitCode == 0 && !timedOut;
	}

	/**
	 * Standard output followed, when standard error is not empty, by a {@code STDERR:}
	 * section.
	 * @return the combined output
	 */
	public String combinedOutput() {
		if (stderr == null || stderr.isEmpty()) {
			return stdout;
		}
		return stdout + "\nSTDERR:\n" + stderr;
	}

}
