/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A process to run through {@link CommandRunner}.
 *
 * <p>
 * Example usage:
 * <pre>{@code
 * CommandResult result = runner.run(
 *     Command.of("bash", "-c", "make build")
 *         .withCwd("/workspace")
 *         .withEnv(Map.of("DEBUG", "true"))
 *         .withTimeout(Duration.ofSeconds(30)));
 * }</pre>
 *
 * @param executable The program to execute
 * @param args The arguments to pass to the program
 * @param cwd The working directory (null for the gateway's own)
 * @param env Extra environment variables (null for none)
 * @param timeout How long to wait before killing the process
 * @author Mark Pollack
 */
public record Command(
		String executable,
		List<String> args,
		String cwd,
		Map<String, String> env,
		Duration timeout
) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	/**
	 * Creates a Command from command-line arguments.
	 * The first argument is the executable, remaining arguments are passed as args.
	 * @param commandAndArgs The command and its arguments
	 * @return A new Command with the default timeout
	 */
	public static Command of(String... commandAndArgs) {
		if (commandAndArgs == null || commandAndArgs.length == 0) {
			throw new IllegalArgumentException("At least one argument (the command) is required");
		}
		return new Command(
				commandAndArgs[0],
				List.copyOf(Arrays.asList(commandAndArgs).subList(1, commandAndArgs.length)),
				null, null, DEFAULT_TIMEOUT);
	}

	/**
	 * Creates a Command that runs a line through {@code bash -c}.
	 * @param commandLine the shell command line
	 * @return A new Command
	 */
	public static Command shell(String commandLine) {
		return of("bash", "-c", commandLine);
	}

	public Command withCwd(String cwd) {
		return new Command(executable, args, cwd, env, timeout);
	}

	public Command withEnv(Map<String, String> env) {
		return new Command(executable, args, cwd, env, timeout);
	}

	public Command withTimeout(Duration timeout) {
		return new Command(executable, args, cwd, env, timeout);
	}

}
