/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link Command} as a child process and captures its output. Output goes to
 * temporary files so neither stream can block the child.
 *
 * @author Mark Pollack
 */
public class CommandRunner {

	private static final Logger logger = LoggerFactory.getLogger(CommandRunner.class);

	/**
	 * Runs the command and waits for it to finish or time out.
	 * @param command the command
	 * @return the result; a timed out process is killed
	 * @throws IOException if the process cannot be started or its output read
	 * @throws InterruptedException if interrupted while waiting
	 */
	public CommandResult run(Command command) throws IOException, InterruptedException {
		List<String> commandLine = new ArrayList<>();
		commandLine.add(command.executable());
		commandLine.addAll(command.args());

		ProcessBuilder builder = new ProcessBuilder(commandLine);
		if (command.cwd() != null) {
			builder.directory(new File(command.cwd()));
		}
		if (command.env() != null) {
			builder.environment().putAll(command.env());
		}

		Path stdout = Files.createTempFile("acp-cmd-", ".out");
		Path stderr = Files.createTempFile("acp-cmd-", ".err");
		try {
			builder.redirectOutput(stdout.toFile());
			builder.redirectError(stderr.toFile());
			logger.debug("Running {} in {}", commandLine, command.cwd());
			Process process = builder.start();
			long timeoutMillis = (command.timeout() != null ? command.timeout() : Command.DEFAULT_TIMEOUT).toMillis();
			if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
				process.destroyForcibly();
				logger.warn("Command {} timed out after {} ms", commandLine, timeoutMillis);
				return CommandResult.timeout();
			}
			return new CommandResult(Files.readString(stdout, StandardCharsets.UTF_8),
					Files.readString(stderr, StandardCharsets.UTF_8), process.exitValue(), false);
		}
		finally {
			Files.deleteIfExists(stdout);
			Files.deleteIfExists(stderr);
		}
	}

}
