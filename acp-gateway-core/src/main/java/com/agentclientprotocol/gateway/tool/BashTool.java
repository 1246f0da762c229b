/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.agentclientprotocol.gateway.spec.AcpSchema.ToolParameter;

/**
 * Runs a shell command in the session's working directory. Each call uses a fresh
 * {@code bash -c} process.
 *
 * @author Mark Pollack
 */
public class BashTool implements AcpTool {

	public static final String NAME = "bash_tool";

	private final CommandRunner runner;

	private final Duration timeout;

	private final String defaultWorkingDirectory;

	public BashTool() {
		this(new CommandRunner(), Command.DEFAULT_TIMEOUT, System.getProperty("user.dir"));
	}

	public BashTool(CommandRunner runner, Duration timeout, String defaultWorkingDirectory) {
		this.runner = runner;
		this.timeout = timeout;
		this.defaultWorkingDirectory = defaultWorkingDirectory;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Execute a shell command in the working directory and return its output. "
				+ "Each command runs in a fresh subprocess.";
	}

	@Override
	public List<ToolParameter> parameters() {
		return List.of(ToolParameter.required("command", "string", "The bash command to execute"),
				ToolParameter.required(ToolRegistry.WORKING_DIRECTORY_ARGUMENT, "string",
						"Directory to run the command in"),
				ToolParameter.optional("restart", "boolean", "Ignored, kept for compatibility", false));
	}

	@Override
	public Object invoke(Map<String, Object> arguments) {
		Object command = arguments.get("command");
		if (!(command instanceof String commandLine) || commandLine.isBlank()) {
			return "Error: command is required";
		}
		Object cwd = arguments.get(ToolRegistry.WORKING_DIRECTORY_ARGUMENT);
		String workingDirectory = cwd != null ? cwd.toString() : defaultWorkingDirectory;
		try {
			CommandResult result = runner.run(Command.shell(commandLine).withCwd(workingDirectory).withTimeout(timeout));
			if (result.timedOut()) {
				return "Error: Command timed out after " + timeout.toSeconds() + " seconds";
			}
			return result.combinedOutput();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return "Error executing command: interrupted";
		}
		catch (Exception e) {
			return "Error executing command: " + e.getMessage();
		}
	}

}
