/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BashTool}. Runs real {@code bash} subprocesses.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class BashToolTest {

	@TempDir
	Path workDir;

	@Test
	void runsCommandAndReturnsStdout() {
		BashTool tool = new BashTool();

		Object output = tool.invoke(Map.of("command", "echo hi"));

		assertThat(output).isEqualTo("hi\n");
	}

	@Test
	void runsInGivenWorkingDirectory() throws Exception {
		Files.writeString(workDir.resolve("marker.txt"), "x");
		BashTool tool = new BashTool();

		Object output = tool.invoke(Map.of("command", "ls", ToolRegistry.WORKING_DIRECTORY_ARGUMENT, workDir.toString()));

		assertThat(output.toString()).contains("marker.txt");
	}

	@Test
	void appendsStderrSection() {
		BashTool tool = new BashTool();

		Object output = tool.invoke(Map.of("command", "echo out; echo oops 1>&2"));

		assertThat(output).isEqualTo("out\n\nSTDERR:\noops\n");
	}

	@Test
	void reportsTimeout() {
		BashTool tool = new BashTool(new CommandRunner(), Duration.ofSeconds(1), workDir.toString());

		Object output = tool.invoke(Map.of("command", "sleep 5"));

		assertThat(output).isEqualTo("Error: Command timed out after 1 seconds");
		assertThat(ToolRegistry.looksLikeError(output.toString())).isTrue();
	}

	@Test
	void missingCommandIsAnError() {
		Object output = new BashTool().invoke(Map.of());

		assertThat(output).isEqualTo("Error: command is required");
	}

	@Test
	void declaresWorkingDirectoryParameter() {
		BashTool tool = new BashTool();

		assertThat(tool.name()).isEqualTo("bash_tool");
		assertThat(tool.parameters()).extracting(p -> p.name())
			.containsExactly("command", ToolRegistry.WORKING_DIRECTORY_ARGUMENT, "restart");
	}

}
