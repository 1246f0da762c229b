/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;

import com.agentclientprotocol.gateway.error.AcpErrorCodes;
import com.agentclientprotocol.gateway.error.AcpProtocolException;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.ToolDescriptor;
import com.agentclientprotocol.gateway.spec.AcpSchema.ToolParameter;
import com.agentclientprotocol.gateway.spec.AcpSchema.ToolResult;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * The set of tools served by the gateway.
 *
 * <p>
 * Tool descriptors are built once from each tool's declared parameters and cached until
 * {@link #clearCache()}. Calls run on a dedicated pool of daemon threads.
 * </p>
 *
 * <p>
 * Raw tool output is classified as an error when it starts with {@code "Error:"} or
 * {@code "Exception:"} or contains {@code "failed"} in any case. This text heuristic is on
 * by default and can be switched off with {@link #errorHeuristic(boolean)}, in which case
 * only thrown exceptions and explicit {@link ToolResult}s report errors.
 * </p>
 *
 * @author Mark Pollack
 */
public class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	public static final String WORKING_DIRECTORY_ARGUMENT = "working_directory";

	public static final String FILE_PATH_ARGUMENT = "file_path";

	private final Map<String, AcpTool> tools = new LinkedHashMap<>();

	private final Map<String, List<ToolParameter>> declaredParameters = new HashMap<>();

	private final McpJsonMapper jsonMapper;

	private final Scheduler toolScheduler;

	private volatile List<ToolDescriptor> descriptorCache;

	private volatile boolean errorHeuristic = true;

	public ToolRegistry(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
		this.toolScheduler = Schedulers.fromExecutorService(Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "acp-tool-worker");
			t.setDaemon(true);
			return t;
		}), "tool-worker");
	}

	public ToolRegistry(McpJsonMapper jsonMapper, Collection<? extends AcpTool> tools) {
		this(jsonMapper);
		tools.forEach(this::register);
	}

	/**
	 * Adds a tool.
	 * @param tool the tool
	 * @return This registry for chaining
	 * @throws IllegalArgumentException if a tool with the same name is registered
	 */
	public synchronized ToolRegistry register(AcpTool tool) {
		Assert.notNull(tool, "Tool must not be null");
		Assert.hasText(tool.name(), "Tool name must not be empty");
		Assert.isTrue(!tools.containsKey(tool.name()), "Tool '" + tool.name() + "' is already registered");
		tools.put(tool.name(), tool);
		declaredParameters.put(tool.name(), tool.parameters() != null ? List.copyOf(tool.parameters()) : List.of());
		descriptorCache = null;
		return this;
	}

	/**
	 * Enables or disables the text-based error classification of raw tool output.
	 * @param enabled whether to apply the heuristic
	 * @return This registry for chaining
	 */
	public ToolRegistry errorHeuristic(boolean enabled) {
		this.errorHeuristic = enabled;
		return this;
	}

	public boolean isErrorHeuristic() {
		return errorHeuristic;
	}

	/**
	 * Returns the descriptors of all registered tools, building and caching them on first
	 * use.
	 * @return the tool descriptors in registration order
	 */
	public List<ToolDescriptor> listTools() {
		List<ToolDescriptor> cached = descriptorCache;
		if (cached != null) {
			return cached;
		}
		synchronized (this) {
			if (descriptorCache == null) {
				List<ToolDescriptor> descriptors = new ArrayList<>(tools.size());
				for (AcpTool tool : tools.values()) {
					descriptors.add(toDescriptor(tool, declaredParameters.get(tool.name())));
				}
				descriptorCache = List.copyOf(descriptors);
			}
			return descriptorCache;
		}
	}

	private static ToolDescriptor toDescriptor(AcpTool tool, List<ToolParameter> parameters) {
		Map<String, ToolParameter> properties = new LinkedHashMap<>();
		List<String> required = new ArrayList<>();
		for (ToolParameter parameter : parameters) {
			properties.put(parameter.name(), parameter);
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		return new ToolDescriptor(tool.name(), tool.description(),
				new AcpSchema.ToolInputSchema("object", properties, required));
	}

	public void clearCache() {
		descriptorCache = null;
		logger.info("Tool cache cleared");
	}

	public synchronized Optional<AcpTool> findTool(String name) {
		return Optional.ofNullable(tools.get(name));
	}

	/**
	 * Returns the parameters a tool declared at registration, never null.
	 * @param name the tool name
	 * @return the declared parameters, empty for an unknown tool
	 */
	public synchronized List<ToolParameter> parametersOf(String name) {
		return declaredParameters.getOrDefault(name, List.of());
	}

	public Optional<ToolDescriptor> getToolInfo(String name) {
		return listTools().stream().filter(descriptor -> descriptor.name().equals(name)).findFirst();
	}

	public synchronized List<String> getToolNames() {
		return List.copyOf(tools.keySet());
	}

	public ToolStats getToolStats() {
		List<ToolDescriptor> cached = descriptorCache;
		List<String> names = getToolNames();
		return new ToolStats(names.size(), cached != null ? cached.size() : 0, names);
	}

	/**
	 * Checks a call against the tool's declared parameters without executing it. The
	 * working directory is not required since the gateway injects it.
	 * @param name the tool name
	 * @param arguments the call arguments
	 * @return the validation outcome
	 */
	public ToolCallValidation validateToolCall(String name, Map<String, Object> arguments) {
		Optional<AcpTool> tool = findTool(name);
		if (tool.isEmpty()) {
			return ToolCallValidation.invalid("Tool '" + name + "' not found");
		}
		Map<String, Object> args = arguments != null ? arguments : Map.of();
		for (ToolParameter parameter : parametersOf(name)) {
			Object value = args.get(parameter.name());
			if (value == null) {
				if (parameter.required() && !WORKING_DIRECTORY_ARGUMENT.equals(parameter.name())) {
					return ToolCallValidation.invalid("Invalid arguments: missing required field '" + parameter.name() + "'");
				}
				continue;
			}
			if (parameter.allowedValues() != null && !parameter.allowedValues().contains(String.valueOf(value))) {
				return ToolCallValidation.invalid("Invalid arguments: '" + parameter.name() + "' must be one of "
						+ parameter.allowedValues());
			}
		}
		return ToolCallValidation.ok();
	}

	/**
	 * Invokes a tool.
	 * @param name the tool name
	 * @param arguments the call arguments, may be null
	 * @param workingDirectory the calling session's directory, may be null
	 * @return a Mono emitting the normalized result; an exception thrown by the tool
	 * becomes an error result
	 * @throws AcpProtocolException with the tool-error code, signalled through the Mono,
	 * when the tool is unknown
	 */
	public Mono<ToolResult> callTool(String name, Map<String, Object> arguments, String workingDirectory) {
		return Mono.defer(() -> {
			AcpTool tool = findTool(name).orElse(null);
			if (tool == null) {
				return Mono.error(new AcpProtocolException(AcpErrorCodes.TOOL_ERROR, "Tool '" + name + "' not found"));
			}
			Map<String, Object> prepared = prepareArguments(tool, arguments, workingDirectory);
			logger.info("Calling tool {} with args {}", name, prepared);
			return Mono.fromCallable(() -> formatResult(tool.invoke(prepared)))
				.subscribeOn(toolScheduler)
				.onErrorResume(error -> {
					logger.error("Tool {} failed", name, error);
					return Mono.just(ToolResult.text("Error executing tool " + name + ": " + error.getMessage(), true));
				});
		});
	}

	Map<String, Object> prepareArguments(AcpTool tool, Map<String, Object> arguments, String workingDirectory) {
		Map<String, Object> prepared = new HashMap<>(arguments != null ? arguments : Map.of());
		if (workingDirectory == null) {
			return prepared;
		}
		for (ToolParameter parameter : parametersOf(tool.name())) {
			if (WORKING_DIRECTORY_ARGUMENT.equals(parameter.name())) {
				prepared.put(WORKING_DIRECTORY_ARGUMENT, workingDirectory);
			}
			else if (FILE_PATH_ARGUMENT.equals(parameter.name())
					&& prepared.get(FILE_PATH_ARGUMENT) instanceof String filePath && !Path.of(filePath).isAbsolute()) {
				prepared.put(FILE_PATH_ARGUMENT, Path.of(workingDirectory).resolve(filePath).toString());
			}
		}
		return prepared;
	}

	ToolResult formatResult(Object output) {
		if (output instanceof ToolResult result) {
			return result;
		}
		String text = toText(output);
		return ToolResult.text(text, errorHeuristic && looksLikeError(text));
	}

	private String toText(Object output) {
		if (output == null) {
			return "";
		}
		if (output instanceof String text) {
			return text;
		}
		if (output instanceof Map || output instanceof Collection) {
			try {
				return jsonMapper.writeValueAsString(output);
			}
			catch (Exception e) {
				logger.debug("Falling back to toString for tool output", e);
			}
		}
		return String.valueOf(output);
	}

	/**
	 * Applies the text heuristic used to flag raw tool output as an error.
	 * @param text the output text
	 * @return true if the text looks like an error report
	 */
	public static boolean looksLikeError(String text) {
		return text.startsWith("Error:") || text.startsWith("Exception:")
				|| text.toLowerCase(Locale.ROOT).contains("failed");
	}

	/**
	 * Releases the tool worker threads.
	 */
	public void close() {
		toolScheduler.dispose();
	}

}
