/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.spec;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire types of the gateway: JSON-RPC 2.0 envelopes and the request, result and
 * notification payloads of every ACP method the gateway serves.
 *
 * <p>
 * Field names on the wire are snake_case; unknown properties are ignored on input and null
 * members are omitted on output.
 * </p>
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
public final class AcpSchema {

	private AcpSchema() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	public static final String PROTOCOL_VERSION = "0.4.0";

	// ---------------------------
	// Method Names
	// ---------------------------

	public static final String METHOD_INITIALIZE = "initialize";

	public static final String METHOD_SESSION_NEW = "session/new";

	public static final String METHOD_SESSION_PROMPT = "session/prompt";

	public static final String METHOD_SESSION_SET_MODE = "session/set_mode";

	public static final String METHOD_SESSION_SET_MODEL = "session/set_model";

	public static final String METHOD_SESSION_CANCEL = "session/cancel";

	public static final String METHOD_TOOLS_LIST = "tools/list";

	public static final String METHOD_TOOLS_CALL = "tools/call";

	public static final String METHOD_SESSION_UPDATE = "session/update";

	// ---------------------------
	// JSON-RPC Message Types
	// ---------------------------

	/**
	 * A JSON-RPC request that expects a response.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param id A unique identifier for the request, a string or an integer
	 * @param method The name of the method to be invoked
	 * @param params Parameters for the method call
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record JSONRPCRequest(@JsonProperty("jsonrpc") String jsonrpc, @JsonProperty("id") Object id,
			@JsonProperty("method") String method, @JsonProperty("params") Object params) implements JSONRPCMessage {
		public JSONRPCRequest(String method, Object id, Object params) {
			this(JSONRPC_VERSION, id, method, params);
		}
	}

	/**
	 * A JSON-RPC notification that does not expect a response.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param method The name of the method to be invoked
	 * @param params Parameters for the method call
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record JSONRPCNotification(@JsonProperty("jsonrpc") String jsonrpc, @JsonProperty("method") String method,
			@JsonProperty("params") Object params) implements JSONRPCMessage {
		public JSONRPCNotification(String method, Object params) {
			this(JSONRPC_VERSION, method, params);
		}
	}

	/**
	 * A JSON-RPC response to a request. The {@code id} member is always written, as
	 * {@code null} when the request id could not be determined.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param id The request ID this response corresponds to
	 * @param result The result of the method call (null if error occurred)
	 * @param error The error information (null if successful)
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record JSONRPCResponse(@JsonProperty("jsonrpc") String jsonrpc,
			@JsonProperty("id") @JsonInclude(JsonInclude.Include.ALWAYS) Object id,
			@JsonProperty("result") Object result,
			@JsonProperty("error") JSONRPCError error) implements JSONRPCMessage {

		public static JSONRPCResponse success(Object id, Object result) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, result, null);
		}

		public static JSONRPCResponse failure(Object id, JSONRPCError error) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, null, error);
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record JSONRPCError(@JsonProperty("code") int code, @JsonProperty("message") String message,
			@JsonProperty("data") Object data) {
	}

	/**
	 * Base type for all JSON-RPC messages.
	 */
	public sealed interface JSONRPCMessage permits JSONRPCRequest, JSONRPCNotification, JSONRPCResponse {

		String jsonrpc();

	}

	// ---------------------------
	// Capabilities
	// ---------------------------

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record PromptCapabilities(@JsonProperty("image") Boolean image,
			@JsonProperty("embedded_context") Boolean embeddedContext) {
		public PromptCapabilities() {
			this(false, true);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record FileSystemCapabilities(@JsonProperty("read_text_file") Boolean readTextFile,
			@JsonProperty("write_text_file") Boolean writeTextFile,
			@JsonProperty("list_directory") Boolean listDirectory,
			@JsonProperty("create_directory") Boolean createDirectory,
			@JsonProperty("delete_file") Boolean deleteFile) {
		public FileSystemCapabilities() {
			this(true, true, false, false, false);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record TerminalCapabilities(@JsonProperty("create") Boolean create, @JsonProperty("resize") Boolean resize,
			@JsonProperty("send_input") Boolean sendInput, @JsonProperty("read_output") Boolean readOutput) {
		public TerminalCapabilities() {
			this(true, true, true, true);
		}
	}

	/**
	 * Capabilities advertised by the gateway and, in the same shape, declared by clients.
	 * The no-arg constructor yields the gateway defaults.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record AgentCapabilities(@JsonProperty("prompt") PromptCapabilities prompt,
			@JsonProperty("fs") FileSystemCapabilities fs, @JsonProperty("terminal") TerminalCapabilities terminal) {
		public AgentCapabilities() {
			this(new PromptCapabilities(), new FileSystemCapabilities(), new TerminalCapabilities());
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ServerInfo(@JsonProperty("name") String name, @JsonProperty("version") String version) {
	}

	// ---------------------------
	// initialize
	// ---------------------------

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record InitializeRequest(@JsonProperty("protocol_version") String protocolVersion,
			@JsonProperty("capabilities") AgentCapabilities capabilities,
			@JsonProperty("client_info") ServerInfo clientInfo,
			@JsonProperty("working_directory") String workingDirectory) {
		public InitializeRequest() {
			this(PROTOCOL_VERSION, null, null, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record InitializeResponse(@JsonProperty("protocol_version") String protocolVersion,
			@JsonProperty("capabilities") AgentCapabilities capabilities,
			@JsonProperty("server_info") ServerInfo serverInfo) {
	}

	// ---------------------------
	// session/*
	// ---------------------------

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record NewSessionRequest(@JsonProperty("working_directory") String workingDirectory,
			@JsonProperty("metadata") Map<String, Object> metadata, @JsonProperty("mode") String mode,
			@JsonProperty("model") String model) {
		public NewSessionRequest(String workingDirectory) {
			this(workingDirectory, null, null, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record NewSessionResponse(@JsonProperty("session_id") String sessionId,
			@JsonProperty("capabilities") AgentCapabilities capabilities,
			@JsonProperty("available_models") List<String> availableModels,
			@JsonProperty("available_modes") List<String> availableModes) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record PromptRequest(@JsonProperty("session_id") String sessionId, @JsonProperty("message") String message,
			@JsonProperty("mode") String mode, @JsonProperty("model") String model,
			@JsonProperty("metadata") Map<String, Object> metadata) {
		public PromptRequest(String sessionId, String message) {
			this(sessionId, message, null, null, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record PromptResult(@JsonProperty("message") AcpMessage message,
			@JsonProperty("stop_reason") StopReason stopReason, @JsonProperty("usage") Map<String, Object> usage) {
		public PromptResult(AcpMessage message, StopReason stopReason) {
			this(message, stopReason, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SetSessionModeRequest(@JsonProperty("session_id") String sessionId,
			@JsonProperty("mode") String mode) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SetSessionModeResponse(@JsonProperty("success") boolean success, @JsonProperty("mode") String mode) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SetSessionModelRequest(@JsonProperty("session_id") String sessionId,
			@JsonProperty("model") String model) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SetSessionModelResponse(@JsonProperty("success") boolean success,
			@JsonProperty("model") String model) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record CancelRequest(@JsonProperty("session_id") String sessionId, @JsonProperty("delete") Boolean delete) {
		public CancelRequest(String sessionId) {
			this(sessionId, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record CancelResponse(@JsonProperty("success") boolean success) {
	}

	// ---------------------------
	// tools/*
	// ---------------------------

	/**
	 * One named parameter of a tool's input schema.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolParameter(@JsonProperty("name") String name, @JsonProperty("description") String description,
			@JsonProperty("type") String type, @JsonProperty("required") boolean required,
			@JsonProperty("default") Object defaultValue, @JsonProperty("enum") List<String> allowedValues) {

		public static ToolParameter required(String name, String type, String description) {
			return new ToolParameter(name, description, type, true, null, null);
		}

		public static ToolParameter optional(String name, String type, String description, Object defaultValue) {
			return new ToolParameter(name, description, type, false, defaultValue, null);
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolInputSchema(@JsonProperty("type") String type,
			@JsonProperty("properties") Map<String, ToolParameter> properties,
			@JsonProperty("required") List<String> required) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolDescriptor(@JsonProperty("name") String name, @JsonProperty("description") String description,
			@JsonProperty("input_schema") ToolInputSchema inputSchema) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ListToolsResponse(@JsonProperty("tools") List<ToolDescriptor> tools) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record CallToolRequest(@JsonProperty("name") String name,
			@JsonProperty("arguments") Map<String, Object> arguments, @JsonProperty("session_id") String sessionId) {
		public CallToolRequest(String name, Map<String, Object> arguments) {
			this(name, arguments, null);
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolResult(@JsonProperty("content") List<MessageContent> content,
			@JsonProperty("is_error") boolean isError) {

		public static ToolResult text(String text, boolean isError) {
			return new ToolResult(List.of(MessageContent.text(text)), isError);
		}

		/**
		 * Concatenates the text of all text content items.
		 * @return the joined text, empty if there is none
		 */
		public String joinedText() {
			StringBuilder sb = new StringBuilder();
			if (content != null) {
				for (MessageContent item : content) {
					if (item.text() != null) {
						sb.append(item.text());
					}
				}
			}
			return sb.toString();
		}

	}

	// ---------------------------
	// Messages and content
	// ---------------------------

	/**
	 * A content item: text, image or embedded resource, discriminated by {@code type}.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record MessageContent(@JsonProperty("type") String type, @JsonProperty("text") String text,
			@JsonProperty("image_url") String imageUrl, @JsonProperty("resource") Map<String, Object> resource) {

		public static final String TYPE_TEXT = "text";

		public static MessageContent text(String text) {
			return new MessageContent(TYPE_TEXT, text, null, null);
		}

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record AcpMessage(@JsonProperty("role") Role role, @JsonProperty("content") List<MessageContent> content) {

		public static AcpMessage assistant(String text) {
			return new AcpMessage(Role.ASSISTANT, List.of(MessageContent.text(text)));
		}

	}

	public enum Role {

		@JsonProperty("user")
		USER, @JsonProperty("assistant")
		ASSISTANT, @JsonProperty("system")
		SYSTEM

	}

	public enum StopReason {

		@JsonProperty("user_stop")
		USER_STOP, @JsonProperty("tool_call_limit")
		TOOL_CALL_LIMIT, @JsonProperty("completion")
		COMPLETION, @JsonProperty("error")
		ERROR

	}

	// ---------------------------
	// session/update
	// ---------------------------

	public enum SessionUpdateType {

		@JsonProperty("message")
		MESSAGE, @JsonProperty("tool_call")
		TOOL_CALL, @JsonProperty("tool_result")
		TOOL_RESULT, @JsonProperty("error")
		ERROR, @JsonProperty("complete")
		COMPLETE, @JsonProperty("cancelled")
		CANCELLED

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolCallUpdate(@JsonProperty("id") String id, @JsonProperty("name") String name,
			@JsonProperty("arguments") Map<String, Object> arguments) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolResultUpdate(@JsonProperty("id") String id, @JsonProperty("name") String name,
			@JsonProperty("result") ToolResult result) {
	}

	/**
	 * Parameters of a {@code session/update} notification. Only the member matching
	 * {@link #type()} is populated.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SessionUpdate(@JsonProperty("session_id") String sessionId,
			@JsonProperty("type") SessionUpdateType type, @JsonProperty("message") AcpMessage message,
			@JsonProperty("tool_call") ToolCallUpdate toolCall,
			@JsonProperty("tool_result") ToolResultUpdate toolResult, @JsonProperty("error") String error,
			@JsonProperty("result") PromptResult result) {
	}

}
