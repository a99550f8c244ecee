/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.spec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于JSON-RPC 2.0的语言服务器协议(LSP)客户端所使用的消息模式。
 * <p>
 * 只包含本客户端实际发送或接收的结构：握手、文档同步通知、功能请求参数、
 * 诊断推送以及服务器主动发起的少量请求。功能请求的结果以透传的
 * 通用JSON结构返回，不在此建模。
 *
 * @author Christian Tzolov
 */
public final class LspSchema {

	private static final Logger logger = LoggerFactory.getLogger(LspSchema.class);

	private LspSchema() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	// ---------------------------
	// Method Names
	// ---------------------------

	// Lifecycle Methods
	public static final String METHOD_INITIALIZE = "initialize";

	public static final String METHOD_NOTIFICATION_INITIALIZED = "initialized";

	public static final String METHOD_SHUTDOWN = "shutdown";

	public static final String METHOD_NOTIFICATION_EXIT = "exit";

	// Document Synchronization
	public static final String METHOD_NOTIFICATION_DID_OPEN = "textDocument/didOpen";

	public static final String METHOD_NOTIFICATION_DID_CHANGE = "textDocument/didChange";

	public static final String METHOD_NOTIFICATION_DID_CLOSE = "textDocument/didClose";

	// Language Features
	public static final String METHOD_COMPLETION = "textDocument/completion";

	public static final String METHOD_HOVER = "textDocument/hover";

	public static final String METHOD_DEFINITION = "textDocument/definition";

	public static final String METHOD_REFERENCES = "textDocument/references";

	public static final String METHOD_DOCUMENT_SYMBOL = "textDocument/documentSymbol";

	// Server Push
	public static final String METHOD_NOTIFICATION_PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";

	public static final String METHOD_NOTIFICATION_LOG_MESSAGE = "window/logMessage";

	public static final String METHOD_NOTIFICATION_SHOW_MESSAGE = "window/showMessage";

	// Server-initiated Requests
	public static final String METHOD_WORKSPACE_CONFIGURATION = "workspace/configuration";

	public static final String METHOD_CLIENT_REGISTER_CAPABILITY = "client/registerCapability";

	public static final String METHOD_WORK_DONE_PROGRESS_CREATE = "window/workDoneProgress/create";

	private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
	};

	/**
	 * 将JSON字符串反序列化为{@link JSONRPCMessage}。
	 * <ul>
	 * <li>同时带有{@code method}和{@code id}的是请求</li>
	 * <li>只有{@code method}的是通知</li>
	 * <li>只有{@code id}的是响应</li>
	 * </ul>
	 * @param objectMapper 用于反序列化的ObjectMapper
	 * @param jsonText 要反序列化的JSON字符串
	 * @return JSONRPCMessage
	 * @throws IOException 如果反序列化过程中发生错误
	 * @throws IllegalArgumentException 如果JSON字符串不是有效的JSON-RPC消息
	 */
	public static JSONRPCMessage deserializeJsonRpcMessage(ObjectMapper objectMapper, String jsonText)
			throws IOException {

		logger.debug("Received JSON message: {}", jsonText);

		var map = objectMapper.readValue(jsonText, MAP_TYPE_REF);
		if (map == null) {
			throw new IllegalArgumentException("Cannot deserialize JSONRPCMessage: " + jsonText);
		}

		if (map.containsKey("method") && map.containsKey("id")) {
			return objectMapper.convertValue(map, JSONRPCRequest.class);
		}
		else if (map.containsKey("method")) {
			return objectMapper.convertValue(map, JSONRPCNotification.class);
		}
		else if (map.containsKey("id")) {
			return objectMapper.convertValue(map, JSONRPCResponse.class);
		}

		throw new IllegalArgumentException("Cannot deserialize JSONRPCMessage: " + jsonText);
	}

	/**
	 * 标准JSON-RPC错误码。
	 */
	public static final class ErrorCodes {

		private ErrorCodes() {
		}

		/**
		 * 服务器收到了无效的JSON。
		 */
		public static final int PARSE_ERROR = -32700;

		/**
		 * 发送的JSON不是有效的请求对象。
		 */
		public static final int INVALID_REQUEST = -32600;

		/**
		 * 方法不存在或不可用。
		 */
		public static final int METHOD_NOT_FOUND = -32601;

		/**
		 * 方法参数无效。
		 */
		public static final int INVALID_PARAMS = -32602;

		/**
		 * 内部JSON-RPC错误。
		 */
		public static final int INTERNAL_ERROR = -32603;

	}

	/**
	 * {@code window/logMessage}与{@code window/showMessage}中使用的消息类型。
	 */
	public static final class MessageType {

		private MessageType() {
		}

		public static final int ERROR = 1;

		public static final int WARNING = 2;

		public static final int INFO = 3;

		public static final int LOG = 4;

	}

	public sealed interface JSONRPCMessage permits JSONRPCRequest, JSONRPCNotification, JSONRPCResponse {

		String jsonrpc();

	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCRequest( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("id") Object id,
		@JsonProperty("params") Object params) implements JSONRPCMessage {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCNotification( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("params") Object params) implements JSONRPCMessage {
	} // @formatter:on

	/**
	 * JSON-RPC响应。成功响应总是携带{@code result}字段（可能为JSON {@code null}），
	 * 错误响应只携带{@code error}字段。
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCResponse( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("id") Object id,
		@JsonProperty("result") Object result,
		@JsonProperty("error") JSONRPCError error) implements JSONRPCMessage {

		/**
		 * 创建成功响应。{@code null}结果被编码为显式的JSON {@code null}。
		 * @param id 对应请求的ID
		 * @param result 结果，可以为{@code null}
		 * @return 成功响应
		 */
		public static JSONRPCResponse success(Object id, Object result) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, result != null ? result : NullNode.getInstance(), null);
		}

		/**
		 * 创建错误响应。
		 * @param id 对应请求的ID
		 * @param code 错误码
		 * @param message 错误消息
		 * @return 错误响应
		 */
		public static JSONRPCResponse failure(Object id, int code, String message) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, null, new JSONRPCError(code, message, null));
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		@JsonIgnoreProperties(ignoreUnknown = true)
		public record JSONRPCError(
			@JsonProperty("code") int code,
			@JsonProperty("message") String message,
			@JsonProperty("data") Object data) {
		}
	}// @formatter:on

	// ---------------------------
	// Initialization
	// ---------------------------
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InitializeParams( // @formatter:off
		@JsonProperty("processId") Long processId,
		@JsonProperty("clientInfo") Implementation clientInfo,
		@JsonProperty("rootUri") String rootUri,
		@JsonProperty("capabilities") ClientCapabilities capabilities,
		@JsonProperty("workspaceFolders") List<WorkspaceFolder> workspaceFolders) {
	} // @formatter:on

	/**
	 * 服务器对{@code initialize}请求的应答。{@code capabilities}原样保留服务器返回的结构，
	 * 握手完成后作为只读快照使用。
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InitializeResult( // @formatter:off
		@JsonProperty("capabilities") Map<String, Object> capabilities,
		@JsonProperty("serverInfo") Implementation serverInfo) {

		public InitializeResult {
			capabilities = capabilities != null ? Collections.unmodifiableMap(new LinkedHashMap<>(capabilities))
					: Map.of();
		}

		/**
		 * 判断服务器是否声明了给定的能力。缺失、{@code null}或{@code false}都视为不支持；
		 * 其它任何取值（{@code true}或一个选项对象）都视为支持。
		 * @param provider 能力名称，例如{@code hoverProvider}
		 * @return 如果服务器声明了该能力则返回true
		 */
		public boolean supports(String provider) {
			Object value = this.capabilities.get(provider);
			return value != null && !Boolean.FALSE.equals(value);
		}
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Implementation( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("version") String version) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record WorkspaceFolder( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("name") String name) {
	} // @formatter:on

	/**
	 * 客户端在{@code initialize}请求中声明的能力。
	 *
	 * <p>
	 * 通过{@link #builder()}逐项启用，或使用{@link #defaults()}启用本客户端支持的全部功能。
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ClientCapabilities( // @formatter:off
		@JsonProperty("workspace") WorkspaceClientCapabilities workspace,
		@JsonProperty("textDocument") TextDocumentClientCapabilities textDocument) {

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record WorkspaceClientCapabilities(
			@JsonProperty("workspaceFolders") Boolean workspaceFolders,
			@JsonProperty("configuration") Boolean configuration) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record TextDocumentClientCapabilities(
			@JsonProperty("synchronization") SynchronizationCapabilities synchronization,
			@JsonProperty("completion") CompletionCapabilities completion,
			@JsonProperty("hover") HoverCapabilities hover,
			@JsonProperty("definition") DefinitionCapabilities definition,
			@JsonProperty("references") ReferencesCapabilities references,
			@JsonProperty("documentSymbol") DocumentSymbolCapabilities documentSymbol,
			@JsonProperty("publishDiagnostics") PublishDiagnosticsCapabilities publishDiagnostics) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record SynchronizationCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration,
			@JsonProperty("willSave") Boolean willSave,
			@JsonProperty("willSaveWaitUntil") Boolean willSaveWaitUntil,
			@JsonProperty("didSave") Boolean didSave) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record CompletionCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration,
			@JsonProperty("completionItem") CompletionItemCapabilities completionItem,
			@JsonProperty("contextSupport") Boolean contextSupport) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record CompletionItemCapabilities(
			@JsonProperty("snippetSupport") Boolean snippetSupport,
			@JsonProperty("commitCharactersSupport") Boolean commitCharactersSupport,
			@JsonProperty("documentationFormat") List<String> documentationFormat,
			@JsonProperty("deprecatedSupport") Boolean deprecatedSupport,
			@JsonProperty("preselectSupport") Boolean preselectSupport) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record HoverCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration,
			@JsonProperty("contentFormat") List<String> contentFormat) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record DefinitionCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration,
			@JsonProperty("linkSupport") Boolean linkSupport) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record ReferencesCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record DocumentSymbolCapabilities(
			@JsonProperty("dynamicRegistration") Boolean dynamicRegistration,
			@JsonProperty("hierarchicalDocumentSymbolSupport") Boolean hierarchicalDocumentSymbolSupport) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record PublishDiagnosticsCapabilities(
			@JsonProperty("relatedInformation") Boolean relatedInformation,
			@JsonProperty("tagSupport") TagSupport tagSupport,
			@JsonProperty("versionSupport") Boolean versionSupport) {
		}

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record TagSupport(
			@JsonProperty("valueSet") List<Integer> valueSet) {
		}

		private static final List<String> MARKUP_FORMATS = List.of("markdown", "plaintext");

		/**
		 * 启用本客户端支持的全部能力。
		 * @return 完整的客户端能力
		 */
		public static ClientCapabilities defaults() {
			return builder().synchronization()
				.completion()
				.hover()
				.definition()
				.references()
				.documentSymbol()
				.publishDiagnostics()
				.workspaceFolders()
				.workspaceConfiguration()
				.build();
		}

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {
			private SynchronizationCapabilities synchronization;
			private CompletionCapabilities completion;
			private HoverCapabilities hover;
			private DefinitionCapabilities definition;
			private ReferencesCapabilities references;
			private DocumentSymbolCapabilities documentSymbol;
			private PublishDiagnosticsCapabilities publishDiagnostics;
			private Boolean workspaceFolders;
			private Boolean configuration;

			public Builder synchronization() {
				this.synchronization = new SynchronizationCapabilities(true, true, true, true);
				return this;
			}

			public Builder completion() {
				this.completion = new CompletionCapabilities(true,
						new CompletionItemCapabilities(true, true, MARKUP_FORMATS, true, true), true);
				return this;
			}

			public Builder hover() {
				this.hover = new HoverCapabilities(true, MARKUP_FORMATS);
				return this;
			}

			public Builder definition() {
				this.definition = new DefinitionCapabilities(true, true);
				return this;
			}

			public Builder references() {
				this.references = new ReferencesCapabilities(true);
				return this;
			}

			public Builder documentSymbol() {
				this.documentSymbol = new DocumentSymbolCapabilities(true, true);
				return this;
			}

			public Builder publishDiagnostics() {
				this.publishDiagnostics = new PublishDiagnosticsCapabilities(true, new TagSupport(List.of(1, 2)), true);
				return this;
			}

			public Builder workspaceFolders() {
				this.workspaceFolders = true;
				return this;
			}

			public Builder workspaceConfiguration() {
				this.configuration = true;
				return this;
			}

			public ClientCapabilities build() {
				WorkspaceClientCapabilities workspace = (workspaceFolders != null || configuration != null)
						? new WorkspaceClientCapabilities(workspaceFolders, configuration) : null;
				TextDocumentClientCapabilities textDocument = new TextDocumentClientCapabilities(synchronization,
						completion, hover, definition, references, documentSymbol, publishDiagnostics);
				return new ClientCapabilities(workspace, textDocument);
			}
		}
	}// @formatter:on

	// ---------------------------
	// Text Documents
	// ---------------------------
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextDocumentIdentifier( // @formatter:off
		@JsonProperty("uri") String uri) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record VersionedTextDocumentIdentifier( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("version") int version) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextDocumentItem( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("languageId") String languageId,
		@JsonProperty("version") int version,
		@JsonProperty("text") String text) {
	} // @formatter:on

	/**
	 * 全量文本替换；不携带{@code range}。
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextDocumentContentChangeEvent( // @formatter:off
		@JsonProperty("text") String text) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DidOpenTextDocumentParams( // @formatter:off
		@JsonProperty("textDocument") TextDocumentItem textDocument) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DidChangeTextDocumentParams( // @formatter:off
		@JsonProperty("textDocument") VersionedTextDocumentIdentifier textDocument,
		@JsonProperty("contentChanges") List<TextDocumentContentChangeEvent> contentChanges) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DidCloseTextDocumentParams( // @formatter:off
		@JsonProperty("textDocument") TextDocumentIdentifier textDocument) {
	} // @formatter:on

	// ---------------------------
	// Language Features
	// ---------------------------
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Position( // @formatter:off
		@JsonProperty("line") int line,
		@JsonProperty("character") int character) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Range( // @formatter:off
		@JsonProperty("start") Position start,
		@JsonProperty("end") Position end) {
	} // @formatter:on

	/**
	 * completion、hover和definition请求共用的参数。
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextDocumentPositionParams( // @formatter:off
		@JsonProperty("textDocument") TextDocumentIdentifier textDocument,
		@JsonProperty("position") Position position) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ReferenceContext( // @formatter:off
		@JsonProperty("includeDeclaration") boolean includeDeclaration) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ReferenceParams( // @formatter:off
		@JsonProperty("textDocument") TextDocumentIdentifier textDocument,
		@JsonProperty("position") Position position,
		@JsonProperty("context") ReferenceContext context) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DocumentSymbolParams( // @formatter:off
		@JsonProperty("textDocument") TextDocumentIdentifier textDocument) {
	} // @formatter:on

	// ---------------------------
	// Diagnostics
	// ---------------------------
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record PublishDiagnosticsParams( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("version") Integer version,
		@JsonProperty("diagnostics") List<Diagnostic> diagnostics) {

		public PublishDiagnosticsParams {
			diagnostics = diagnostics != null ? Collections.unmodifiableList(new ArrayList<>(diagnostics)) : List.of();
		}
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Diagnostic( // @formatter:off
		@JsonProperty("range") Range range,
		@JsonProperty("severity") Integer severity,
		@JsonProperty("code") Object code,
		@JsonProperty("codeDescription") Object codeDescription,
		@JsonProperty("source") String source,
		@JsonProperty("message") String message,
		@JsonProperty("tags") List<Integer> tags,
		@JsonProperty("relatedInformation") List<Object> relatedInformation,
		@JsonProperty("data") Object data) {

		public Diagnostic(Range range, Integer severity, String source, String message) {
			this(range, severity, null, null, source, message, null, null, null);
		}
	} // @formatter:on

	// ---------------------------
	// Server-initiated
	// ---------------------------
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ConfigurationParams( // @formatter:off
		@JsonProperty("items") List<ConfigurationItem> items) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ConfigurationItem( // @formatter:off
		@JsonProperty("scopeUri") String scopeUri,
		@JsonProperty("section") String section) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record LogMessageParams( // @formatter:off
		@JsonProperty("type") int type,
		@JsonProperty("message") String message) {
	} // @formatter:on

}
