/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import io.lspbridge.spec.LspClientSession;
import io.lspbridge.spec.LspClientSession.NotificationHandler;
import io.lspbridge.spec.LspClientSession.RequestHandler;
import io.lspbridge.spec.LspClientTransport;
import io.lspbridge.spec.LspError;
import io.lspbridge.spec.LspSchema;
import io.lspbridge.spec.LspSchema.ClientCapabilities;
import io.lspbridge.spec.LspSchema.Implementation;
import io.lspbridge.spec.LspSchema.InitializeResult;
import io.lspbridge.spec.LspSchema.PublishDiagnosticsParams;
import io.lspbridge.spec.LspSchema.WorkspaceFolder;
import io.lspbridge.spec.SessionNotStartedException;
import io.lspbridge.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * 语言服务器协议的异步客户端，使用Project Reactor的Mono类型提供非阻塞操作。
 *
 * <p>
 * 客户端按以下状态推进：{@link State#UNSTARTED} → {@link State#HANDSHAKING} →
 * {@link State#READY} → {@link State#SHUTTING_DOWN} → {@link State#CLOSED}。
 * 它负责：
 * <ul>
 * <li>{@code initialize}/{@code initialized}握手，并保存服务器能力快照</li>
 * <li>文档同步：打开、全文变更、关闭，并维护本地文档版本</li>
 * <li>功能请求：补全、悬停、定义、引用和文档符号，结果原样透传</li>
 * <li>把{@code textDocument/publishDiagnostics}转发给唯一的诊断处理器</li>
 * <li>自动应答服务器发起的配置查询、动态注册和进度令牌创建请求</li>
 * <li>尽力而为的{@code shutdown}/{@code exit}关闭流程</li>
 * </ul>
 *
 * <p>
 * 任何传输失败都会使客户端进入{@link State#CLOSED}，所有未完成的请求都会被拒绝。
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see LspClient
 * @see LspClientSession
 */
public class LspAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(LspAsyncClient.class);

	private static final TypeReference<Void> VOID_TYPE_REFERENCE = new TypeReference<>() {
	};

	private static final TypeReference<Object> OBJECT_TYPE_REFERENCE = new TypeReference<>() {
	};

	private static final TypeReference<InitializeResult> INITIALIZE_RESULT_TYPE_REFERENCE = new TypeReference<>() {
	};

	private static final Duration EXIT_NOTIFICATION_DELAY = Duration.ofMillis(100);

	/**
	 * 连接状态。
	 */
	public enum State {

		UNSTARTED, HANDSHAKING, READY, SHUTTING_DOWN, CLOSED

	}

	private final AtomicReference<State> state = new AtomicReference<>(State.UNSTARTED);

	private final LspClientSession session;

	private final LspClientTransport transport;

	private final ClientCapabilities clientCapabilities;

	private final Implementation clientInfo;

	@Nullable
	private final String rootUri;

	@Nullable
	private final List<WorkspaceFolder> workspaceFolders;

	private final Duration shutdownTimeout;

	private final TextDocumentSession documents = new TextDocumentSession();

	/** 唯一的诊断处理器，注册新的处理器会替换旧的 */
	private final AtomicReference<Consumer<PublishDiagnosticsParams>> diagnosticsHandler = new AtomicReference<>();

	private volatile InitializeResult serverCapabilities;

	/**
	 * 创建新的LspAsyncClient。
	 * @param transport 传输层
	 * @param requestTimeout 单个请求的超时，为null时不限时
	 * @param shutdownTimeout 等待{@code shutdown}响应的最长时间
	 * @param rootUri 工作区根URI
	 * @param workspaceFolders 工作区文件夹，为null时使用以rootUri为根的单个文件夹
	 * @param clientCapabilities 客户端能力
	 * @param clientInfo 客户端信息
	 */
	LspAsyncClient(LspClientTransport transport, @Nullable Duration requestTimeout, Duration shutdownTimeout,
			@Nullable String rootUri, @Nullable List<WorkspaceFolder> workspaceFolders,
			ClientCapabilities clientCapabilities, Implementation clientInfo) {

		Assert.notNull(transport, "Transport must not be null");
		Assert.notNull(shutdownTimeout, "Shutdown timeout must not be null");
		Assert.notNull(clientCapabilities, "Client capabilities must not be null");
		Assert.notNull(clientInfo, "Client info must not be null");

		this.transport = transport;
		this.shutdownTimeout = shutdownTimeout;
		this.rootUri = rootUri;
		this.clientCapabilities = clientCapabilities;
		this.clientInfo = clientInfo;
		if (workspaceFolders != null) {
			this.workspaceFolders = List.copyOf(workspaceFolders);
		}
		else if (rootUri != null) {
			this.workspaceFolders = List.of(new WorkspaceFolder(rootUri, "workspace"));
		}
		else {
			this.workspaceFolders = null;
		}

		// Request Handlers
		Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();
		requestHandlers.put(LspSchema.METHOD_WORKSPACE_CONFIGURATION, workspaceConfigurationRequestHandler());
		requestHandlers.put(LspSchema.METHOD_CLIENT_REGISTER_CAPABILITY, params -> Mono.fromRunnable(
				() -> logger.debug("Accepting dynamic capability registration: {}", params)));
		requestHandlers.put(LspSchema.METHOD_WORK_DONE_PROGRESS_CREATE,
				params -> Mono.fromRunnable(() -> logger.debug("Accepting progress token: {}", params)));

		// Notification Handlers
		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();
		notificationHandlers.put(LspSchema.METHOD_NOTIFICATION_PUBLISH_DIAGNOSTICS, diagnosticsNotificationHandler());
		notificationHandlers.put(LspSchema.METHOD_NOTIFICATION_LOG_MESSAGE, messageNotificationHandler());
		notificationHandlers.put(LspSchema.METHOD_NOTIFICATION_SHOW_MESSAGE, messageNotificationHandler());

		this.session = new LspClientSession(requestTimeout, transport, requestHandlers, notificationHandlers);
		this.session.setCloseListener(this::handleConnectionClosed);
	}

	/**
	 * 获取服务器在握手时声明的能力。
	 * @return 能力快照；握手完成前为{@code null}
	 */
	@Nullable
	public InitializeResult getServerCapabilities() {
		return this.serverCapabilities;
	}

	public ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	public Implementation getClientInfo() {
		return this.clientInfo;
	}

	@Nullable
	public String getRootUri() {
		return this.rootUri;
	}

	public State getState() {
		return this.state.get();
	}

	public boolean isInitialized() {
		return this.state.get() == State.READY;
	}

	/**
	 * 已打开文档的本地记录。
	 */
	public TextDocumentSession getDocuments() {
		return this.documents;
	}

	/**
	 * 立即关闭连接，不执行shutdown握手。
	 */
	public void close() {
		this.state.set(State.CLOSED);
		this.documents.clear();
		this.session.close();
	}

	/**
	 * 优雅地关闭连接。处于{@link State#READY}时先发送{@code shutdown}请求并等待响应，
	 * 其失败或超时都被忽略；对于需要的传输随后发送{@code exit}通知；最后关闭传输。
	 * 已经关闭时不做任何事情。
	 * @return 关闭完成时完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			State previous = this.state.get();
			if (previous == State.CLOSED || previous == State.SHUTTING_DOWN
					|| !this.state.compareAndSet(previous, State.SHUTTING_DOWN)) {
				return Mono.empty();
			}
			logger.debug("Closing client in state {}", previous);
			Mono<Void> handshake = previous == State.READY ? shutdownHandshake() : Mono.empty();
			return handshake.then(this.session.closeGracefully()).doFinally(signal -> {
				this.state.set(State.CLOSED);
				this.documents.clear();
			});
		});
	}

	private Mono<Void> shutdownHandshake() {
		Mono<Void> shutdown = this.session.sendRequest(LspSchema.METHOD_SHUTDOWN, null, VOID_TYPE_REFERENCE)
			.timeout(this.shutdownTimeout)
			.onErrorResume(error -> {
				logger.warn("Shutdown request failed, closing anyway: {}", error.getMessage());
				return Mono.empty();
			});
		if (!this.transport.requiresExitNotification()) {
			return shutdown;
		}
		return shutdown.then(Mono.delay(EXIT_NOTIFICATION_DELAY))
			.then(this.session.sendNotification(LspSchema.METHOD_NOTIFICATION_EXIT).onErrorResume(error -> {
				logger.debug("Exit notification not delivered: {}", error.getMessage());
				return Mono.empty();
			}));
	}

	private void handleConnectionClosed(@Nullable Throwable cause) {
		State previous = this.state.getAndSet(State.CLOSED);
		this.documents.clear();
		if (cause != null && previous != State.SHUTTING_DOWN && previous != State.CLOSED) {
			logger.error("Connection to language server closed in state {}: {}", previous, cause.getMessage());
		}
	}

	// --------------------------
	// Initialization
	// --------------------------
	/**
	 * 打开传输并执行初始化握手。成功后客户端进入{@link State#READY}。
	 *
	 * <p>
	 * 核心不为握手施加超时；若需要时限，调用方应自行包装返回的Mono，
	 * 或通过构建器设置请求超时。握手失败时传输被关闭，客户端进入{@link State#CLOSED}。
	 * @return 服务器返回的{@link InitializeResult}
	 * @see <a href=
	 * "https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#initialize">Initialize
	 * Request</a>
	 */
	public Mono<InitializeResult> initialize() {
		return Mono.defer(() -> {
			if (!this.state.compareAndSet(State.UNSTARTED, State.HANDSHAKING)) {
				return Mono.error(new LspError("Client cannot be initialized in state " + this.state.get()));
			}

			LspSchema.InitializeParams initializeParams = new LspSchema.InitializeParams(// @formatter:off
					ProcessHandle.current().pid(),
					this.clientInfo,
					this.rootUri,
					this.clientCapabilities,
					this.workspaceFolders); // @formatter:on

			return this.session.connect()
				.then(this.session.sendRequest(LspSchema.METHOD_INITIALIZE, initializeParams,
						INITIALIZE_RESULT_TYPE_REFERENCE))
				.switchIfEmpty(Mono.error(() -> new LspError("Server returned an empty initialize result")))
				.flatMap(initializeResult -> {
					this.serverCapabilities = initializeResult;
					logger.info("Server response with Capabilities: {} and Info: {}",
							initializeResult.capabilities().keySet(), initializeResult.serverInfo());
					return this.session.sendNotification(LspSchema.METHOD_NOTIFICATION_INITIALIZED, Map.of())
						.thenReturn(initializeResult);
				})
				.doOnSuccess(initializeResult -> {
					if (!this.state.compareAndSet(State.HANDSHAKING, State.READY)) {
						logger.warn("Connection closed during handshake");
					}
				})
				.doOnError(error -> {
					logger.error("Initialization failed: {}", error.getMessage());
					close();
				});
		});
	}

	private <T> Mono<T> withReadyCheck(String actionName, Supplier<Mono<T>> operation) {
		return Mono.defer(() -> {
			if (this.state.get() != State.READY) {
				return Mono.error(new SessionNotStartedException(actionName));
			}
			return operation.get();
		});
	}

	// --------------------------
	// Document Synchronization
	// --------------------------

	/**
	 * 以版本1打开文档并发送{@code textDocument/didOpen}通知。
	 * 该URI已打开时以{@link io.lspbridge.spec.DocumentAlreadyOpenException}失败，且不发送通知。
	 * @param uri 文档URI
	 * @param languageId 语言标识
	 * @param text 文档全文
	 * @return 通知发送完成时完成的Mono
	 */
	public Mono<Void> openDocument(String uri, String languageId, String text) {
		return withReadyCheck("opening a document", () -> {
			TextDocumentSession.DocumentRecord record = this.documents.open(uri, languageId, text);
			var params = new LspSchema.DidOpenTextDocumentParams(
					new LspSchema.TextDocumentItem(record.uri(), record.languageId(), record.version(), record.text()));
			return this.session.sendNotification(LspSchema.METHOD_NOTIFICATION_DID_OPEN, params)
				.doOnError(error -> this.documents.revert(record, null));
		});
	}

	/**
	 * 以全文替换文档内容，版本加1，并发送{@code textDocument/didChange}通知。
	 * @param uri 文档URI
	 * @param text 新的全文
	 * @return 通知发送完成时完成的Mono
	 */
	public Mono<Void> changeDocument(String uri, String text) {
		return withReadyCheck("changing a document", () -> {
			TextDocumentSession.DocumentRecord previous = this.documents.get(uri);
			TextDocumentSession.DocumentRecord record = this.documents.change(uri, text);
			var params = new LspSchema.DidChangeTextDocumentParams(
					new LspSchema.VersionedTextDocumentIdentifier(record.uri(), record.version()),
					List.of(new LspSchema.TextDocumentContentChangeEvent(record.text())));
			return this.session.sendNotification(LspSchema.METHOD_NOTIFICATION_DID_CHANGE, params)
				.doOnError(error -> this.documents.revert(record, previous));
		});
	}

	/**
	 * 删除文档记录并发送{@code textDocument/didClose}通知。
	 * @param uri 文档URI
	 * @return 通知发送完成时完成的Mono
	 */
	public Mono<Void> closeDocument(String uri) {
		return withReadyCheck("closing a document", () -> {
			TextDocumentSession.DocumentRecord record = this.documents.close(uri);
			var params = new LspSchema.DidCloseTextDocumentParams(new LspSchema.TextDocumentIdentifier(record.uri()));
			return this.session.sendNotification(LspSchema.METHOD_NOTIFICATION_DID_CLOSE, params);
		});
	}

	// --------------------------
	// Language Features
	// --------------------------

	/**
	 * 请求给定位置的补全。结果可能是补全列表或条目数组，服务器返回{@code null}时Mono为空。
	 */
	public Mono<Object> completion(String uri, int line, int character) {
		return withReadyCheck("requesting completion",
				() -> this.session.sendRequest(LspSchema.METHOD_COMPLETION, positionParams(uri, line, character),
						OBJECT_TYPE_REFERENCE));
	}

	/**
	 * 请求给定位置的悬停信息。
	 */
	public Mono<Object> hover(String uri, int line, int character) {
		return withReadyCheck("requesting hover", () -> this.session.sendRequest(LspSchema.METHOD_HOVER,
				positionParams(uri, line, character), OBJECT_TYPE_REFERENCE));
	}

	/**
	 * 请求给定位置符号的定义。结果可能是单个位置、位置数组或链接数组。
	 */
	public Mono<Object> definition(String uri, int line, int character) {
		return withReadyCheck("requesting definition", () -> this.session.sendRequest(LspSchema.METHOD_DEFINITION,
				positionParams(uri, line, character), OBJECT_TYPE_REFERENCE));
	}

	/**
	 * 请求给定位置符号的引用，包含声明本身。
	 */
	public Mono<Object> references(String uri, int line, int character) {
		return references(uri, line, character, true);
	}

	public Mono<Object> references(String uri, int line, int character, boolean includeDeclaration) {
		return withReadyCheck("requesting references", () -> {
			var params = new LspSchema.ReferenceParams(new LspSchema.TextDocumentIdentifier(uri),
					new LspSchema.Position(line, character), new LspSchema.ReferenceContext(includeDeclaration));
			return this.session.sendRequest(LspSchema.METHOD_REFERENCES, params, OBJECT_TYPE_REFERENCE);
		});
	}

	/**
	 * 请求文档符号。结果可能是扁平的或层次化的符号数组。
	 */
	public Mono<Object> documentSymbols(String uri) {
		return withReadyCheck("requesting document symbols",
				() -> this.session.sendRequest(LspSchema.METHOD_DOCUMENT_SYMBOL,
						new LspSchema.DocumentSymbolParams(new LspSchema.TextDocumentIdentifier(uri)),
						OBJECT_TYPE_REFERENCE));
	}

	private static LspSchema.TextDocumentPositionParams positionParams(String uri, int line, int character) {
		return new LspSchema.TextDocumentPositionParams(new LspSchema.TextDocumentIdentifier(uri),
				new LspSchema.Position(line, character));
	}

	// --------------------------
	// Diagnostics
	// --------------------------

	/**
	 * 注册诊断处理器。只保留一个处理器，新注册的处理器替换之前的处理器。
	 * 处理器在读取线程上同步调用，不应阻塞。
	 * @param handler 诊断处理器，为null时取消注册
	 */
	public void onDiagnostics(@Nullable Consumer<PublishDiagnosticsParams> handler) {
		this.diagnosticsHandler.set(handler);
	}

	private NotificationHandler diagnosticsNotificationHandler() {
		return params -> Mono.fromRunnable(() -> {
			PublishDiagnosticsParams diagnostics = this.transport.unmarshalFrom(params,
					new TypeReference<PublishDiagnosticsParams>() {
					});
			Consumer<PublishDiagnosticsParams> handler = this.diagnosticsHandler.get();
			if (handler != null) {
				handler.accept(diagnostics);
			}
			else {
				logger.debug("No diagnostics handler registered, dropping diagnostics for {}", diagnostics.uri());
			}
		});
	}

	private NotificationHandler messageNotificationHandler() {
		return params -> Mono.fromRunnable(() -> {
			LspSchema.LogMessageParams message = this.transport.unmarshalFrom(params,
					new TypeReference<LspSchema.LogMessageParams>() {
					});
			switch (message.type()) {
				case LspSchema.MessageType.ERROR -> logger.error("Server: {}", message.message());
				case LspSchema.MessageType.WARNING -> logger.warn("Server: {}", message.message());
				case LspSchema.MessageType.INFO -> logger.info("Server: {}", message.message());
				default -> logger.debug("Server: {}", message.message());
			}
		});
	}

	// --------------------------
	// Server-initiated requests
	// --------------------------

	/**
	 * 为每个请求的配置项返回一个空配置对象。
	 */
	private RequestHandler<List<Map<String, Object>>> workspaceConfigurationRequestHandler() {
		return params -> {
			LspSchema.ConfigurationParams request = this.transport.unmarshalFrom(params,
					new TypeReference<LspSchema.ConfigurationParams>() {
					});
			int count = request.items() != null ? request.items().size() : 0;
			List<Map<String, Object>> configurations = new ArrayList<>(count);
			for (int i = 0; i < count; i++) {
				configurations.add(Map.of());
			}
			return Mono.just(configurations);
		};
	}

}
