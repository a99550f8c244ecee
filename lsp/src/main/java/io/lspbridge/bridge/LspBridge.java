/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import io.lspbridge.client.LspAsyncClient;
import io.lspbridge.client.LspClient;
import io.lspbridge.client.transport.ServerParameters;
import io.lspbridge.client.transport.TransportFactory;
import io.lspbridge.spec.LspClientTransport;
import io.lspbridge.spec.LspSchema.Diagnostic;
import io.lspbridge.spec.LspSchema.InitializeResult;
import io.lspbridge.spec.LspSchema.PublishDiagnosticsParams;
import io.lspbridge.util.Assert;
import io.lspbridge.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * 同一时刻至多管理一个语言服务器会话的桥接器，状态为{@code Idle → Running → Idle}。
 *
 * <p>
 * {@link #start}和{@link #stop}由同一把锁串行化，不会同时存在两个会话；
 * 文档和功能操作读取当前会话的快照，不加锁。所有失败都以{@link LspBridgeException}抛出，
 * 其{@link LspBridgeException.ErrorKind}说明错误类别。
 *
 * <p>
 * 服务器发布的诊断经过一个多播{@link Flux}分发，内置的{@link DiagnosticsBuffer}是其中一个订阅者。
 */
public class LspBridge implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LspBridge.class);

	private static final String NOT_RUNNING = "LSP server not running. Call /start first.";

	private static final String ALREADY_RUNNING = "LSP server already running. Stop it first.";

	private record BridgeSession(String language, LspAsyncClient client, InitializeResult capabilities) {
	}

	private final BackendRegistry registry;

	private final TransportFactory transportFactory;

	@Nullable
	private final Duration requestTimeout;

	private final ReentrantLock lifecycleLock = new ReentrantLock();

	private volatile BridgeSession current;

	private final Sinks.Many<PublishDiagnosticsParams> diagnosticsSink = Sinks.many().multicast().directBestEffort();

	private final DiagnosticsBuffer diagnosticsBuffer = new DiagnosticsBuffer();

	private final Disposable bufferSubscription;

	public LspBridge() {
		this(BackendPresets.defaults(), TransportFactory.DEFAULT, null);
	}

	/**
	 * 创建桥接器。
	 * @param registry 后端注册表
	 * @param transportFactory 传输工厂
	 * @param requestTimeout 每个请求的超时，包括握手；为null时不限时
	 */
	public LspBridge(BackendRegistry registry, TransportFactory transportFactory, @Nullable Duration requestTimeout) {
		Assert.notNull(registry, "Registry must not be null");
		Assert.notNull(transportFactory, "Transport factory must not be null");
		this.registry = registry;
		this.transportFactory = transportFactory;
		this.requestTimeout = requestTimeout;
		this.bufferSubscription = this.diagnosticsSink.asFlux().subscribe(this.diagnosticsBuffer::accept);
	}

	public BackendRegistry getRegistry() {
		return this.registry;
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 启动指定后端并完成握手。所有校验都在启动进程之前完成，依次为：
	 * 是否已在运行、{@code language}、{@code rootUri}、后端是否注册、后端特有的必需字段。
	 * 失败时不保留任何会话状态。
	 * @param options 启动选项
	 * @return 服务器的初始化结果
	 */
	public InitializeResult start(BackendOptions options) {
		Assert.notNull(options, "Options must not be null");
		this.lifecycleLock.lock();
		try {
			if (this.current != null) {
				throw LspBridgeException.precondition(ALREADY_RUNNING);
			}
			if (!Utils.hasText(options.language())) {
				throw LspBridgeException.invalidRequest("language is required");
			}
			if (!Utils.hasText(options.rootUri())) {
				throw LspBridgeException.invalidRequest("rootUri is required");
			}
			BackendPreset preset = this.registry.get(options.language());
			if (preset == null) {
				throw LspBridgeException.configuration("Unsupported language: " + options.language() + ". Supported: "
						+ String.join(", ", this.registry.kinds()));
			}
			ServerParameters params = resolve(preset, options);

			LspClientTransport transport = this.transportFactory.create(params);
			LspClient.AsyncSpec spec = LspClient.async(transport).rootUri(options.rootUri());
			if (this.requestTimeout != null) {
				spec.requestTimeout(this.requestTimeout);
			}
			LspAsyncClient client = spec.build();
			client.onDiagnostics(this::publishDiagnostics);

			InitializeResult result;
			try {
				result = client.initialize().block();
			}
			catch (RuntimeException e) {
				client.onDiagnostics(null);
				client.close();
				throw translate(e);
			}
			this.current = new BridgeSession(options.language(), client, result);
			logger.info("Started {} language server for {}", options.language(), options.rootUri());
			return result;
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	private static ServerParameters resolve(BackendPreset preset, BackendOptions options) {
		try {
			return preset.resolve(options);
		}
		catch (IllegalArgumentException e) {
			throw new LspBridgeException(LspBridgeException.ErrorKind.CONFIGURATION, e.getMessage(), e);
		}
	}

	/**
	 * 停止当前会话并清空诊断缓冲。没有会话时不做任何事情。关闭过程中的错误只记录日志。
	 */
	public void stop() {
		this.lifecycleLock.lock();
		try {
			BridgeSession session = this.current;
			if (session == null) {
				return;
			}
			this.current = null;
			session.client().onDiagnostics(null);
			try {
				session.client().closeGracefully().block();
			}
			catch (RuntimeException e) {
				logger.warn("Error while stopping {} language server", session.language(), e);
			}
			this.diagnosticsBuffer.clear();
			logger.info("Stopped {} language server", session.language());
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	public BridgeSchema.StatusResponse status() {
		BridgeSession session = this.current;
		if (session == null) {
			return BridgeSchema.StatusResponse.IDLE;
		}
		return new BridgeSchema.StatusResponse(true, session.language(), session.capabilities());
	}

	public boolean isRunning() {
		return this.current != null;
	}

	/**
	 * 停止任何活动会话，忽略错误。用于服务器关闭。
	 */
	@Override
	public void close() {
		try {
			stop();
		}
		catch (RuntimeException e) {
			logger.warn("Error while closing bridge", e);
		}
		this.bufferSubscription.dispose();
		this.diagnosticsSink.tryEmitComplete();
	}

	// --------------------------
	// Documents
	// --------------------------

	public void openDocument(String uri, String languageId, String text) {
		call(client -> client.openDocument(uri, languageId, text));
	}

	public void changeDocument(String uri, String text) {
		call(client -> client.changeDocument(uri, text));
	}

	public void closeDocument(String uri) {
		call(client -> client.closeDocument(uri));
	}

	// --------------------------
	// Features
	// --------------------------

	@Nullable
	public Object completion(String uri, int line, int character) {
		return call(client -> client.completion(uri, line, character));
	}

	@Nullable
	public Object hover(String uri, int line, int character) {
		return call(client -> client.hover(uri, line, character));
	}

	@Nullable
	public Object definition(String uri, int line, int character) {
		return call(client -> client.definition(uri, line, character));
	}

	@Nullable
	public Object references(String uri, int line, int character, boolean includeDeclaration) {
		return call(client -> client.references(uri, line, character, includeDeclaration));
	}

	@Nullable
	public Object documentSymbols(String uri) {
		return call(client -> client.documentSymbols(uri));
	}

	private <T> T call(Function<LspAsyncClient, Mono<T>> operation) {
		BridgeSession session = this.current;
		if (session == null) {
			throw LspBridgeException.precondition(NOT_RUNNING);
		}
		try {
			return operation.apply(session.client()).block();
		}
		catch (RuntimeException e) {
			throw translate(e);
		}
	}

	private static LspBridgeException translate(RuntimeException e) {
		return LspBridgeException.from(Exceptions.unwrap(e));
	}

	// --------------------------
	// Diagnostics
	// --------------------------

	/**
	 * 所有URI最近一次发布的诊断。
	 */
	public Map<String, List<Diagnostic>> getDiagnostics() {
		return this.diagnosticsBuffer.getAll();
	}

	public void clearDiagnostics() {
		this.diagnosticsBuffer.clear();
	}

	/**
	 * 订阅诊断推送。订阅之前发布的诊断不会重放。
	 * @return 诊断流
	 */
	public Flux<PublishDiagnosticsParams> diagnostics() {
		return this.diagnosticsSink.asFlux();
	}

	private void publishDiagnostics(PublishDiagnosticsParams params) {
		synchronized (this.diagnosticsSink) {
			Sinks.EmitResult result = this.diagnosticsSink.tryEmitNext(params);
			if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
				logger.warn("Failed to relay diagnostics for {}: {}", params.uri(), result);
			}
		}
	}

}
