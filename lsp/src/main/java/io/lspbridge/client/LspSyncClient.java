/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client;

import java.time.Duration;
import java.util.function.Consumer;

import io.lspbridge.spec.LspSchema;
import io.lspbridge.spec.LspSchema.ClientCapabilities;
import io.lspbridge.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 语言服务器协议的同步客户端，通过阻塞包装{@link LspAsyncClient}。
 *
 * <p>
 * 功能请求在服务器返回{@code null}时返回{@code null}。错误以{@link io.lspbridge.spec.LspError}
 * 及其子类型抛出。
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see LspClient
 * @see LspAsyncClient
 */
public class LspSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LspSyncClient.class);

	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final LspAsyncClient delegate;

	LspSyncClient(LspAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	public LspSchema.InitializeResult getServerCapabilities() {
		return this.delegate.getServerCapabilities();
	}

	public ClientCapabilities getClientCapabilities() {
		return this.delegate.getClientCapabilities();
	}

	public LspSchema.Implementation getClientInfo() {
		return this.delegate.getClientInfo();
	}

	public LspAsyncClient.State getState() {
		return this.delegate.getState();
	}

	public TextDocumentSession getDocuments() {
		return this.delegate.getDocuments();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	public LspSchema.InitializeResult initialize() {
		// 核心不设握手超时，需要时限时在构建器中设置requestTimeout
		return this.delegate.initialize().block();
	}

	public void openDocument(String uri, String languageId, String text) {
		this.delegate.openDocument(uri, languageId, text).block();
	}

	public void changeDocument(String uri, String text) {
		this.delegate.changeDocument(uri, text).block();
	}

	public void closeDocument(String uri) {
		this.delegate.closeDocument(uri).block();
	}

	public Object completion(String uri, int line, int character) {
		return this.delegate.completion(uri, line, character).block();
	}

	public Object hover(String uri, int line, int character) {
		return this.delegate.hover(uri, line, character).block();
	}

	public Object definition(String uri, int line, int character) {
		return this.delegate.definition(uri, line, character).block();
	}

	public Object references(String uri, int line, int character) {
		return this.delegate.references(uri, line, character).block();
	}

	public Object references(String uri, int line, int character, boolean includeDeclaration) {
		return this.delegate.references(uri, line, character, includeDeclaration).block();
	}

	public Object documentSymbols(String uri) {
		return this.delegate.documentSymbols(uri).block();
	}

	public void onDiagnostics(Consumer<LspSchema.PublishDiagnosticsParams> handler) {
		this.delegate.onDiagnostics(handler);
	}

}
