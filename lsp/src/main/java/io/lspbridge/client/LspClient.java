/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.lspbridge.spec.LspClientTransport;
import io.lspbridge.spec.LspSchema.ClientCapabilities;
import io.lspbridge.spec.LspSchema.Implementation;
import io.lspbridge.spec.LspSchema.WorkspaceFolder;
import io.lspbridge.util.Assert;

/**
 * 创建语言服务器客户端的工厂类。提供构建同步与异步客户端的构建器。
 *
 * <p>
 * 同步客户端示例：<pre>{@code
 * LspSyncClient client = LspClient.sync(new StdioClientTransport(params))
 *     .rootUri("file:///work/project")
 *     .build();
 *
 * client.initialize();
 * client.openDocument("file:///work/project/a.ts", "typescript", "let x = 1");
 * Object hover = client.hover("file:///work/project/a.ts", 0, 4);
 * client.closeGracefully();
 * }</pre>
 *
 * <p>
 * 异步客户端示例：<pre>{@code
 * LspAsyncClient client = LspClient.async(transport)
 *     .rootUri(rootUri)
 *     .requestTimeout(Duration.ofSeconds(30))
 *     .build();
 *
 * client.initialize()
 *     .then(client.openDocument(uri, "rust", text))
 *     .then(client.documentSymbols(uri))
 *     .subscribe(symbols -> ...);
 * }</pre>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see LspAsyncClient
 * @see LspSyncClient
 */
public interface LspClient {

	Implementation DEFAULT_CLIENT_INFO = new Implementation("lsp-bridge", "0.1.0");

	Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

	/**
	 * 开始构建同步客户端。
	 * @param transport 传输层
	 * @return 构建器
	 */
	static SyncSpec sync(LspClientTransport transport) {
		return new SyncSpec(transport);
	}

	/**
	 * 开始构建异步客户端。
	 * @param transport 传输层
	 * @return 构建器
	 */
	static AsyncSpec async(LspClientTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * 同步客户端构建器。
	 */
	class SyncSpec {

		private final AsyncSpec delegate;

		private SyncSpec(LspClientTransport transport) {
			this.delegate = new AsyncSpec(transport);
		}

		public SyncSpec rootUri(String rootUri) {
			this.delegate.rootUri(rootUri);
			return this;
		}

		public SyncSpec workspaceFolders(List<WorkspaceFolder> workspaceFolders) {
			this.delegate.workspaceFolders(workspaceFolders);
			return this;
		}

		public SyncSpec capabilities(ClientCapabilities capabilities) {
			this.delegate.capabilities(capabilities);
			return this;
		}

		public SyncSpec clientInfo(Implementation clientInfo) {
			this.delegate.clientInfo(clientInfo);
			return this;
		}

		public SyncSpec requestTimeout(Duration requestTimeout) {
			this.delegate.requestTimeout(requestTimeout);
			return this;
		}

		public SyncSpec shutdownTimeout(Duration shutdownTimeout) {
			this.delegate.shutdownTimeout(shutdownTimeout);
			return this;
		}

		public LspSyncClient build() {
			return new LspSyncClient(this.delegate.build());
		}

	}

	/**
	 * 异步客户端构建器。
	 */
	class AsyncSpec {

		private final LspClientTransport transport;

		private String rootUri;

		private List<WorkspaceFolder> workspaceFolders;

		private ClientCapabilities capabilities = ClientCapabilities.defaults();

		private Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private Duration requestTimeout;

		private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

		private AsyncSpec(LspClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * 工作区根URI。未设置工作区文件夹时，以它作为唯一的文件夹。
		 */
		public AsyncSpec rootUri(String rootUri) {
			Assert.hasText(rootUri, "Root URI must not be empty");
			this.rootUri = rootUri;
			return this;
		}

		public AsyncSpec workspaceFolders(List<WorkspaceFolder> workspaceFolders) {
			Assert.notNull(workspaceFolders, "Workspace folders must not be null");
			this.workspaceFolders = new ArrayList<>(workspaceFolders);
			return this;
		}

		public AsyncSpec capabilities(ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public AsyncSpec clientInfo(Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		/**
		 * 为每个请求设置超时。默认不设超时。
		 */
		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * 关闭时等待{@code shutdown}响应的最长时间，默认5秒。
		 */
		public AsyncSpec shutdownTimeout(Duration shutdownTimeout) {
			Assert.notNull(shutdownTimeout, "Shutdown timeout must not be null");
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		public LspAsyncClient build() {
			return new LspAsyncClient(this.transport, this.requestTimeout, this.shutdownTimeout, this.rootUri,
					this.workspaceFolders, this.capabilities, this.clientInfo);
		}

	}

}
