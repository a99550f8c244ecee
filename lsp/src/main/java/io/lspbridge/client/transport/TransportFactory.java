/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client.transport;

import io.lspbridge.spec.LspClientTransport;

/**
 * 根据服务器参数创建传输。
 */
@FunctionalInterface
public interface TransportFactory {

	/**
	 * 按参数选择套接字或标准输入输出传输。
	 */
	TransportFactory DEFAULT = params -> params.isSocket() ? new SocketClientTransport(params)
			: new StdioClientTransport(params);

	LspClientTransport create(ServerParameters params);

}
