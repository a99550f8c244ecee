/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import io.lspbridge.client.transport.ServerParameters;

/**
 * 把启动选项解析为具体的服务器进程参数。实现应是无副作用的，
 * 只允许检查文件是否存在；缺少必需字段时抛出{@link LspBridgeException.ErrorKind#CONFIGURATION}错误。
 */
@FunctionalInterface
public interface BackendPreset {

	ServerParameters resolve(BackendOptions options);

}
