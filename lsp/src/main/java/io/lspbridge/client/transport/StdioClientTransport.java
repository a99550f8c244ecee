/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.spec.LspTransportException;

/**
 * 通过服务器进程的标准输入输出交换LSP帧的传输。进程的stderr只用于诊断日志。
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public class StdioClientTransport extends AbstractProcessClientTransport {

	/**
	 * 使用指定参数和默认ObjectMapper创建新的StdioClientTransport。
	 * @param params 用于配置服务器进程的参数
	 */
	public StdioClientTransport(ServerParameters params) {
		this(params, new ObjectMapper());
	}

	/**
	 * 使用指定参数和ObjectMapper创建新的StdioClientTransport。
	 * @param params 用于配置服务器进程的参数
	 * @param objectMapper 用于JSON序列化/反序列化的ObjectMapper
	 */
	public StdioClientTransport(ServerParameters params, ObjectMapper objectMapper) {
		super(params, objectMapper);
	}

	@Override
	protected Channel openChannel(Process process) {
		if (process.getInputStream() == null || process.getOutputStream() == null) {
			throw new LspTransportException("Process input or output stream is null");
		}
		return new Channel(process.getInputStream(), process.getOutputStream());
	}

}
