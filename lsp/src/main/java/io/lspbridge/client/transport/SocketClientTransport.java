/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.spec.LspTransportException;
import io.lspbridge.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 先启动服务器进程，等待一段固定的稳定时间，再通过TCP连接到服务器监听端口的传输。
 * 进程的标准输出不参与协议，直接丢弃。
 *
 * <p>
 * 这类服务器在收到{@code shutdown}后会自行断开连接，因此不发送{@code exit}通知。
 */
public class SocketClientTransport extends AbstractProcessClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(SocketClientTransport.class);

	private volatile Socket socket;

	public SocketClientTransport(ServerParameters params) {
		this(params, new ObjectMapper());
	}

	public SocketClientTransport(ServerParameters params, ObjectMapper objectMapper) {
		super(params, objectMapper);
		Assert.isTrue(params.isSocket(), "Socket transport requires a port");
	}

	@Override
	protected void configureProcess(ProcessBuilder processBuilder) {
		processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
	}

	@Override
	protected Channel openChannel(Process process) {
		String endpoint = this.params.getHost() + ":" + this.params.getPort();
		try {
			Thread.sleep(this.params.getSettleDelay().toMillis());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LspTransportException("Interrupted while waiting for server at " + endpoint, e);
		}

		Socket connected = new Socket();
		try {
			connected.connect(new InetSocketAddress(this.params.getHost(), this.params.getPort()));
			this.socket = connected;
			logger.info("Connected to language server at {}", endpoint);
			return new Channel(connected.getInputStream(), connected.getOutputStream());
		}
		catch (IOException e) {
			closeQuietly(connected);
			throw new LspTransportException("Failed to connect to server at " + endpoint + ": " + e.getMessage(), e);
		}
	}

	@Override
	protected void closeChannel() {
		Socket current = this.socket;
		if (current != null) {
			closeQuietly(current);
		}
	}

	@Override
	public boolean requiresExitNotification() {
		return false;
	}

	private static void closeQuietly(Socket socket) {
		try {
			socket.close();
		}
		catch (IOException e) {
			logger.debug("Error closing socket: {}", e.getMessage());
		}
	}

}
