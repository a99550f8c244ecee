/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import io.lspbridge.spec.DocumentAlreadyOpenException;
import io.lspbridge.spec.DocumentNotOpenException;
import io.lspbridge.spec.LspError;
import io.lspbridge.spec.LspFramingException;
import io.lspbridge.spec.LspTransportException;
import io.lspbridge.spec.SessionNotStartedException;

/**
 * 桥接层对外报告的错误，带有机器可读的{@link ErrorKind}。
 */
public class LspBridgeException extends RuntimeException {

	/**
	 * 错误分类。
	 */
	public enum ErrorKind {

		/** 请求体缺少字段或字段无效 */
		INVALID_REQUEST,

		/** 后端配置缺失或无效，未启动任何进程 */
		CONFIGURATION,

		/** 操作在当前状态下不允许 */
		PRECONDITION,

		/** 进程启动、连接或读写失败 */
		TRANSPORT,

		/** 帧或消息格式错误 */
		PROTOCOL,

		/** 语言服务器以错误应答 */
		REMOTE,

		INTERNAL;

		/**
		 * 是否归咎于调用方。
		 */
		public boolean isClientError() {
			return this == INVALID_REQUEST || this == CONFIGURATION || this == PRECONDITION;
		}

	}

	private final ErrorKind kind;

	public LspBridgeException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public LspBridgeException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return this.kind;
	}

	public static LspBridgeException invalidRequest(String message) {
		return new LspBridgeException(ErrorKind.INVALID_REQUEST, message);
	}

	public static LspBridgeException configuration(String message) {
		return new LspBridgeException(ErrorKind.CONFIGURATION, message);
	}

	public static LspBridgeException precondition(String message) {
		return new LspBridgeException(ErrorKind.PRECONDITION, message);
	}

	/**
	 * 把客户端层的异常归类。
	 * @param error 任意异常
	 * @return 对应的桥接异常
	 */
	public static LspBridgeException from(Throwable error) {
		if (error instanceof LspBridgeException bridgeException) {
			return bridgeException;
		}
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		ErrorKind kind;
		if (error instanceof SessionNotStartedException || error instanceof DocumentNotOpenException
				|| error instanceof DocumentAlreadyOpenException) {
			kind = ErrorKind.PRECONDITION;
		}
		else if (error instanceof LspFramingException) {
			kind = ErrorKind.PROTOCOL;
		}
		else if (error instanceof LspTransportException) {
			kind = ErrorKind.TRANSPORT;
		}
		else if (error instanceof LspError lspError) {
			kind = lspError.getJsonRpcError() != null ? ErrorKind.REMOTE : ErrorKind.PROTOCOL;
		}
		else if (error instanceof IllegalArgumentException) {
			kind = ErrorKind.INVALID_REQUEST;
		}
		else {
			kind = ErrorKind.INTERNAL;
		}
		return new LspBridgeException(kind, message, error);
	}

}
