/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.server;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.bridge.BackendOptions;
import io.lspbridge.bridge.BridgeSchema;
import io.lspbridge.bridge.LspBridge;
import io.lspbridge.bridge.LspBridgeException;
import io.lspbridge.util.Assert;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 以JSON over HTTP暴露{@link LspBridge}的Servlet。
 *
 * <p>
 * 路由：
 * <ul>
 * <li>{@code POST /start}、{@code POST /stop}、{@code GET /status}</li>
 * <li>{@code POST /document/open}、{@code /document/change}、{@code /document/close}</li>
 * <li>{@code POST /completion}、{@code /hover}、{@code /definition}、{@code /references}、{@code /symbols}</li>
 * <li>{@code GET /diagnostics}、{@code DELETE /diagnostics}</li>
 * </ul>
 * 失败时返回{@code {"error": ..., "kind": ...}}，调用方错误为400，其余为500。
 * 所有应答都允许任意来源跨域访问。
 *
 * <p>
 * 语言服务器调用在Servlet线程上阻塞完成。
 */
@WebServlet
public class HttpServletLspBridgeServer extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletLspBridgeServer.class);

	public static final String UTF_8 = "UTF-8";

	public static final String APPLICATION_JSON = "application/json";

	public static final String FAILED_TO_SEND_ERROR_RESPONSE = "Failed to send error response: {}";

	private final LspBridge bridge;

	private final ObjectMapper objectMapper;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	public HttpServletLspBridgeServer(LspBridge bridge, ObjectMapper objectMapper) {
		Assert.notNull(bridge, "Bridge must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.bridge = bridge;
		this.objectMapper = objectMapper;
	}

	public LspBridge getBridge() {
		return this.bridge;
	}

	@Override
	protected void service(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		response.setHeader("Access-Control-Allow-Origin", "*");
		response.setHeader("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
		response.setHeader("Access-Control-Allow-Headers", "Content-Type");
		if (this.isClosing.get() && !"OPTIONS".equals(request.getMethod())) {
			response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}
		super.service(request, response);
	}

	@Override
	protected void doOptions(HttpServletRequest request, HttpServletResponse response) {
		response.setStatus(HttpServletResponse.SC_NO_CONTENT);
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		String path = routePath(request);
		switch (path) {
			case "/status" -> handle(response, () -> this.bridge.status());
			case "/diagnostics" ->
				handle(response, () -> new BridgeSchema.DiagnosticsResponse(this.bridge.getDiagnostics()));
			default -> sendNotFound(response, "GET", path);
		}
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response) throws IOException {
		String path = routePath(request);
		if ("/diagnostics".equals(path)) {
			handle(response, () -> {
				this.bridge.clearDiagnostics();
				return BridgeSchema.SuccessResponse.OK;
			});
		}
		else {
			sendNotFound(response, "DELETE", path);
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
		String path = routePath(request);
		switch (path) {
			case "/start" -> handle(response, () -> {
				BackendOptions options = readBody(request, BackendOptions.class);
				return new BridgeSchema.StartResponse(this.bridge.start(options));
			});
			case "/stop" -> handle(response, () -> {
				this.bridge.stop();
				return BridgeSchema.SuccessResponse.OK;
			});
			case "/document/open" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.DocumentOpenRequest.class).validate();
				this.bridge.openDocument(body.uri(), body.languageId(), body.text());
				return BridgeSchema.SuccessResponse.OK;
			});
			case "/document/change" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.DocumentChangeRequest.class).validate();
				this.bridge.changeDocument(body.uri(), body.text());
				return BridgeSchema.SuccessResponse.OK;
			});
			case "/document/close" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.DocumentCloseRequest.class).validate();
				this.bridge.closeDocument(body.uri());
				return BridgeSchema.SuccessResponse.OK;
			});
			case "/completion" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
				return new BridgeSchema.CompletionResponse(
						this.bridge.completion(body.uri(), body.line(), body.character()));
			});
			case "/hover" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
				return new BridgeSchema.HoverResponse(this.bridge.hover(body.uri(), body.line(), body.character()));
			});
			case "/definition" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
				return new BridgeSchema.LocationsResponse(
						this.bridge.definition(body.uri(), body.line(), body.character()));
			});
			case "/references" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.ReferencesRequest.class).validate();
				return new BridgeSchema.LocationsResponse(this.bridge.references(body.uri(), body.line(),
						body.character(), body.includeDeclarationOrDefault()));
			});
			case "/symbols" -> handle(response, () -> {
				var body = readBody(request, BridgeSchema.SymbolsRequest.class).validate();
				return new BridgeSchema.SymbolsResponse(this.bridge.documentSymbols(body.uri()));
			});
			default -> sendNotFound(response, "POST", path);
		}
	}

	@FunctionalInterface
	private interface RouteHandler {

		Object handle() throws IOException;

	}

	private void handle(HttpServletResponse response, RouteHandler handler) throws IOException {
		Object result;
		try {
			result = handler.handle();
		}
		catch (JsonProcessingException e) {
			sendError(response, LspBridgeException.invalidRequest("Invalid JSON body: " + e.getOriginalMessage()));
			return;
		}
		catch (RuntimeException e) {
			sendError(response, LspBridgeException.from(e));
			return;
		}
		writeJson(response, HttpServletResponse.SC_OK, result);
	}

	private <T> T readBody(HttpServletRequest request, Class<T> type) throws IOException {
		BufferedReader reader = request.getReader();
		StringBuilder body = new StringBuilder();
		String line;
		while ((line = reader.readLine()) != null) {
			body.append(line);
		}
		String json = body.toString().isBlank() ? "{}" : body.toString();
		T value = this.objectMapper.readValue(json, type);
		if (value == null) {
			throw LspBridgeException.invalidRequest("Request body must be a JSON object");
		}
		return value;
	}

	private void sendNotFound(HttpServletResponse response, String method, String path) throws IOException {
		writeJson(response, HttpServletResponse.SC_NOT_FOUND,
				new BridgeSchema.ErrorResponse("Route " + method + " " + path + " not found",
						LspBridgeException.ErrorKind.INVALID_REQUEST));
	}

	private void sendError(HttpServletResponse response, LspBridgeException error) throws IOException {
		int status = error.getKind().isClientError() ? HttpServletResponse.SC_BAD_REQUEST
				: HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
		if (status == HttpServletResponse.SC_INTERNAL_SERVER_ERROR) {
			logger.error("Bridge call failed: {}", error.getMessage(), error);
		}
		else {
			logger.debug("Bridge call rejected: {}", error.getMessage());
		}
		try {
			writeJson(response, status, BridgeSchema.ErrorResponse.of(error));
		}
		catch (IOException ex) {
			logger.error(FAILED_TO_SEND_ERROR_RESPONSE, ex.getMessage());
			response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Error processing request");
		}
	}

	private void writeJson(HttpServletResponse response, int status, Object body) throws IOException {
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.setStatus(status);
		String json = this.objectMapper.writeValueAsString(body);
		PrintWriter writer = response.getWriter();
		writer.write(json);
		writer.flush();
	}

	private static String routePath(HttpServletRequest request) {
		String path = request.getRequestURI().substring(request.getContextPath().length());
		if (path.length() > 1 && path.endsWith("/")) {
			path = path.substring(0, path.length() - 1);
		}
		return path;
	}

	@Override
	public void destroy() {
		if (this.isClosing.compareAndSet(false, true)) {
			logger.debug("Servlet destroyed, stopping bridge");
			this.bridge.close();
		}
		super.destroy();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private ObjectMapper objectMapper = new ObjectMapper();

		private LspBridge bridge;

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder bridge(LspBridge bridge) {
			Assert.notNull(bridge, "Bridge must not be null");
			this.bridge = bridge;
			return this;
		}

		public HttpServletLspBridgeServer build() {
			return new HttpServletLspBridgeServer(this.bridge != null ? this.bridge : new LspBridge(),
					this.objectMapper);
		}

	}

}
