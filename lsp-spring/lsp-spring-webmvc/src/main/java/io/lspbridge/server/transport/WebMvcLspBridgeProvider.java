/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.server.transport;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.bridge.BackendOptions;
import io.lspbridge.bridge.BridgeSchema;
import io.lspbridge.bridge.LspBridge;
import io.lspbridge.bridge.LspBridgeException;
import io.lspbridge.util.Assert;
import jakarta.servlet.ServletException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * 基于Spring WebMVC函数式路由暴露{@link LspBridge}。路由和应答格式与
 * {@code HttpServletLspBridgeServer}相同。
 *
 * <p>
 * 使用示例：<pre>{@code
 * @Bean
 * RouterFunction<ServerResponse> lspBridgeRoutes(LspBridge bridge, ObjectMapper objectMapper) {
 *     return new WebMvcLspBridgeProvider(bridge, objectMapper).getRouterFunction();
 * }
 * }</pre>
 */
public class WebMvcLspBridgeProvider {

	private static final Logger logger = LoggerFactory.getLogger(WebMvcLspBridgeProvider.class);

	private final LspBridge bridge;

	private final ObjectMapper objectMapper;

	private final RouterFunction<ServerResponse> routerFunction;

	private volatile boolean isClosing = false;

	@FunctionalInterface
	private interface BridgeCall {

		Object call(ServerRequest request) throws ServletException, IOException;

	}

	public WebMvcLspBridgeProvider(LspBridge bridge, ObjectMapper objectMapper) {
		Assert.notNull(bridge, "Bridge must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");

		this.bridge = bridge;
		this.objectMapper = objectMapper;
		this.routerFunction = RouterFunctions.route()
			.POST("/start", request -> handle(request, this::start))
			.POST("/stop", request -> handle(request, this::stop))
			.GET("/status", request -> handle(request, r -> this.bridge.status()))
			.POST("/document/open", request -> handle(request, this::openDocument))
			.POST("/document/change", request -> handle(request, this::changeDocument))
			.POST("/document/close", request -> handle(request, this::closeDocument))
			.POST("/completion", request -> handle(request, this::completion))
			.POST("/hover", request -> handle(request, this::hover))
			.POST("/definition", request -> handle(request, this::definition))
			.POST("/references", request -> handle(request, this::references))
			.POST("/symbols", request -> handle(request, this::symbols))
			.GET("/diagnostics",
					request -> handle(request, r -> new BridgeSchema.DiagnosticsResponse(this.bridge.getDiagnostics())))
			.DELETE("/diagnostics", request -> handle(request, r -> {
				this.bridge.clearDiagnostics();
				return BridgeSchema.SuccessResponse.OK;
			}))
			.OPTIONS("/**", request -> ServerResponse.noContent().headers(WebMvcLspBridgeProvider::cors).build())
			.build();
	}

	public RouterFunction<ServerResponse> getRouterFunction() {
		return this.routerFunction;
	}

	/**
	 * 停止接受请求并关闭桥接会话。
	 */
	public void close() {
		this.isClosing = true;
		this.bridge.close();
	}

	private ServerResponse handle(ServerRequest request, BridgeCall call) {
		if (this.isClosing) {
			return ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
				.headers(WebMvcLspBridgeProvider::cors)
				.body("Server is shutting down");
		}
		try {
			Object result = call.call(request);
			return ServerResponse.ok()
				.headers(WebMvcLspBridgeProvider::cors)
				.contentType(MediaType.APPLICATION_JSON)
				.body(result);
		}
		catch (JsonProcessingException e) {
			return error(LspBridgeException.invalidRequest("Invalid JSON body: " + e.getOriginalMessage()));
		}
		catch (ServletException | IOException e) {
			return error(new LspBridgeException(LspBridgeException.ErrorKind.INTERNAL, e.getMessage(), e));
		}
		catch (RuntimeException e) {
			return error(LspBridgeException.from(e));
		}
	}

	private ServerResponse error(LspBridgeException error) {
		HttpStatus status = error.getKind().isClientError() ? HttpStatus.BAD_REQUEST
				: HttpStatus.INTERNAL_SERVER_ERROR;
		if (status.is5xxServerError()) {
			logger.error("Bridge call failed: {}", error.getMessage(), error);
		}
		else {
			logger.debug("Bridge call rejected: {}", error.getMessage());
		}
		return ServerResponse.status(status)
			.headers(WebMvcLspBridgeProvider::cors)
			.contentType(MediaType.APPLICATION_JSON)
			.body(BridgeSchema.ErrorResponse.of(error));
	}

	private static void cors(HttpHeaders headers) {
		headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
		headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, DELETE, OPTIONS");
		headers.set(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
	}

	private <T> T readBody(ServerRequest request, Class<T> type) throws ServletException, IOException {
		String body = request.body(String.class);
		T value = this.objectMapper.readValue(body == null || body.isBlank() ? "{}" : body, type);
		if (value == null) {
			throw LspBridgeException.invalidRequest("Request body must be a JSON object");
		}
		return value;
	}

	private Object start(ServerRequest request) throws ServletException, IOException {
		BackendOptions options = readBody(request, BackendOptions.class);
		return new BridgeSchema.StartResponse(this.bridge.start(options));
	}

	private Object stop(ServerRequest request) {
		this.bridge.stop();
		return BridgeSchema.SuccessResponse.OK;
	}

	private Object openDocument(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.DocumentOpenRequest.class).validate();
		this.bridge.openDocument(body.uri(), body.languageId(), body.text());
		return BridgeSchema.SuccessResponse.OK;
	}

	private Object changeDocument(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.DocumentChangeRequest.class).validate();
		this.bridge.changeDocument(body.uri(), body.text());
		return BridgeSchema.SuccessResponse.OK;
	}

	private Object closeDocument(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.DocumentCloseRequest.class).validate();
		this.bridge.closeDocument(body.uri());
		return BridgeSchema.SuccessResponse.OK;
	}

	private Object completion(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
		return new BridgeSchema.CompletionResponse(this.bridge.completion(body.uri(), body.line(), body.character()));
	}

	private Object hover(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
		return new BridgeSchema.HoverResponse(this.bridge.hover(body.uri(), body.line(), body.character()));
	}

	private Object definition(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.PositionRequest.class).validate();
		return new BridgeSchema.LocationsResponse(this.bridge.definition(body.uri(), body.line(), body.character()));
	}

	private Object references(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.ReferencesRequest.class).validate();
		return new BridgeSchema.LocationsResponse(this.bridge.references(body.uri(), body.line(), body.character(),
				body.includeDeclarationOrDefault()));
	}

	private Object symbols(ServerRequest request) throws ServletException, IOException {
		var body = readBody(request, BridgeSchema.SymbolsRequest.class).validate();
		return new BridgeSchema.SymbolsResponse(this.bridge.documentSymbols(body.uri()));
	}

}
