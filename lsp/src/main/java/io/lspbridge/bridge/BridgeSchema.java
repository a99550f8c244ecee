/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.lspbridge.spec.LspSchema.Diagnostic;
import io.lspbridge.spec.LspSchema.InitializeResult;
import io.lspbridge.util.Utils;

/**
 * 桥接调用接口的请求体和应答体。请求体的{@code validate()}在字段缺失时抛出
 * {@link LspBridgeException.ErrorKind#INVALID_REQUEST}错误，消息形如{@code "uri is required"}。
 */
public final class BridgeSchema {

	private BridgeSchema() {
	}

	private static void required(boolean present, String field) {
		if (!present) {
			throw LspBridgeException.invalidRequest(field + " is required");
		}
	}

	// ---------------------------
	// Requests
	// ---------------------------
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DocumentOpenRequest( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("languageId") String languageId,
		@JsonProperty("text") String text) { // @formatter:on

		public DocumentOpenRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			required(Utils.hasText(this.languageId), "languageId");
			required(this.text != null, "text");
			return this;
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DocumentChangeRequest( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("text") String text) { // @formatter:on

		public DocumentChangeRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			required(this.text != null, "text");
			return this;
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record DocumentCloseRequest( // @formatter:off
		@JsonProperty("uri") String uri) { // @formatter:on

		public DocumentCloseRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			return this;
		}
	}

	/**
	 * completion、hover和definition共用的位置请求。
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record PositionRequest( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("line") Integer line,
		@JsonProperty("character") Integer character) { // @formatter:on

		public PositionRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			required(this.line != null, "line");
			required(this.character != null, "character");
			return this;
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ReferencesRequest( // @formatter:off
		@JsonProperty("uri") String uri,
		@JsonProperty("line") Integer line,
		@JsonProperty("character") Integer character,
		@JsonProperty("includeDeclaration") Boolean includeDeclaration) { // @formatter:on

		public ReferencesRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			required(this.line != null, "line");
			required(this.character != null, "character");
			return this;
		}

		public boolean includeDeclarationOrDefault() {
			return this.includeDeclaration == null || this.includeDeclaration;
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record SymbolsRequest( // @formatter:off
		@JsonProperty("uri") String uri) { // @formatter:on

		public SymbolsRequest validate() {
			required(Utils.hasText(this.uri), "uri");
			return this;
		}
	}

	// ---------------------------
	// Responses
	// ---------------------------
	public record StartResponse( // @formatter:off
		@JsonProperty("capabilities") InitializeResult capabilities) {
	} // @formatter:on

	public record SuccessResponse( // @formatter:off
		@JsonProperty("success") boolean success) {

		public static final SuccessResponse OK = new SuccessResponse(true);
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record StatusResponse( // @formatter:off
		@JsonProperty("running") boolean running,
		@JsonProperty("language") String language,
		@JsonProperty("capabilities") InitializeResult capabilities) {

		public static final StatusResponse IDLE = new StatusResponse(false, null, null);
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.ALWAYS)
	public record CompletionResponse( // @formatter:off
		@JsonProperty("items") Object items) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.ALWAYS)
	public record HoverResponse( // @formatter:off
		@JsonProperty("hover") Object hover) {
	} // @formatter:on

	/**
	 * definition和references共用。
	 */
	@JsonInclude(JsonInclude.Include.ALWAYS)
	public record LocationsResponse( // @formatter:off
		@JsonProperty("locations") Object locations) {
	} // @formatter:on

	@JsonInclude(JsonInclude.Include.ALWAYS)
	public record SymbolsResponse( // @formatter:off
		@JsonProperty("symbols") Object symbols) {
	} // @formatter:on

	public record DiagnosticsResponse( // @formatter:off
		@JsonProperty("diagnostics") Map<String, List<Diagnostic>> diagnostics) {
	} // @formatter:on

	public record ErrorResponse( // @formatter:off
		@JsonProperty("error") String error,
		@JsonProperty("kind") LspBridgeException.ErrorKind kind) {

		public static ErrorResponse of(LspBridgeException exception) {
			return new ErrorResponse(exception.getMessage(), exception.getKind());
		}
	} // @formatter:on

}
