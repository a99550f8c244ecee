/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 启动一个后端的请求。除{@code language}和{@code rootUri}外，各字段只对部分后端有意义。
 *
 * @param language 后端类型，例如{@code typescript}
 * @param rootUri 工作区根URI
 * @param serverArgs 替换默认参数的服务器参数（csharp为追加）
 * @param cwd 服务器进程的工作目录（ruby）
 * @param serverDir pylsp所在的poetry项目目录（python）
 * @param serverPath 服务器可执行文件路径（perl、sql、go）
 * @param solutionPath 解决方案文件路径（csharp）
 * @param logLevel 日志级别（csharp，默认INFO）
 * @param serverJar 服务器JAR路径（cobol）
 * @param host 套接字主机（cobol，默认localhost）
 * @param port 套接字端口（cobol，默认1044）
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendOptions( // @formatter:off
	@JsonProperty("language") String language,
	@JsonProperty("rootUri") String rootUri,
	@JsonProperty("serverArgs") List<String> serverArgs,
	@JsonProperty("cwd") String cwd,
	@JsonProperty("serverDir") String serverDir,
	@JsonProperty("serverPath") String serverPath,
	@JsonProperty("solutionPath") String solutionPath,
	@JsonProperty("logLevel") String logLevel,
	@JsonProperty("serverJar") String serverJar,
	@JsonProperty("host") String host,
	@JsonProperty("port") Integer port) { // @formatter:on

	public BackendOptions {
		serverArgs = serverArgs != null ? Collections.unmodifiableList(new ArrayList<>(serverArgs)) : null;
	}

	public static Builder builder(String language, String rootUri) {
		return new Builder(language, rootUri);
	}

	public static class Builder {

		private final String language;

		private final String rootUri;

		private List<String> serverArgs;

		private String cwd;

		private String serverDir;

		private String serverPath;

		private String solutionPath;

		private String logLevel;

		private String serverJar;

		private String host;

		private Integer port;

		private Builder(String language, String rootUri) {
			this.language = language;
			this.rootUri = rootUri;
		}

		public Builder serverArgs(List<String> serverArgs) {
			this.serverArgs = serverArgs;
			return this;
		}

		public Builder cwd(String cwd) {
			this.cwd = cwd;
			return this;
		}

		public Builder serverDir(String serverDir) {
			this.serverDir = serverDir;
			return this;
		}

		public Builder serverPath(String serverPath) {
			this.serverPath = serverPath;
			return this;
		}

		public Builder solutionPath(String solutionPath) {
			this.solutionPath = solutionPath;
			return this;
		}

		public Builder logLevel(String logLevel) {
			this.logLevel = logLevel;
			return this;
		}

		public Builder serverJar(String serverJar) {
			this.serverJar = serverJar;
			return this;
		}

		public Builder host(String host) {
			this.host = host;
			return this;
		}

		public Builder port(Integer port) {
			this.port = port;
			return this;
		}

		public BackendOptions build() {
			return new BackendOptions(this.language, this.rootUri, this.serverArgs, this.cwd, this.serverDir,
					this.serverPath, this.solutionPath, this.logLevel, this.serverJar, this.host, this.port);
		}

	}

}
