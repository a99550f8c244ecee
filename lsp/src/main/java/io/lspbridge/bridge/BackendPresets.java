/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import io.lspbridge.client.transport.ServerParameters;
import io.lspbridge.util.Utils;

/**
 * 内置的后端预设。每个预设只负责把选项翻译为命令行、工作目录和传输方式。
 *
 * <p>
 * 调用方提供的{@code serverArgs}替换默认参数，csharp例外：它的参数追加在必需参数之后。
 */
public final class BackendPresets {

	public static final int DEFAULT_COBOL_PORT = 1044;

	private BackendPresets() {
	}

	/**
	 * 注册了全部内置后端的注册表。
	 * @return 新的注册表
	 */
	public static BackendRegistry defaults() {
		return new BackendRegistry() // @formatter:off
			.register("typescript", simple("typescript-language-server", "--stdio"))
			.register("python", BackendPresets::python)
			.register("java", simple("jdtls"))
			.register("rust", simple("rust-analyzer"))
			.register("ruby", BackendPresets::ruby)
			.register("perl", BackendPresets::perl)
			.register("cpp", simple("clangd", "--log=error"))
			.register("csharp", BackendPresets::csharp)
			.register("sql", BackendPresets::sql)
			.register("cobol", BackendPresets::cobol)
			.register("bash", simple("bash-language-server", "start"))
			.register("terraform", simple("terraform-ls", "serve"))
			.register("clojure", simple("clojure-lsp"))
			.register("kotlin", simple("kotlin-lsp", "--stdio"))
			.register("go", BackendPresets::go)
			.register("php", simple("intelephense", "--stdio")); // @formatter:on
	}

	/**
	 * 固定命令加默认参数的预设。
	 */
	public static BackendPreset simple(String command, String... defaultArgs) {
		return options -> ServerParameters.builder(command).args(args(options, defaultArgs)).build();
	}

	static ServerParameters python(BackendOptions options) {
		String serverDir = require(options.serverDir(), "serverDir is required for Python");
		requireExists(serverDir, "Server directory not found: ");
		return ServerParameters.builder("poetry")
			.args("run", "pylsp")
			.args(args(options, "-v"))
			.workingDirectory(Path.of(serverDir))
			.build();
	}

	static ServerParameters ruby(BackendOptions options) {
		Path projectDir = Utils.hasText(options.cwd()) ? Path.of(options.cwd()) : Utils.toPath(options.rootUri());
		return ServerParameters.builder("solargraph")
			.args(args(options, "stdio"))
			.workingDirectory(projectDir)
			.build();
	}

	static ServerParameters perl(BackendOptions options) {
		String serverPath = require(options.serverPath(), "serverPath is required for Perl");
		requireExists(serverPath, "PerlNavigator not found: ");
		return ServerParameters.builder(serverPath).args(args(options, "--stdio")).build();
	}

	static ServerParameters csharp(BackendOptions options) {
		String solutionPath = require(options.solutionPath(), "solutionPath is required for C#");
		String logLevel = Utils.hasText(options.logLevel()) ? options.logLevel() : "INFO";
		ServerParameters.Builder builder = ServerParameters.builder("csharp-ls")
			.args("--loglevel", logLevel, "--solution", solutionPath);
		if (options.serverArgs() != null) {
			builder.args(options.serverArgs());
		}
		return builder.build();
	}

	static ServerParameters sql(BackendOptions options) {
		String serverPath = require(options.serverPath(), "serverPath is required for SQL");
		requireExists(serverPath, "SQL language server not found: ");
		return ServerParameters.builder(serverPath).args(args(options, "up", "--method", "stdio")).build();
	}

	static ServerParameters cobol(BackendOptions options) {
		String serverJar = require(options.serverJar(), "serverJar is required for COBOL");
		requireExists(serverJar, "Server JAR not found: ");
		String host = Utils.hasText(options.host()) ? options.host() : ServerParameters.DEFAULT_SOCKET_HOST;
		int port = options.port() != null ? options.port() : DEFAULT_COBOL_PORT;
		if (port < 1 || port > 65535) {
			throw LspBridgeException.configuration("port must be between 1 and 65535: " + port);
		}
		return ServerParameters.builder("java").args("-jar", serverJar).socket(host, port).build();
	}

	static ServerParameters go(BackendOptions options) {
		String serverPath = Utils.hasText(options.serverPath()) ? options.serverPath()
				: Path.of(System.getProperty("user.home"), "go", "bin", "gopls").toString();
		requireExists(serverPath, "gopls not found at: ");
		return ServerParameters.builder(serverPath).args(args(options)).build();
	}

	private static List<String> args(BackendOptions options, String... defaults) {
		return options.serverArgs() != null ? options.serverArgs() : List.of(defaults);
	}

	private static String require(String value, String message) {
		if (!Utils.hasText(value)) {
			throw LspBridgeException.configuration(message);
		}
		return value;
	}

	private static void requireExists(String path, String messagePrefix) {
		if (!Files.exists(Path.of(path))) {
			throw LspBridgeException.configuration(messagePrefix + path);
		}
	}

}
