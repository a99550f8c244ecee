/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.server;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.bridge.LspBridge;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * 在嵌入式Tomcat中运行{@link HttpServletLspBridgeServer}的命令行入口。
 */
@CommandLine.Command(name = "lsp-bridge", mixinStandardHelpOptions = true, version = "lsp-bridge 0.1.0",
		description = "Serve a single language server session over HTTP.")
public class LspBridgeServerCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(LspBridgeServerCommand.class);

	public static final int DEFAULT_PORT = 3000;

	private static final String SERVLET_NAME = "lspBridge";

	@CommandLine.Option(names = { "-p", "--port" }, defaultValue = "" + DEFAULT_PORT,
			description = "Port to listen on (default: ${DEFAULT-VALUE}).")
	int port = DEFAULT_PORT;

	@CommandLine.Option(names = "--host", defaultValue = "0.0.0.0",
			description = "Address to bind to (default: ${DEFAULT-VALUE}).")
	String host = "0.0.0.0";

	@CommandLine.Spec
	CommandLine.Model.CommandSpec spec;

	private Tomcat tomcat;

	private LspBridge bridge;

	@Override
	public Integer call() throws Exception {
		if (this.port < 1 || this.port > 65535) {
			throw new CommandLine.ParameterException(this.spec.commandLine(),
					"Invalid port: " + this.port + " (expected 1-65535)");
		}
		start();
		Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "lsp-bridge-shutdown"));
		logger.info("LSP bridge listening on http://{}:{}", this.host, getLocalPort());
		this.tomcat.getServer().await();
		return 0;
	}

	/**
	 * 启动嵌入式Tomcat。
	 * @throws LifecycleException 如果Tomcat无法启动
	 */
	void start() throws Exception {
		this.bridge = new LspBridge();
		HttpServletLspBridgeServer servlet = HttpServletLspBridgeServer.builder()
			.bridge(this.bridge)
			.objectMapper(new ObjectMapper())
			.build();

		Path baseDir = Files.createTempDirectory("lsp-bridge");
		this.tomcat = new Tomcat();
		this.tomcat.setBaseDir(baseDir.toString());
		this.tomcat.setHostname(this.host);
		this.tomcat.setPort(this.port);
		this.tomcat.getConnector().setProperty("address", this.host);

		Context context = this.tomcat.addContext("", baseDir.toString());
		Tomcat.addServlet(context, SERVLET_NAME, servlet);
		context.addServletMappingDecoded("/*", SERVLET_NAME);

		this.tomcat.start();
	}

	/**
	 * 先停止桥接会话，再停止Tomcat。
	 */
	void stop() {
		logger.info("Shutting down LSP bridge");
		if (this.bridge != null) {
			this.bridge.close();
		}
		if (this.tomcat != null) {
			try {
				this.tomcat.stop();
				this.tomcat.destroy();
			}
			catch (LifecycleException e) {
				logger.warn("Error stopping embedded Tomcat: {}", e.getMessage());
			}
		}
	}

	int getLocalPort() {
		return this.tomcat.getConnector().getLocalPort();
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new LspBridgeServerCommand()).execute(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

}
