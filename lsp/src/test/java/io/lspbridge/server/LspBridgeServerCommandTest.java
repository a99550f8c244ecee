/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.server;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link LspBridgeServerCommand}的测试。
 */
@Timeout(15)
class LspBridgeServerCommandTest {

	@Test
	void defaultsToPort3000OnAllInterfaces() {
		LspBridgeServerCommand command = new LspBridgeServerCommand();
		new CommandLine(command).parseArgs();

		assertThat(command.port).isEqualTo(LspBridgeServerCommand.DEFAULT_PORT);
		assertThat(command.host).isEqualTo("0.0.0.0");
	}

	@Test
	void parsesPortAndHost() {
		LspBridgeServerCommand command = new LspBridgeServerCommand();
		new CommandLine(command).parseArgs("-p", "8123", "--host", "127.0.0.1");

		assertThat(command.port).isEqualTo(8123);
		assertThat(command.host).isEqualTo("127.0.0.1");
	}

	@Test
	void rejectsOutOfRangePort() {
		StringWriter err = new StringWriter();
		CommandLine commandLine = new CommandLine(new LspBridgeServerCommand());
		commandLine.setErr(new PrintWriter(err));

		int exitCode = commandLine.execute("--port", "70000");

		assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
		assertThat(err.toString()).contains("Invalid port: 70000");
	}

	@Test
	void rejectsNonNumericPort() {
		StringWriter err = new StringWriter();
		CommandLine commandLine = new CommandLine(new LspBridgeServerCommand());
		commandLine.setErr(new PrintWriter(err));

		assertThat(commandLine.execute("--port", "http")).isEqualTo(CommandLine.ExitCode.USAGE);
	}

	@Test
	void servesStatusUntilStopped() throws Exception {
		LspBridgeServerCommand command = new LspBridgeServerCommand();
		new CommandLine(command).parseArgs("--host", "127.0.0.1", "--port", "0");
		command.start();
		try {
			int port = command.getLocalPort();
			assertThat(port).isPositive();

			HttpResponse<String> response = HttpClient.newBuilder()
				.version(HttpClient.Version.HTTP_1_1)
				.build()
				.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/status")).GET().build(),
						HttpResponse.BodyHandlers.ofString());
			assertThat(response.statusCode()).isEqualTo(200);
			assertThat(response.body()).isEqualTo("{\"running\":false}");
		}
		finally {
			command.stop();
		}
	}

}
