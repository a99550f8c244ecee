/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client.transport;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.lspbridge.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * 启动语言服务器进程所需的参数：可执行命令、参数、附加环境变量和工作目录，
 * 以及可选的TCP端点。设置了端点时，客户端在进程启动并等待{@link #getSettleDelay()}
 * 之后通过套接字与服务器通信，否则使用进程的标准输入输出。
 *
 * @author Christian Tzolov
 */
public class ServerParameters {

	public static final String DEFAULT_SOCKET_HOST = "localhost";

	public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(2);

	public static final Duration DEFAULT_TERMINATION_GRACE_PERIOD = Duration.ofSeconds(2);

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	@Nullable
	private final Path workingDirectory;

	private final String host;

	@Nullable
	private final Integer port;

	private final Duration settleDelay;

	private final Duration terminationGracePeriod;

	private ServerParameters(Builder builder) {
		this.command = builder.command;
		this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
		this.env = Collections.unmodifiableMap(new HashMap<>(builder.env));
		this.workingDirectory = builder.workingDirectory;
		this.host = builder.host;
		this.port = builder.port;
		this.settleDelay = builder.settleDelay;
		this.terminationGracePeriod = builder.terminationGracePeriod;
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	/**
	 * 叠加在当前进程环境之上的变量。
	 */
	public Map<String, String> getEnv() {
		return this.env;
	}

	@Nullable
	public Path getWorkingDirectory() {
		return this.workingDirectory;
	}

	public String getHost() {
		return this.host;
	}

	@Nullable
	public Integer getPort() {
		return this.port;
	}

	public boolean isSocket() {
		return this.port != null;
	}

	public Duration getSettleDelay() {
		return this.settleDelay;
	}

	public Duration getTerminationGracePeriod() {
		return this.terminationGracePeriod;
	}

	/**
	 * 完整的命令行，命令在前。
	 * @return 命令行
	 */
	public List<String> getCommandLine() {
		List<String> commandLine = new ArrayList<>();
		commandLine.add(this.command);
		commandLine.addAll(this.args);
		return commandLine;
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	@Override
	public String toString() {
		return "ServerParameters{commandLine=" + getCommandLine() + ", workingDirectory=" + this.workingDirectory
				+ (isSocket() ? ", endpoint=" + this.host + ":" + this.port : ", stdio") + "}";
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private Path workingDirectory;

		private String host = DEFAULT_SOCKET_HOST;

		private Integer port;

		private Duration settleDelay = DEFAULT_SETTLE_DELAY;

		private Duration terminationGracePeriod = DEFAULT_TERMINATION_GRACE_PERIOD;

		public Builder(String command) {
			Assert.hasText(command, "The command can not be empty");
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder arg(String arg) {
			Assert.notNull(arg, "The arg can not be null");
			this.args.add(arg);
			return this;
		}

		public Builder env(Map<String, String> env) {
			if (env != null && !env.isEmpty()) {
				this.env.putAll(env);
			}
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.notNull(key, "The key can not be null");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public Builder workingDirectory(@Nullable Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		/**
		 * 通过TCP而不是标准输入输出与服务器通信。
		 * @param host 主机
		 * @param port 端口
		 * @return 构建器
		 */
		public Builder socket(String host, int port) {
			Assert.hasText(host, "The host can not be empty");
			Assert.isTrue(port > 0 && port <= 65535, "The port must be between 1 and 65535");
			this.host = host;
			this.port = port;
			return this;
		}

		public Builder settleDelay(Duration settleDelay) {
			Assert.notNull(settleDelay, "The settleDelay can not be null");
			this.settleDelay = settleDelay;
			return this;
		}

		public Builder terminationGracePeriod(Duration terminationGracePeriod) {
			Assert.notNull(terminationGracePeriod, "The terminationGracePeriod can not be null");
			this.terminationGracePeriod = terminationGracePeriod;
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this);
		}

	}

}
