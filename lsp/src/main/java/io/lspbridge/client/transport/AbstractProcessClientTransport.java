/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lspbridge.spec.LspClientTransport;
import io.lspbridge.spec.LspFrameCodec;
import io.lspbridge.spec.LspFramingException;
import io.lspbridge.spec.LspSchema;
import io.lspbridge.spec.LspSchema.JSONRPCMessage;
import io.lspbridge.spec.LspTransportException;
import io.lspbridge.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * 启动语言服务器子进程并通过一条字节通道与其交换{@code Content-Length}帧的传输基类。
 * 子类决定通道是什么：进程的标准输入输出，或者进程启动后连接的TCP套接字。
 *
 * <p>
 * 入站读取、出站写入和stderr读取各自运行在独立的单线程调度器上。
 * 出站写入在专用线程上串行执行，因此消息按照订阅{@link #sendMessage}的顺序写出。
 * 通道读到EOF、读写失败或进程退出时，关闭回调被调用且仅调用一次。
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public abstract class AbstractProcessClientTransport implements LspClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(AbstractProcessClientTransport.class);

	private static final int READ_CHUNK_SIZE = 8192;

	private final Sinks.Many<JSONRPCMessage> inboundSink;

	private final Sinks.Many<String> errorSink;

	/** 用于配置和启动服务器进程的参数 */
	protected final ServerParameters params;

	private final ObjectMapper objectMapper;

	/** 正在通信的服务器进程 */
	private volatile Process process;

	private volatile Channel channel;

	/** 用于处理来自服务器的入站消息的调度器 */
	private final Scheduler inboundScheduler;

	/** 用于写出出站消息的调度器 */
	private final Scheduler outboundScheduler;

	/** 用于读取服务器进程stderr的调度器 */
	private final Scheduler errorScheduler;

	/** 主动关闭时置位，用于抑制关闭过程中的读写错误日志 */
	private volatile boolean isClosing = false;

	private final AtomicBoolean closeRequested = new AtomicBoolean(false);

	private final AtomicBoolean closeReported = new AtomicBoolean(false);

	@Nullable
	private volatile Integer exitCode;

	private volatile Consumer<Throwable> closeHandler = cause -> {
	};

	// visible for tests
	private Consumer<String> stdErrorHandler = error -> logger.info("STDERR Message received: {}", error);

	/**
	 * 输入输出字节流。
	 *
	 * @param input 来自服务器的字节
	 * @param output 发往服务器的字节
	 */
	protected record Channel(InputStream input, OutputStream output) {
	}

	protected AbstractProcessClientTransport(ServerParameters params, ObjectMapper objectMapper) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(objectMapper, "The ObjectMapper can not be null");

		this.params = params;
		this.objectMapper = objectMapper;

		this.inboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.errorSink = Sinks.many().unicast().onBackpressureBuffer();

		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "lsp-inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "lsp-outbound");
		this.errorScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "lsp-stderr");
	}

	/**
	 * 启动服务器进程，打开通道并开始入站、stderr处理。
	 * 进程无法启动或通道无法打开时以{@link LspTransportException}失败，且已启动的进程会被终止。
	 */
	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		return Mono.<Void>fromRunnable(() -> {
			handleIncomingMessages(handler);
			handleIncomingErrors();

			List<String> fullCommand = this.params.getCommandLine();

			ProcessBuilder processBuilder = this.getProcessBuilder();
			processBuilder.command(fullCommand);
			processBuilder.environment().putAll(this.params.getEnv());
			if (this.params.getWorkingDirectory() != null) {
				processBuilder.directory(this.params.getWorkingDirectory().toFile());
			}
			configureProcess(processBuilder);

			logger.info("Starting language server: {}", this.params);
			try {
				this.process = processBuilder.start();
			}
			catch (IOException e) {
				throw new LspTransportException("Failed to start process with command: " + fullCommand, e);
			}
			this.process.onExit().thenAccept(this::handleProcessExit);
			startErrorProcessing();

			try {
				this.channel = openChannel(this.process);
			}
			catch (RuntimeException e) {
				this.isClosing = true;
				this.process.destroyForcibly();
				throw e;
			}

			startInboundProcessing();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * 创建并返回一个新的ProcessBuilder实例。受保护以允许在测试中重写。
	 * @return 一个新的ProcessBuilder实例
	 */
	protected ProcessBuilder getProcessBuilder() {
		return new ProcessBuilder();
	}

	/**
	 * 启动前调整进程配置，例如重定向不参与协议的输出。
	 * @param processBuilder 进程构建器
	 */
	protected void configureProcess(ProcessBuilder processBuilder) {
	}

	/**
	 * 打开与已启动进程通信的通道。
	 * @param process 已启动的服务器进程
	 * @return 通道
	 * @throws LspTransportException 如果通道无法打开
	 */
	protected abstract Channel openChannel(Process process);

	/**
	 * 释放通道持有的额外资源。默认实现关闭输出流。
	 */
	protected void closeChannel() {
		Channel current = this.channel;
		if (current != null) {
			try {
				current.output().close();
			}
			catch (IOException e) {
				logger.debug("Error closing output stream: {}", e.getMessage());
			}
		}
	}

	/**
	 * 设置服务器进程stderr每一行的处理器。默认以INFO级别记录日志。
	 * @param errorHandler 处理stderr行的消费者
	 */
	public void setStdErrorHandler(Consumer<String> errorHandler) {
		Assert.notNull(errorHandler, "The errorHandler can not be null");
		this.stdErrorHandler = errorHandler;
	}

	@Override
	public void setCloseHandler(Consumer<Throwable> closeHandler) {
		Assert.notNull(closeHandler, "The closeHandler can not be null");
		this.closeHandler = closeHandler;
	}

	/**
	 * 服务器进程的退出码。
	 * @return 退出码；进程仍在运行或未启动时为{@code null}
	 */
	@Nullable
	public Integer getExitCode() {
		return this.exitCode;
	}

	/**
	 * 等待服务器进程退出。
	 * @throws LspTransportException 如果等待过程中线程被中断
	 */
	public void awaitForExit() {
		try {
			this.process.waitFor();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LspTransportException("Process interrupted", e);
		}
	}

	private void handleProcessExit(Process exited) {
		this.exitCode = exited.exitValue();
		if (this.isClosing) {
			logger.info("Language server exited with code {}", this.exitCode);
			reportClosed(null);
		}
		else {
			logger.warn("Language server exited unexpectedly with code {}", this.exitCode);
			reportClosed(new LspTransportException("Language server exited with code " + this.exitCode));
		}
	}

	private void reportClosed(@Nullable Throwable cause) {
		if (this.closeReported.compareAndSet(false, true)) {
			this.closeHandler.accept(cause);
		}
	}

	/**
	 * 启动从进程错误流读取的处理线程，每一行交给stderr处理器。
	 */
	private void startErrorProcessing() {
		Process started = this.process;
		this.errorScheduler.schedule(() -> {
			try (BufferedReader processErrorReader = new BufferedReader(
					new InputStreamReader(started.getErrorStream(), StandardCharsets.UTF_8))) {
				String line;
				while ((line = processErrorReader.readLine()) != null) {
					if (!this.errorSink.tryEmitNext(line).isSuccess()) {
						if (!this.isClosing) {
							logger.error("Failed to emit error message");
						}
						break;
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from error stream", e);
				}
			}
			finally {
				this.errorSink.tryEmitComplete();
			}
		});
	}

	private void handleIncomingMessages(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> inboundMessageHandler) {
		// concatMap保持服务器发送的顺序
		this.inboundSink.asFlux()
			.concatMap(message -> Mono.just(message)
				.transform(inboundMessageHandler)
				.onErrorResume(error -> {
					logger.error("Error dispatching inbound message {}", message, error);
					return Mono.empty();
				}))
			.subscribe(null, error -> logger.error("Error dispatching inbound message", error));
	}

	private void handleIncomingErrors() {
		this.errorSink.asFlux().subscribe(e -> this.stdErrorHandler.accept(e));
	}

	/**
	 * 启动从通道读取字节、解码帧并反序列化JSON-RPC消息的入站处理线程。
	 * 无法解析的负载被记录并丢弃；帧头错误是致命的，会关闭连接。
	 */
	private void startInboundProcessing() {
		Channel current = this.channel;
		this.inboundScheduler.schedule(() -> {
			LspFrameCodec codec = new LspFrameCodec();
			byte[] chunk = new byte[READ_CHUNK_SIZE];
			Throwable failure = null;
			try (InputStream input = current.input()) {
				int read;
				while ((read = input.read(chunk)) != -1) {
					codec.append(chunk, 0, read);
					String frame;
					while ((frame = codec.nextFrame()) != null) {
						emitFrame(frame);
					}
				}
				logger.debug("Language server closed its output");
			}
			catch (LspFramingException e) {
				logger.error("Unrecoverable framing error, closing connection: {}", e.getMessage());
				failure = e;
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from input stream", e);
					failure = new LspTransportException("Error reading from language server", e);
				}
			}
			finally {
				this.inboundSink.tryEmitComplete();
				if (failure == null && !this.isClosing) {
					failure = new LspTransportException("Language server closed the connection");
				}
				reportClosed(failure);
			}
		});
	}

	private void emitFrame(String frame) {
		JSONRPCMessage message;
		try {
			message = LspSchema.deserializeJsonRpcMessage(this.objectMapper, frame);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Dropping unparseable message: {} ({})", frame, e.getMessage());
			return;
		}
		if (!this.inboundSink.tryEmitNext(message).isSuccess() && !this.isClosing) {
			logger.error("Failed to enqueue inbound message: {}", message);
		}
	}

	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		return Mono.<Void>fromRunnable(() -> writeMessage(message))
			// writes come from user threads; keep the actual writing on one dedicated
			// thread so frames never interleave
			.subscribeOn(this.outboundScheduler);
	}

	private void writeMessage(JSONRPCMessage message) {
		Channel current = this.channel;
		if (current == null || this.isClosing || this.closeReported.get()) {
			throw new LspTransportException("Transport is not open, cannot send " + describe(message));
		}
		try {
			byte[] frame = LspFrameCodec.encode(this.objectMapper.writeValueAsString(message));
			OutputStream os = current.output();
			synchronized (os) {
				os.write(frame);
				os.flush();
			}
		}
		catch (IOException e) {
			LspTransportException error = new LspTransportException(
					"Failed to write " + describe(message) + " to language server", e);
			if (!this.isClosing) {
				logger.error(error.getMessage(), e);
				reportClosed(error);
			}
			throw error;
		}
	}

	private static String describe(JSONRPCMessage message) {
		if (message instanceof LspSchema.JSONRPCRequest request) {
			return "request " + request.method();
		}
		if (message instanceof LspSchema.JSONRPCNotification notification) {
			return "notification " + notification.method();
		}
		return "response";
	}

	/**
	 * 关闭通道并终止进程：先发送TERM，超过宽限期仍未退出则强制终止。重复调用不产生额外效果。
	 * @return 进程退出且线程释放后完成的Mono
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.closeRequested.compareAndSet(false, true)) {
				return Mono.empty();
			}
			this.isClosing = true;
			logger.debug("Initiating graceful shutdown");
			return Mono.defer(() -> {
				closeChannel();
				// Give a short time for any pending messages to be processed
				return Mono.delay(Duration.ofMillis(100));
			}).then(Mono.defer(this::terminateProcess)).then(Mono.fromRunnable(() -> {
				this.inboundSink.tryEmitComplete();
				this.errorSink.tryEmitComplete();
				// The threads may be blocked on read so disposeGracefully would not
				// interrupt them, therefore we issue an async hard dispose.
				this.inboundScheduler.dispose();
				this.errorScheduler.dispose();
				this.outboundScheduler.dispose();
				reportClosed(null);
				logger.debug("Graceful shutdown completed");
			}));
		}).then().subscribeOn(Schedulers.boundedElastic());
	}

	private Mono<Void> terminateProcess() {
		Process current = this.process;
		if (current == null) {
			logger.warn("Process not started");
			return Mono.empty();
		}
		logger.debug("Sending TERM to process");
		current.destroy();
		Duration grace = this.params.getTerminationGracePeriod();
		return Mono.fromFuture(current.onExit())
			.timeout(grace)
			.onErrorResume(TimeoutException.class, e -> {
				logger.warn("Language server did not exit within {}, killing it", grace);
				current.destroyForcibly();
				return Mono.fromFuture(current.onExit());
			})
			.doOnNext(exited -> logger.debug("Process terminated with code {}", exited.exitValue()))
			.then();
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
