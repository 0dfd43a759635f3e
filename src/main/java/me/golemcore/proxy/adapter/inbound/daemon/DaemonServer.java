package me.golemcore.proxy.adapter.inbound.daemon;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.stdio.LoopbackSocketChannel;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelay;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelayFactory;
import me.golemcore.proxy.domain.model.DaemonRequest;
import me.golemcore.proxy.domain.model.DaemonRequestType;
import me.golemcore.proxy.domain.model.DaemonResponse;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background daemon hosting stdio relays behind a loopback control port.
 *
 * <p>
 * Binding the control port is the single-instance guarantee: the socket is
 * bound without {@code SO_REUSEADDR}, and "address in use" is reported as
 * {@link DaemonAlreadyRunningException}. There is no lock file.
 *
 * <p>
 * Each accepted connection carries one newline-terminated
 * {@link DaemonRequest} and receives one {@link DaemonResponse} line, then is
 * closed. Connections are served concurrently on a cached pool.
 * <ul>
 * <li>{@code stdio} - starts a relay whose client side waits on a fresh
 * loopback port, registers it, and removes it again when it terminates</li>
 * <li>{@code status} - running flag, port, relay count, uptime, server ids</li>
 * <li>{@code stop} - replies first, shuts down after
 * {@code proxy.daemon.stop-delay}</li>
 * </ul>
 * A failing connection or relay never takes the daemon down.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DaemonServer {

    private final ProxyProperties.DaemonProperties settings;
    private final StdioRelayFactory relayFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Getter
    private final DaemonRegistry registry = new DaemonRegistry();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile ServerSocket serverSocket;
    private ExecutorService connectionExecutor;
    private ScheduledExecutorService scheduler;
    private Instant startedAt;

    public DaemonServer(ProxyProperties properties, StdioRelayFactory relayFactory, ObjectMapper objectMapper,
            Clock clock) {
        this.settings = properties.getDaemon();
        this.relayFactory = relayFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Binds the control port and starts accepting connections.
     *
     * @throws DaemonAlreadyRunningException
     *             if another process already holds the port
     * @throws IOException
     *             for any other bind failure
     */
    public void start() throws DaemonAlreadyRunningException, IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("daemon already started");
        }

        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(false);
        try {
            socket.bind(new InetSocketAddress(InetAddress.getByName(settings.getHost()), settings.getPort()));
        } catch (BindException e) {
            closeQuietly(socket);
            terminated.countDown();
            if (isAddressInUse(e)) {
                throw new DaemonAlreadyRunningException(settings.getPort(), e);
            }
            throw e;
        } catch (IOException e) {
            closeQuietly(socket);
            terminated.countDown();
            throw e;
        }

        serverSocket = socket;
        startedAt = Instant.now(clock);
        AtomicInteger connectionCounter = new AtomicInteger();
        connectionExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "daemon-conn-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "daemon-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        running.set(true);

        Thread acceptThread = new Thread(this::acceptLoop, "daemon-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("[Daemon] Listening on {}:{}", settings.getHost(), getPort());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Actual control port; differs from the configured one only when port 0
     * was configured.
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : settings.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /**
     * Stops accepting connections and stops every hosted relay. Safe to call
     * repeatedly and from any thread.
     */
    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[Daemon] Shutting down ({} relay(s))", registry.size());
        closeQuietly(serverSocket);
        registry.stopAll();
        connectionExecutor.shutdown();
        scheduler.shutdown();
        terminated.countDown();
        log.info("[Daemon] Stopped");
    }

    // ==================== CONNECTIONS ====================

    private void acceptLoop() {
        while (running.get()) {
            try {
                Socket connection = serverSocket.accept();
                connectionExecutor.execute(() -> handleConnection(connection));
            } catch (RejectedExecutionException e) {
                log.debug("[Daemon] Connection refused during shutdown");
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("[Daemon] Accept failed: {}", e.getMessage());
                }
            }
        }
    }

    private void handleConnection(Socket connection) {
        try (Socket socket = connection;
                BufferedReader reader = new BufferedReader(
                        new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                BufferedWriter writer = new BufferedWriter(
                        new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
            socket.setSoTimeout((int) settings.getReadTimeout());
            String line = reader.readLine();
            if (line == null) {
                // Liveness checks connect and close without sending anything
                log.debug("[Daemon] Connection closed without a request");
                return;
            }
            DaemonResponse response;
            try {
                response = handleLine(line);
            } catch (RuntimeException e) {
                log.error("[Daemon] Request failed", e);
                response = DaemonResponse.failure("internal error: " + e.getMessage());
            }
            writer.write(objectMapper.writeValueAsString(response));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.warn("[Daemon] Control connection failed: {}", e.getMessage());
        }
    }

    DaemonResponse handleLine(String line) {
        if (line.isBlank()) {
            return DaemonResponse.failure("failed to decode request: empty request");
        }
        DaemonRequest request;
        try {
            request = objectMapper.readValue(line, DaemonRequest.class);
        } catch (JsonProcessingException e) {
            return DaemonResponse.failure("failed to decode request: " + e.getOriginalMessage());
        }
        if (request == null) {
            return DaemonResponse.failure("failed to decode request: empty request");
        }
        return handle(request);
    }

    /**
     * Executes one control request.
     */
    public DaemonResponse handle(DaemonRequest request) {
        log.debug("[Daemon] Request {} ({})", request.getId(), request.getType());
        DaemonRequestType type = DaemonRequestType.fromWireName(request.getType()).orElse(null);
        if (type == null) {
            return DaemonResponse.failure(String.format("unknown request type: %s", request.getType()));
        }
        return switch (type) {
        case START_STDIO -> startStdio(request);
        case STATUS -> status();
        case STOP -> stop();
        };
    }

    // ==================== HANDLERS ====================

    private DaemonResponse startStdio(DaemonRequest request) {
        if (!running.get()) {
            return DaemonResponse.failure("daemon is shutting down");
        }
        String command = request.getCommand();
        if (command == null || command.isBlank()) {
            return DaemonResponse.failure("command is required");
        }
        List<String> args = request.getArgs() != null ? request.getArgs() : List.of();

        LoopbackSocketChannel channel;
        try {
            channel = new LoopbackSocketChannel(settings.getHost(), settings.getAttachTimeout());
        } catch (IOException e) {
            return DaemonResponse.failure("failed to open client channel: " + e.getMessage());
        }

        StdioRelay relay;
        try {
            relay = relayFactory.create(command, args, channel);
            relay.start();
        } catch (IOException | RuntimeException e) {
            closeQuietly(channel);
            log.warn("[Daemon] Failed to start stdio proxy for {}: {}", command, e.getMessage());
            return DaemonResponse.failure("failed to start stdio proxy: " + e.getMessage());
        }

        String serverId = relay.getServerId();
        registry.register(serverId, relay);
        relay.getTermination().whenComplete((exitCode, error) -> {
            registry.remove(serverId);
            log.info("[Daemon] Relay {} exited (code {})", serverId, exitCode);
        });
        if (!running.get()) {
            // Shutdown raced with this start
            registry.remove(serverId);
            relay.stop();
            return DaemonResponse.failure("daemon is shutting down");
        }

        log.info("[Daemon] Started relay {} for {} {} (client port {})", serverId, command, args, channel.getPort());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command", command);
        data.put("args", args);
        return DaemonResponse.builder()
                .success(true)
                .serverId(serverId)
                .port(channel.getPort())
                .data(data)
                .build();
    }

    private DaemonResponse status() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("running", running.get());
        data.put("port", getPort());
        data.put("server_count", registry.size());
        data.put("uptime_seconds", startedAt != null ? Duration.between(startedAt, Instant.now(clock)).getSeconds() : 0);
        data.put("servers", registry.serverIds());
        return DaemonResponse.builder()
                .success(true)
                .port(getPort())
                .data(data)
                .build();
    }

    private DaemonResponse stop() {
        if (running.get()) {
            log.info("[Daemon] Stop requested, shutting down in {} ms", settings.getStopDelay());
            try {
                scheduler.schedule(this::shutdown, settings.getStopDelay(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[Daemon] Shutdown already in progress");
            }
        }
        return DaemonResponse.builder()
                .success(true)
                .data(Map.of("message", "daemon stopping"))
                .build();
    }

    private static boolean isAddressInUse(BindException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("in use");
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("[Daemon] Error closing {}: {}", closeable, e.getMessage());
        }
    }
}
