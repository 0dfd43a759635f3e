package me.golemcore.proxy.adapter.inbound.stdio;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.BatchResult;
import me.golemcore.proxy.domain.model.ChainResult;
import me.golemcore.proxy.domain.model.MessageDirection;
import me.golemcore.proxy.domain.model.MessageType;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.ProxyMessage;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.McpErrorFormatter;
import me.golemcore.proxy.domain.processor.PayloadParseException;
import me.golemcore.proxy.domain.processor.ProcessorChain;
import me.golemcore.proxy.port.outbound.ActivityLogPort;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relays newline-delimited JSON-RPC frames between one client and one
 * downstream MCP server process, running every frame through a
 * {@link ProcessorChain}.
 *
 * <p>
 * Lifecycle: {@code CREATED -> STARTED -> STOPPING -> STOPPED}. {@link #start()}
 * spawns the server once and starts three daemon threads: the client-to-server
 * loop, the server-to-client loop and a stderr drain. Both forwarding loops
 * share the relay state as their cancellation signal; a frame already being
 * processed finishes, no new frame is picked up once the relay leaves
 * {@code STARTED}.
 *
 * <p>
 * Frame handling:
 * <ul>
 * <li>no enabled processors, or a frame that is neither a JSON object nor a
 * batch - forwarded verbatim</li>
 * <li>batch - every element goes through the chain on its own with the rules
 * below; survivors are forwarded as one batch and errors owed to the sender
 * are sent back as another</li>
 * <li>chain success - the resulting payload is re-serialized and
 * forwarded</li>
 * <li>rejected request, from either side - absorbed; a JSON-RPC error with the
 * request id goes back to the side that sent it</li>
 * <li>rejected notification - absorbed with a warning, no reply</li>
 * <li>any other rejected frame (a response) - replaced by a JSON-RPC error
 * carrying the frame id (or null), delivered to the intended receiver</li>
 * </ul>
 *
 * <p>
 * Server stdout EOF or an I/O failure in either loop stops the relay. Client
 * EOF closes the server's stdin and gives it the shutdown grace period to exit
 * on its own.
 *
 * <p>
 * Not a Spring bean. Created per downstream process by
 * {@link StdioRelayFactory}.
 */
@Slf4j
public class StdioRelay {

    public enum State {
        CREATED, STARTED, STOPPING, STOPPED
    }

    @Getter
    private final String serverId;
    @Getter
    private final String sessionId;
    @Getter
    private final String command;
    @Getter
    private final List<String> args;
    private final Map<String, String> environment;
    private final ProcessorChain chain;
    private final ClientChannel client;
    private final ActivityLogPort activityLog;
    private final ObjectMapper objectMapper;
    private final long shutdownGraceMs;
    private final long loopJoinTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final CompletableFuture<Integer> termination = new CompletableFuture<>();
    private final Object lifecycleLock = new Object();
    private final Object clientWriteLock = new Object();

    private Process process;
    private BufferedWriter serverWriter;
    private BufferedWriter clientWriter;
    private Thread clientLoop;
    private Thread serverLoop;
    private Thread stderrThread;

    @Builder
    public StdioRelay(String serverId, String sessionId, String command, List<String> args,
            Map<String, String> environment, ProcessorChain chain, ClientChannel client, ActivityLogPort activityLog,
            ObjectMapper objectMapper, long shutdownGraceMs, long loopJoinTimeoutMs) {
        this.serverId = serverId;
        this.sessionId = sessionId;
        this.command = command;
        this.args = args != null ? List.copyOf(args) : List.of();
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        this.chain = chain;
        this.client = client;
        this.activityLog = activityLog;
        this.objectMapper = objectMapper;
        this.shutdownGraceMs = shutdownGraceMs;
        this.loopJoinTimeoutMs = loopJoinTimeoutMs;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Completes with the server's exit code (or -1 if it could not be
     * determined) once the relay has fully stopped.
     */
    public CompletableFuture<Integer> getTermination() {
        return termination;
    }

    /**
     * Spawns the downstream server and starts the forwarding loops.
     *
     * @throws IllegalStateException
     *             if the relay was already started
     * @throws IOException
     *             if the process cannot be spawned; the relay is then stopped
     */
    public void start() throws IOException {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.CREATED, State.STARTED)) {
                throw new IllegalStateException("relay " + serverId + " already started");
            }

            List<String> commandLine = new ArrayList<>();
            commandLine.add(command);
            commandLine.addAll(args);
            log.info("[Relay:{}] Starting server: {}", sessionId, commandLine);

            ProcessBuilder pb = new ProcessBuilder(commandLine);
            pb.redirectErrorStream(false);
            pb.environment().putAll(environment);
            try {
                process = pb.start();
            } catch (IOException e) {
                log.error("[Relay:{}] Failed to start server: {}", sessionId, e.getMessage());
                state.set(State.STOPPED);
                closeClient();
                record(ProxyEvent.EventKind.START, MessageDirection.SYSTEM, null, null, false, e.getMessage());
                termination.complete(-1);
                throw e;
            }

            serverWriter = new BufferedWriter(
                    new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            record(ProxyEvent.EventKind.START, MessageDirection.SYSTEM, null, null, true, null);

            clientLoop = startThread("relay-client-" + sessionId, this::pumpClientToServer);
            serverLoop = startThread("relay-server-" + sessionId, this::pumpServerToClient);
            stderrThread = startThread("relay-stderr-" + sessionId, this::drainStderr);
        }
    }

    /**
     * Stops the relay: asks the process to terminate, kills it after the grace
     * period, closes its stdin and the client channel, then waits for both
     * loops.
     * Stopping a relay that never started or is already stopping is a no-op.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.STARTED, State.STOPPING)) {
                return;
            }
        }
        log.info("[Relay:{}] Stopping", sessionId);

        int exitCode = terminateProcess();
        closeServerInput();
        closeClient();

        joinLoop(clientLoop);
        joinLoop(serverLoop);
        joinLoop(stderrThread);
        releaseProcessStreams();

        state.set(State.STOPPED);
        log.info("[Relay:{}] Stopped (exit code {})", sessionId, exitCode);
        record(ProxyEvent.EventKind.STOP, MessageDirection.SYSTEM, null, null, true, null);
        termination.complete(exitCode);
    }

    private boolean isRunning() {
        return state.get() == State.STARTED;
    }

    private void requestStop() {
        if (isRunning()) {
            startThread("relay-stop-" + sessionId, this::stop);
        }
    }

    // ==================== FORWARDING LOOPS ====================

    private void pumpClientToServer() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(client.input(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null && isRunning()) {
                if (line.isBlank()) {
                    continue;
                }
                relay(frame(MessageDirection.CLIENT_TO_SERVER, line));
            }
            if (isRunning()) {
                log.info("[Relay:{}] Client closed its input", sessionId);
                closeServerInput();
                awaitServerExit();
            }
        } catch (IOException e) {
            if (isRunning()) {
                log.warn("[Relay:{}] Client loop failed: {}", sessionId, e.getMessage());
                requestStop();
            }
        } catch (RuntimeException e) {
            log.error("[Relay:{}] Client loop crashed", sessionId, e);
            requestStop();
        }
    }

    private void pumpServerToClient() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null && isRunning()) {
                if (line.isBlank()) {
                    continue;
                }
                relay(frame(MessageDirection.SERVER_TO_CLIENT, line));
            }
            if (isRunning()) {
                log.info("[Relay:{}] Server closed its output", sessionId);
            }
        } catch (IOException e) {
            if (isRunning()) {
                log.warn("[Relay:{}] Server loop failed: {}", sessionId, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("[Relay:{}] Server loop crashed", sessionId, e);
        } finally {
            requestStop();
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[Relay:{}] stderr: {}", sessionId, line);
            }
        } catch (IOException e) {
            log.debug("[Relay:{}] Stderr drain ended: {}", sessionId, e.getMessage());
        }
    }

    private void awaitServerExit() {
        try {
            if (!process.waitFor(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.info("[Relay:{}] Server still running after client EOF, stopping", sessionId);
                requestStop();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
        }
    }

    // ==================== FRAME HANDLING ====================

    private ProxyMessage frame(MessageDirection direction, String line) {
        return ProxyMessage.builder()
                .direction(direction)
                .rawJson(line)
                .transport(Transport.STDIO)
                .sessionId(sessionId)
                .command(command)
                .args(args)
                .build();
    }

    private void relay(ProxyMessage message) throws IOException {
        boolean fromClient = message.getDirection() == MessageDirection.CLIENT_TO_SERVER;
        log.debug("[Relay:{}] {} {}", sessionId, fromClient ? "→" : "←", message.getRawJson());

        String outbound = message.getRawJson();
        if (chain.hasProcessors()) {
            JsonNode frame = parseOrNull(message);
            if (frame instanceof ArrayNode batch) {
                relayBatch(message, batch);
                return;
            }
            if (frame instanceof ObjectNode payload) {
                message.setType(MessageType.classify(payload));
                ChainResult result = chain.execute(message.getType(), payload);
                if (!result.isSuccess()) {
                    handleRejection(message, payload.get("id"), result);
                    return;
                }
                outbound = objectMapper.writeValueAsString(result.getPayload());
            }
        }

        record(fromClient ? ProxyEvent.EventKind.REQUEST : ProxyEvent.EventKind.RESPONSE, message.getDirection(),
                message.getType(), outbound, true, null);
        if (fromClient) {
            writeToServer(outbound);
        } else {
            writeToClient(outbound);
        }
    }

    private void relayBatch(ProxyMessage message, ArrayNode batch) throws IOException {
        boolean fromClient = message.getDirection() == MessageDirection.CLIENT_TO_SERVER;
        ProxyEvent.EventKind kind = fromClient ? ProxyEvent.EventKind.REQUEST : ProxyEvent.EventKind.RESPONSE;
        BatchResult result = chain.executeBatch(batch);
        if (result.hasRejections()) {
            log.warn("[Relay:{}] {} of {} batch element(s) rejected: {}", sessionId, result.getRejections().size(),
                    batch.size(), result.getRejections().get(0).getError());
            record(kind, message.getDirection(), null, message.getRawJson(), false,
                    result.getRejections().get(0).getError());
        }
        if (!result.getForward().isEmpty()) {
            String outbound = objectMapper.writeValueAsString(result.getForward());
            record(kind, message.getDirection(), null, outbound, true, null);
            if (fromClient) {
                writeToServer(outbound);
            } else {
                writeToClient(outbound);
            }
        }
        if (!result.getReplies().isEmpty()) {
            String replies = objectMapper.writeValueAsString(result.getReplies());
            if (fromClient) {
                writeToClient(replies);
            } else {
                writeToServer(replies);
            }
        }
    }

    private JsonNode parseOrNull(ProxyMessage message) {
        try {
            return chain.parseFrame(message.getRawJson());
        } catch (PayloadParseException e) {
            log.warn("[Relay:{}] Forwarding unparseable frame unmodified: {}", sessionId, e.getMessage());
            return null;
        }
    }

    private void handleRejection(ProxyMessage message, JsonNode id, ChainResult result) throws IOException {
        boolean fromClient = message.getDirection() == MessageDirection.CLIENT_TO_SERVER;
        String sender = fromClient ? "Client" : "Server";
        record(fromClient ? ProxyEvent.EventKind.REQUEST : ProxyEvent.EventKind.RESPONSE, message.getDirection(),
                message.getType(), message.getRawJson(), false, result.getError());

        switch (message.getType()) {
        case REQUEST -> {
            log.warn("[Relay:{}] {} request {} rejected (status {}): {}", sessionId, sender, id, result.getStatus(),
                    result.getError());
            String error = objectMapper.writeValueAsString(McpErrorFormatter.format(result, id));
            if (fromClient) {
                writeToClient(error);
            } else {
                writeToServer(error);
            }
        }
        case NOTIFICATION -> log.warn("[Relay:{}] {} notification absorbed (status {}): {}", sessionId, sender,
                result.getStatus(), result.getError());
        default -> {
            log.warn("[Relay:{}] {} {} replaced by error (status {}): {}", sessionId, sender,
                    message.getType().getValue(), result.getStatus(), result.getError());
            String error = objectMapper.writeValueAsString(McpErrorFormatter.format(result, id));
            if (fromClient) {
                writeToServer(error);
            } else {
                writeToClient(error);
            }
        }
        }
    }

    private void writeToServer(String line) throws IOException {
        synchronized (serverWriter) {
            serverWriter.write(line);
            serverWriter.newLine();
            serverWriter.flush();
        }
    }

    private void writeToClient(String line) throws IOException {
        synchronized (clientWriteLock) {
            if (clientWriter == null) {
                clientWriter = new BufferedWriter(new OutputStreamWriter(client.output(), StandardCharsets.UTF_8));
            }
            clientWriter.write(line);
            clientWriter.newLine();
            clientWriter.flush();
        }
    }

    // ==================== SHUTDOWN ====================

    private void closeServerInput() {
        if (serverWriter == null) {
            return;
        }
        synchronized (serverWriter) {
            try {
                serverWriter.close();
            } catch (IOException e) {
                log.debug("[Relay:{}] Error closing server stdin: {}", sessionId, e.getMessage());
            }
        }
    }

    private int terminateProcess() {
        if (process.isAlive()) {
            process.destroy();
        }
        try {
            if (!process.waitFor(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Relay:{}] Server did not exit within {} ms, killing", sessionId, shutdownGraceMs);
                process.destroyForcibly();
                process.waitFor(shutdownGraceMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        return process.isAlive() ? -1 : process.exitValue();
    }

    private void closeClient() {
        try {
            client.close();
        } catch (IOException e) {
            log.debug("[Relay:{}] Error closing client channel {}: {}", sessionId, client.describe(),
                    e.getMessage());
        }
    }

    private void joinLoop(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(loopJoinTimeoutMs);
            if (thread.isAlive()) {
                log.debug("[Relay:{}] {} still blocked after {} ms", sessionId, thread.getName(),
                        loopJoinTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void releaseProcessStreams() {
        try {
            process.getInputStream().close();
            process.getErrorStream().close();
        } catch (IOException e) {
            log.debug("[Relay:{}] Error releasing process streams: {}", sessionId, e.getMessage());
        }
    }

    private static Thread startThread(String name, Runnable task) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void record(ProxyEvent.EventKind kind, MessageDirection direction, MessageType type, String message,
            boolean success, String error) {
        activityLog.record(ProxyEvent.builder()
                .kind(kind)
                .sessionId(sessionId)
                .serverId(serverId)
                .transport(Transport.STDIO)
                .direction(direction)
                .messageType(type)
                .success(success)
                .error(error)
                .message(message)
                .command(command)
                .args(args)
                .build());
    }
}
