package me.golemcore.proxy.adapter.outbound.daemon;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.DaemonRequest;
import me.golemcore.proxy.domain.model.DaemonRequestType;
import me.golemcore.proxy.domain.model.DaemonResponse;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Synchronous client for the daemon control port. Each call opens a new
 * connection, sends one request line and reads one response line.
 */
@Component
@Slf4j
public class DaemonClient {

    private final ProxyProperties.DaemonProperties settings;
    private final ObjectMapper objectMapper;

    public DaemonClient(ProxyProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getDaemon();
        this.objectMapper = objectMapper;
    }

    /**
     * Checks the control port with a short connect timeout.
     */
    public boolean isDaemonRunning() {
        try (Socket socket = new Socket()) {
            socket.connect(address(), (int) settings.getLivenessTimeout());
            return true;
        } catch (IOException e) {
            log.debug("[DaemonClient] No daemon on port {}: {}", settings.getPort(), e.getMessage());
            return false;
        }
    }

    public DaemonResponse startStdioProxy(String command, List<String> args) throws IOException {
        return send(DaemonRequest.builder()
                .type(DaemonRequestType.START_STDIO.getWireName())
                .id(requestId(DaemonRequestType.START_STDIO))
                .command(command)
                .args(args)
                .build());
    }

    public DaemonResponse status() throws IOException {
        return send(DaemonRequest.builder()
                .type(DaemonRequestType.STATUS.getWireName())
                .id(requestId(DaemonRequestType.STATUS))
                .build());
    }

    public DaemonResponse stop() throws IOException {
        return send(DaemonRequest.builder()
                .type(DaemonRequestType.STOP.getWireName())
                .id(requestId(DaemonRequestType.STOP))
                .build());
    }

    public DaemonResponse send(DaemonRequest request) throws IOException {
        int timeoutMs = (int) settings.getClientTimeout();
        try (Socket socket = new Socket()) {
            socket.connect(address(), timeoutMs);
            socket.setSoTimeout(timeoutMs);

            BufferedWriter writer = new BufferedWriter(
                    new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
            writer.write(objectMapper.writeValueAsString(request));
            writer.newLine();
            writer.flush();

            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                throw new IOException("daemon closed the connection without a response");
            }
            DaemonResponse response = objectMapper.readValue(line, DaemonResponse.class);
            log.debug("[DaemonClient] {} -> success={}", request.getType(), response.isSuccess());
            return response;
        }
    }

    public String getHost() {
        return settings.getHost();
    }

    private InetSocketAddress address() {
        return new InetSocketAddress(settings.getHost(), settings.getPort());
    }

    private static String requestId(DaemonRequestType type) {
        return type.getWireName() + "_" + System.nanoTime();
    }
}
