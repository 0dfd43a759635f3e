package me.golemcore.proxy.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Attaches the local standard streams to a daemon-hosted relay: local input is
 * copied to the relay's loopback socket and everything the relay writes back
 * is copied to local output.
 */
@Slf4j
public class StreamBridge {

    private static final int BUFFER_SIZE = 8192;

    private final String host;
    private final int port;
    private final InputStream localInput;
    private final OutputStream localOutput;

    public StreamBridge(String host, int port, InputStream localInput, OutputStream localOutput) {
        this.host = host;
        this.port = port;
        this.localInput = localInput;
        this.localOutput = localOutput;
    }

    /**
     * Blocks until the relay closes its side of the socket. Local EOF
     * half-closes the socket so the relay sees end of input.
     */
    public void run(int connectTimeoutMs) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            log.debug("[Bridge] Attached to {}:{}", host, port);

            Thread upstream = new Thread(() -> copyInput(socket), "bridge-input");
            upstream.setDaemon(true);
            upstream.start();

            copy(socket.getInputStream(), localOutput);
            log.debug("[Bridge] Relay closed the connection");
        }
    }

    private void copyInput(Socket socket) {
        try {
            copy(localInput, socket.getOutputStream());
            socket.shutdownOutput();
        } catch (IOException e) {
            if (!socket.isClosed()) {
                log.warn("[Bridge] Failed to forward input: {}", e.getMessage());
            }
        }
    }

    private static void copy(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            out.flush();
        }
    }
}
