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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * Client channel for relays hosted by the daemon.
 *
 * <p>
 * Binds an ephemeral loopback port on construction and accepts exactly one
 * attachment, lazily, the first time either stream is requested. The
 * listening socket is closed as soon as the client is attached. If nobody
 * attaches within the attach timeout, the stream request fails and the relay
 * shuts down.
 */
@Slf4j
public class LoopbackSocketChannel implements ClientChannel {

    private final ServerSocket serverSocket;
    private final int attachTimeoutMs;
    private final Object attachLock = new Object();
    private volatile Socket socket;
    private volatile boolean closed;

    public LoopbackSocketChannel(String host, long attachTimeoutMs) throws IOException {
        this.serverSocket = new ServerSocket();
        this.serverSocket.bind(new InetSocketAddress(InetAddress.getByName(host), 0), 1);
        this.attachTimeoutMs = (int) Math.min(Integer.MAX_VALUE, attachTimeoutMs);
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public InputStream input() throws IOException {
        return awaitClient().getInputStream();
    }

    @Override
    public OutputStream output() throws IOException {
        return awaitClient().getOutputStream();
    }

    @Override
    public String describe() {
        return "loopback port " + getPort();
    }

    private Socket awaitClient() throws IOException {
        synchronized (attachLock) {
            if (socket != null) {
                return socket;
            }
            if (closed) {
                throw new IOException("channel closed before a client attached");
            }
            serverSocket.setSoTimeout(attachTimeoutMs);
            try {
                Socket accepted = serverSocket.accept();
                accepted.setTcpNoDelay(true);
                socket = accepted;
                log.debug("[Channel] Client attached on port {} from {}", getPort(),
                        accepted.getRemoteSocketAddress());
                return accepted;
            } catch (SocketTimeoutException e) {
                throw new IOException("no client attached within " + attachTimeoutMs + " ms", e);
            } finally {
                serverSocket.close();
            }
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        IOException failure = null;
        try {
            serverSocket.close();
        } catch (IOException e) {
            failure = e;
        }
        Socket current = socket;
        if (current != null) {
            current.close();
        }
        if (failure != null) {
            throw failure;
        }
    }
}
