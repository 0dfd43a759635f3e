package me.golemcore.proxy.adapter.inbound.command;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StreamBridgeTest {

    @Test
    void copiesBothDirectionsUntilRelayCloses() throws Exception {
        try (ServerSocket relaySocket = new ServerSocket(0)) {
            Thread relay = new Thread(() -> {
                try (Socket socket = relaySocket.accept()) {
                    byte[] received = socket.getInputStream().readAllBytes();
                    OutputStream out = socket.getOutputStream();
                    out.write(new String(received, StandardCharsets.UTF_8).toUpperCase()
                            .getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    fail(e);
                }
            });
            relay.start();

            InputStream input = new ByteArrayInputStream("line one\nline two\n".getBytes(StandardCharsets.UTF_8));
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            new StreamBridge("127.0.0.1", relaySocket.getLocalPort(), input, output).run(5000);

            relay.join(5000);
            assertEquals("LINE ONE\nLINE TWO\n", output.toString(StandardCharsets.UTF_8));
        }
    }

    @Test
    void refusedConnectionThrows() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        StreamBridge bridge = new StreamBridge("127.0.0.1", port, new ByteArrayInputStream(new byte[0]),
                new ByteArrayOutputStream());

        assertThrows(IOException.class, () -> bridge.run(1000));
    }
}
