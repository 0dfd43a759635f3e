package me.golemcore.proxy.adapter.inbound.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.adapter.inbound.daemon.DaemonAlreadyRunningException;
import me.golemcore.proxy.adapter.inbound.daemon.DaemonServer;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelayFactory;
import me.golemcore.proxy.adapter.outbound.daemon.DaemonClient;
import me.golemcore.proxy.domain.model.DaemonResponse;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.BindException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProxyCommandRunnerTest {

    private DaemonClient daemonClient;
    private DaemonServer daemonServer;
    private StdioRelayFactory relayFactory;
    private ByteArrayOutputStream output;
    private ProxyCommandRunner runner;

    @BeforeEach
    void setUp() {
        daemonClient = mock(DaemonClient.class);
        daemonServer = mock(DaemonServer.class);
        relayFactory = mock(StdioRelayFactory.class);
        output = new ByteArrayOutputStream();
        runner = new ProxyCommandRunner(new ProxyProperties(), relayFactory, daemonClient, daemonServer,
                new ObjectMapper())
                .withStreams(new ByteArrayInputStream(new byte[0]),
                        new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void detectsServerMode() {
        assertTrue(ProxyCommandRunner.isServerMode(new String[] { "server" }));
        assertFalse(ProxyCommandRunner.isServerMode(new String[] { "stdio", "server" }));
        assertFalse(ProxyCommandRunner.isServerMode(new String[0]));
    }

    @Test
    void missingCommandIsUsageError() throws Exception {
        assertEquals(ProxyCommandRunner.EXIT_USAGE, runner.dispatch(new String[0]));
        assertEquals(ProxyCommandRunner.EXIT_USAGE, runner.dispatch(new String[] { "bogus" }));
        assertEquals(ProxyCommandRunner.EXIT_USAGE, runner.dispatch(new String[] { "daemon", "restart" }));
        verifyNoInteractions(daemonClient, daemonServer, relayFactory);
    }

    @Test
    void cmdOptionWithoutValueIsUsageError() throws Exception {
        assertEquals(ProxyCommandRunner.EXIT_USAGE, runner.dispatch(new String[] { "stdio", "--cmd" }));
        verifyNoInteractions(relayFactory);
    }

    @Test
    void statusWithoutDaemonFails() throws Exception {
        when(daemonClient.isDaemonRunning()).thenReturn(false);

        assertEquals(ProxyCommandRunner.EXIT_FAILURE, runner.dispatch(new String[] { "daemon", "status" }));
        verify(daemonClient, never()).status();
        assertEquals(0, output.size());
    }

    @Test
    void statusPrintsDaemonResponse() throws Exception {
        when(daemonClient.isDaemonRunning()).thenReturn(true);
        when(daemonClient.status()).thenReturn(DaemonResponse.builder()
                .success(true)
                .data(Map.of("servers", List.of()))
                .build());

        assertEquals(ProxyCommandRunner.EXIT_OK, runner.dispatch(new String[] { "daemon", "status" }));
        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("\"success\" : true"));
        assertTrue(printed.contains("\"servers\""));
    }

    @Test
    void stopReportsFailureResponse() throws Exception {
        when(daemonClient.isDaemonRunning()).thenReturn(true);
        when(daemonClient.stop()).thenReturn(DaemonResponse.failure("busy"));

        assertEquals(ProxyCommandRunner.EXIT_FAILURE, runner.dispatch(new String[] { "daemon", "stop" }));
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("busy"));
    }

    @Test
    void startWhileRunningExitsWithDistinctCode() throws Exception {
        doThrow(new DaemonAlreadyRunningException(47821, new BindException("Address already in use")))
                .when(daemonServer).start();

        assertEquals(ProxyCommandRunner.EXIT_ALREADY_RUNNING, runner.dispatch(new String[] { "daemon", "start" }));
        verify(daemonServer, never()).awaitShutdown();
    }

    @Test
    void startBlocksUntilShutdown() throws Exception {
        assertEquals(ProxyCommandRunner.EXIT_OK, runner.dispatch(new String[] { "daemon", "start" }));

        verify(daemonServer).start();
        verify(daemonServer).awaitShutdown();
    }

    @Test
    void failedAttachReturnsFailure() throws Exception {
        when(daemonClient.isDaemonRunning()).thenReturn(true);
        when(daemonClient.startStdioProxy(anyString(), anyList())).thenReturn(DaemonResponse.failure("spawn failed"));

        assertEquals(ProxyCommandRunner.EXIT_FAILURE,
                runner.dispatch(new String[] { "stdio", "--cmd", "uvx", "mcp-server-git" }));
        verify(daemonClient).startStdioProxy("uvx", List.of("mcp-server-git"));
        verify(relayFactory, never()).create(anyString(), anyList(), any());
    }

    @Test
    void attachesToDaemonHostedRelay() throws Exception {
        try (ServerSocket relaySocket = new ServerSocket(0)) {
            Thread relay = new Thread(() -> {
                try (Socket socket = relaySocket.accept()) {
                    BufferedReader reader = new BufferedReader(
                            new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                    String line = reader.readLine();
                    OutputStream out = socket.getOutputStream();
                    out.write(("{\"echo\":" + line + "}\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (Exception e) {
                    fail(e);
                }
            });
            relay.start();

            when(daemonClient.isDaemonRunning()).thenReturn(true);
            when(daemonClient.getHost()).thenReturn("127.0.0.1");
            when(daemonClient.startStdioProxy(anyString(), anyList())).thenReturn(DaemonResponse.builder()
                    .success(true)
                    .serverId("stdio_1")
                    .port(relaySocket.getLocalPort())
                    .build());

            runner.withStreams(new ByteArrayInputStream("{\"id\":1}\n".getBytes(StandardCharsets.UTF_8)),
                    new PrintStream(output, true, StandardCharsets.UTF_8));
            int exit = runner.dispatch(new String[] { "stdio", "-y", "@modelcontextprotocol/server-memory" });

            relay.join(5000);
            assertEquals(ProxyCommandRunner.EXIT_OK, exit);
            assertEquals("{\"echo\":{\"id\":1}}\n", output.toString(StandardCharsets.UTF_8));
            verify(daemonClient).startStdioProxy("npx", List.of("-y", "@modelcontextprotocol/server-memory"));
        }
    }
}
