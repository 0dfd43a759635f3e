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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.daemon.DaemonAlreadyRunningException;
import me.golemcore.proxy.adapter.inbound.daemon.DaemonServer;
import me.golemcore.proxy.adapter.inbound.stdio.StandardStreamsChannel;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelay;
import me.golemcore.proxy.adapter.inbound.stdio.StdioRelayFactory;
import me.golemcore.proxy.adapter.outbound.daemon.DaemonClient;
import me.golemcore.proxy.domain.model.DaemonResponse;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Dispatches the command line:
 *
 * <pre>
 * stdio [--cmd &lt;command&gt;] &lt;args...&gt;
 * server
 * daemon start|stop|status
 * </pre>
 *
 * <p>
 * {@code stdio} attaches to a running daemon when one answers on the control
 * port and relays locally otherwise. Standard output belongs to the relayed
 * protocol in that mode, so diagnostics only go to the log.
 */
@Component
@Slf4j
public class ProxyCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String STDIO_COMMAND = "stdio";
    static final String SERVER_COMMAND = "server";
    static final String DAEMON_COMMAND = "daemon";
    static final String CMD_OPTION = "--cmd";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ALREADY_RUNNING = 3;

    private final ProxyProperties properties;
    private final StdioRelayFactory relayFactory;
    private final DaemonClient daemonClient;
    private final DaemonServer daemonServer;
    private final ObjectMapper objectMapper;

    private InputStream stdin = System.in;
    private PrintStream stdout = System.out;
    private volatile int exitCode;

    public ProxyCommandRunner(ProxyProperties properties, StdioRelayFactory relayFactory, DaemonClient daemonClient,
            DaemonServer daemonServer, ObjectMapper objectMapper) {
        this.properties = properties;
        this.relayFactory = relayFactory;
        this.daemonClient = daemonClient;
        this.daemonServer = daemonServer;
        this.objectMapper = objectMapper;
    }

    ProxyCommandRunner withStreams(InputStream input, PrintStream output) {
        this.stdin = input;
        this.stdout = output;
        return this;
    }

    public static boolean isServerMode(String[] args) {
        return args.length > 0 && SERVER_COMMAND.equals(args[0]);
    }

    @Override
    public void run(ApplicationArguments arguments) throws Exception {
        exitCode = dispatch(arguments.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int dispatch(String[] args) throws IOException, InterruptedException {
        if (args.length == 0) {
            return usage();
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        return switch (args[0]) {
        case STDIO_COMMAND -> runStdio(rest);
        case SERVER_COMMAND -> EXIT_OK;
        case DAEMON_COMMAND -> runDaemon(rest);
        default -> usage();
        };
    }

    // ==================== STDIO ====================

    private int runStdio(List<String> rest) throws IOException, InterruptedException {
        String command = properties.getStdio().getDefaultCommand();
        List<String> args = rest;
        if (!rest.isEmpty() && CMD_OPTION.equals(rest.get(0))) {
            if (rest.size() < 2) {
                log.error("{} requires a value", CMD_OPTION);
                return EXIT_USAGE;
            }
            command = rest.get(1);
            args = rest.subList(2, rest.size());
        }

        if (daemonClient.isDaemonRunning()) {
            return runAttached(command, args);
        }
        return runDirect(command, args);
    }

    private int runAttached(String command, List<String> args) throws IOException {
        DaemonResponse response = daemonClient.startStdioProxy(command, args);
        if (!response.isSuccess() || response.getPort() == null) {
            log.error("[Daemon] Failed to start stdio proxy: {}", response.getError());
            return EXIT_FAILURE;
        }
        log.info("[Daemon] Attached to {} on port {}", response.getServerId(), response.getPort());
        new StreamBridge(daemonClient.getHost(), response.getPort(), stdin, stdout)
                .run((int) properties.getDaemon().getClientTimeout());
        return EXIT_OK;
    }

    private int runDirect(String command, List<String> args) throws IOException, InterruptedException {
        StdioRelay relay = relayFactory.create(command, args, new StandardStreamsChannel(stdin, stdout));
        relay.start();
        Thread hook = new Thread(relay::stop, "relay-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            int serverExit = relay.getTermination().get();
            return serverExit >= 0 ? serverExit : EXIT_FAILURE;
        } catch (ExecutionException e) {
            log.error("[Relay] Terminated abnormally", e.getCause());
            return EXIT_FAILURE;
        } finally {
            removeShutdownHook(hook);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down: {}", e.getMessage());
        }
    }

    // ==================== DAEMON ====================

    private int runDaemon(List<String> rest) throws IOException, InterruptedException {
        String action = rest.isEmpty() ? "" : rest.get(0);
        return switch (action) {
        case "start" -> startDaemon();
        case "stop", "status" -> printDaemonResponse(action);
        default -> usage();
        };
    }

    private int startDaemon() throws IOException, InterruptedException {
        try {
            daemonServer.start();
        } catch (DaemonAlreadyRunningException e) {
            log.error("[Daemon] {}", e.getMessage());
            return EXIT_ALREADY_RUNNING;
        }
        daemonServer.awaitShutdown();
        return EXIT_OK;
    }

    private int printDaemonResponse(String action) throws IOException {
        if (!daemonClient.isDaemonRunning()) {
            log.error("[Daemon] Not running on port {}", properties.getDaemon().getPort());
            return EXIT_FAILURE;
        }
        DaemonResponse response = "stop".equals(action) ? daemonClient.stop() : daemonClient.status();
        stdout.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        stdout.flush();
        return response.isSuccess() ? EXIT_OK : EXIT_FAILURE;
    }

    private int usage() {
        log.error("Usage: stdio [--cmd <command>] <args...> | server | daemon start|stop|status");
        return EXIT_USAGE;
    }
}
