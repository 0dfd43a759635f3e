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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.ProcessorChain;
import me.golemcore.proxy.domain.processor.ProcessorChainFactory;
import me.golemcore.proxy.domain.service.ProxyConfigService;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Creates {@link StdioRelay} instances wired with the global processor chain
 * and the configured shutdown timings.
 *
 * <p>
 * Session ids have the form {@code session_<nanos>}, server ids
 * {@code stdio_<command name>_<nanos>}.
 */
@Component
@RequiredArgsConstructor
public class StdioRelayFactory {

    private final ProxyProperties properties;
    private final ProxyConfigService configService;
    private final ProcessorChainFactory chainFactory;
    private final ActivityLogPort activityLog;
    private final ObjectMapper objectMapper;

    public StdioRelay create(String command, List<String> args, ClientChannel client) {
        return create(command, args, Map.of(), client);
    }

    public StdioRelay create(String command, List<String> args, Map<String, String> environment,
            ClientChannel client) {
        long nanos = System.nanoTime();
        String sessionId = "session_" + nanos;
        String commandName = commandName(command);
        ProcessorChain chain = chainFactory.create(configService.getGlobalProcessors(), commandName,
                Transport.STDIO, sessionId);

        ProxyProperties.StdioProperties stdio = properties.getStdio();
        return StdioRelay.builder()
                .serverId("stdio_" + commandName + "_" + nanos)
                .sessionId(sessionId)
                .command(command)
                .args(args)
                .environment(environment)
                .chain(chain)
                .client(client)
                .activityLog(activityLog)
                .objectMapper(objectMapper)
                .shutdownGraceMs(stdio.getShutdownGrace())
                .loopJoinTimeoutMs(stdio.getLoopJoinTimeout())
                .build();
    }

    static String commandName(String command) {
        Path fileName = Path.of(command).getFileName();
        return fileName != null ? fileName.toString() : command;
    }
}
