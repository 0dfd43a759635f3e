package me.golemcore.proxy.adapter.inbound.http;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.GatewayConfig;
import me.golemcore.proxy.domain.model.McpServerConfig;
import me.golemcore.proxy.domain.model.MessageDirection;
import me.golemcore.proxy.domain.model.ProxyConfig;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.ProcessorChainFactory;
import me.golemcore.proxy.domain.service.ConfigurationException;
import me.golemcore.proxy.domain.service.EnvSubstitution;
import me.golemcore.proxy.domain.service.ProxyConfigService;
import me.golemcore.proxy.domain.service.ProxyConfigValidator;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import okhttp3.HttpUrl;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@code /mcp/<gateway>/<server>} endpoints and the aggregated
 * {@code /mcp/<gateway>} endpoints from the proxy configuration at startup.
 *
 * <p>
 * Each server endpoint gets its own processor chain: the global processors
 * followed by the gateway's processors. Disabled servers get no endpoint. A
 * gateway with at least one active server also gets an aggregated endpoint
 * over those servers. A
 * configuration without gateways, or with an enabled server lacking a URL,
 * fails startup with a {@link ConfigurationException}.
 */
@Component
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@RequiredArgsConstructor
@Slf4j
public class HttpRelayRegistry {

    private final ProxyConfigService configService;
    private final ProxyConfigValidator validator;
    private final ProcessorChainFactory chainFactory;
    private final ActivityLogPort activityLog;

    private final Map<String, HttpRelayEndpoint> endpoints = new LinkedHashMap<>();
    private final Map<String, AggregatedGateway> gateways = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        ProxyConfig config = configService.getConfig();
        validator.validateForHttpServer(config);

        for (Map.Entry<String, GatewayConfig> gateway : config.getGateways().entrySet()) {
            Map<String, HttpRelayEndpoint> servers = new LinkedHashMap<>();
            for (Map.Entry<String, McpServerConfig> server : gateway.getValue().getMcpServers().entrySet()) {
                register(gateway.getKey(), server.getKey(), server.getValue())
                        .ifPresent(endpoint -> servers.put(endpoint.getServer(), endpoint));
            }
            if (!servers.isEmpty()) {
                registerGateway(gateway.getKey(), servers);
            }
        }
        log.info("[HttpRelay] {} endpoint(s) and {} gateway(s) ready", endpoints.size(), gateways.size());
    }

    private Optional<HttpRelayEndpoint> register(String gatewayName, String serverName, McpServerConfig server) {
        if (!server.isActive()) {
            log.info("[HttpRelay] Skipping disabled server {}/{}", gatewayName, serverName);
            return Optional.empty();
        }
        HttpUrl target = HttpUrl.parse(server.getUrl());
        if (target == null) {
            throw new ConfigurationException(String.format("server '%s' in gateway '%s' has an invalid url '%s'",
                    serverName, gatewayName, server.getUrl()));
        }

        String path = "/mcp/" + gatewayName + "/" + serverName;
        String sessionId = "http_endpoint_mcp_" + gatewayName + "_" + serverName + "_" + System.nanoTime();
        HttpRelayEndpoint endpoint = HttpRelayEndpoint.builder()
                .gateway(gatewayName)
                .server(serverName)
                .path(path)
                .sessionId(sessionId)
                .target(target)
                .headers(Collections.unmodifiableMap(EnvSubstitution.expandValues(server.getHeaders())))
                .chain(chainFactory.create(configService.getProcessorsForGateway(gatewayName), serverName,
                        Transport.HTTP, sessionId))
                .build();
        endpoints.put(key(gatewayName, serverName), endpoint);

        log.info("[HttpRelay] {} -> {}", path, target);
        record(endpoint.getSessionId(), endpoint.getGateway() + "/" + endpoint.getServer(), endpoint.getPath(),
                ProxyEvent.EventKind.START);
        return Optional.of(endpoint);
    }

    private void registerGateway(String gatewayName, Map<String, HttpRelayEndpoint> servers) {
        AggregatedGateway gateway = AggregatedGateway.builder()
                .gateway(gatewayName)
                .path("/mcp/" + gatewayName)
                .sessionId("http_gateway_mcp_" + gatewayName + "_" + System.nanoTime())
                .servers(Collections.unmodifiableMap(servers))
                .build();
        gateways.put(gatewayName, gateway);

        log.info("[HttpRelay] {} -> {}", gateway.getPath(), servers.keySet());
        record(gateway.getSessionId(), gatewayName, gateway.getPath(), ProxyEvent.EventKind.START);
    }

    public Optional<HttpRelayEndpoint> find(String gateway, String server) {
        return Optional.ofNullable(endpoints.get(key(gateway, server)));
    }

    public Optional<AggregatedGateway> findGateway(String gateway) {
        return Optional.ofNullable(gateways.get(gateway));
    }

    public Collection<HttpRelayEndpoint> getEndpoints() {
        return Collections.unmodifiableCollection(endpoints.values());
    }

    public Collection<AggregatedGateway> getGateways() {
        return Collections.unmodifiableCollection(gateways.values());
    }

    @PreDestroy
    public void shutdown() {
        endpoints.values().forEach(endpoint -> record(endpoint.getSessionId(),
                endpoint.getGateway() + "/" + endpoint.getServer(), endpoint.getPath(), ProxyEvent.EventKind.STOP));
        gateways.values().forEach(gateway -> record(gateway.getSessionId(), gateway.getGateway(), gateway.getPath(),
                ProxyEvent.EventKind.STOP));
    }

    private void record(String sessionId, String serverId, String path, ProxyEvent.EventKind kind) {
        activityLog.record(ProxyEvent.builder()
                .kind(kind)
                .sessionId(sessionId)
                .serverId(serverId)
                .transport(Transport.HTTP)
                .direction(MessageDirection.SYSTEM)
                .endpoint(path)
                .success(true)
                .build());
    }

    private static String key(String gateway, String server) {
        return gateway + "/" + server;
    }
}
