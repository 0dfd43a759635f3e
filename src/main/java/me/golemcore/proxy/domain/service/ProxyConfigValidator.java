package me.golemcore.proxy.domain.service;

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

import me.golemcore.proxy.domain.model.GatewayConfig;
import me.golemcore.proxy.domain.model.McpServerConfig;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorType;
import me.golemcore.proxy.domain.model.ProxyConfig;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural validation of a {@link ProxyConfig}. Every problem is reported
 * as a {@link ConfigurationException} naming the offending entry.
 *
 * <p>
 * Processor kinds are checked here, for disabled processors too, so a typo in
 * a kind surfaces at load time instead of on the first frame.
 */
@Component
public class ProxyConfigValidator {

    private static final Pattern URL_SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    public void validate(ProxyConfig config) {
        if (config.getVersion() == null || config.getVersion().isBlank()) {
            throw new ConfigurationException("version is required");
        }
        validateProcessors("global", config.getProcessors());

        Map<String, GatewayConfig> gateways = config.getGateways();
        if (gateways == null) {
            return;
        }
        for (Map.Entry<String, GatewayConfig> gateway : gateways.entrySet()) {
            String gatewayName = gateway.getKey();
            if (!URL_SAFE_NAME.matcher(gatewayName).matches()) {
                throw new ConfigurationException(String.format(
                        "gateway name '%s' must contain only letters, digits, '-' and '_'", gatewayName));
            }
            GatewayConfig gatewayConfig = gateway.getValue();
            if (gatewayConfig == null) {
                throw new ConfigurationException(String.format("gateway '%s' has no configuration", gatewayName));
            }
            validateProcessors("gateway '" + gatewayName + "'", gatewayConfig.getProcessors());
            if (gatewayConfig.getMcpServers() == null) {
                continue;
            }
            for (Map.Entry<String, McpServerConfig> server : gatewayConfig.getMcpServers().entrySet()) {
                validateServer(gatewayName, server.getKey(), server.getValue());
            }
        }
    }

    /**
     * Additional rules for running the HTTP relay: at least one gateway, and
     * every enabled server reachable over HTTP.
     */
    public void validateForHttpServer(ProxyConfig config) {
        validate(config);
        if (config.getGateways() == null || config.getGateways().isEmpty()) {
            throw new ConfigurationException("at least one gateway is required to start the HTTP server");
        }
        config.getGateways().forEach((gatewayName, gateway) -> {
            if (gateway.getMcpServers() == null) {
                return;
            }
            gateway.getMcpServers().forEach((serverName, server) -> {
                if (server.isActive() && !server.isHttp()) {
                    throw new ConfigurationException(String.format(
                            "server '%s' in gateway '%s' has no url; the HTTP server can only relay to HTTP servers",
                            serverName, gatewayName));
                }
            });
        });
    }

    public void validateProcessors(String scope, List<ProcessorConfig> processors) {
        if (processors == null) {
            return;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < processors.size(); i++) {
            ProcessorConfig processor = processors.get(i);
            if (processor == null) {
                throw new ConfigurationException(String.format("%s processor %d is empty", scope, i));
            }
            String name = processor.getName();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(String.format("%s processor %d: name is required", scope, i));
            }
            if (!names.add(name)) {
                throw new ConfigurationException(
                        String.format("%s processor '%s': duplicate processor name", scope, name));
            }
            if (processor.getType() == null || processor.getType().isBlank()) {
                throw new ConfigurationException(String.format("%s processor '%s': type is required", scope, name));
            }
            if (ProcessorType.fromValue(processor.getType()).isEmpty()) {
                throw new ConfigurationException(String.format(
                        "%s processor '%s': unsupported processor type '%s'", scope, name, processor.getType()));
            }
            if (processor.getTimeout() < 0) {
                throw new ConfigurationException(
                        String.format("%s processor '%s': timeout must not be negative", scope, name));
            }
            validateCommandConfig(scope, name, processor.getConfig());
        }
    }

    private void validateCommandConfig(String scope, String name, Map<String, Object> settings) {
        if (settings == null || settings.isEmpty()) {
            throw new ConfigurationException(String.format("%s processor '%s': config is required", scope, name));
        }
        Object command = settings.get("command");
        if (!(command instanceof String executable) || executable.isBlank()) {
            throw new ConfigurationException(
                    String.format("%s processor '%s': config.command must be a non-empty string", scope, name));
        }
        Object args = settings.get("args");
        if (args != null && (!(args instanceof List<?> argList)
                || argList.stream().anyMatch(arg -> !(arg instanceof String)))) {
            throw new ConfigurationException(
                    String.format("%s processor '%s': config.args must be an array of strings", scope, name));
        }
    }

    private void validateServer(String gatewayName, String serverName, McpServerConfig server) {
        String where = String.format("server '%s' in gateway '%s'", serverName, gatewayName);
        if (!URL_SAFE_NAME.matcher(serverName).matches()) {
            throw new ConfigurationException(where + ": name must contain only letters, digits, '-' and '_'");
        }
        if (server == null) {
            throw new ConfigurationException(where + " has no configuration");
        }
        boolean hasCommand = server.getCommand() != null && !server.getCommand().isBlank();
        boolean hasUrl = server.isHttp();
        if (hasCommand == hasUrl) {
            throw new ConfigurationException(where + ": exactly one of command or url is required");
        }
        if (hasUrl) {
            validateUrl(where, server.getUrl());
        }
        if (server.getHeaders() != null) {
            server.getHeaders().forEach((key, value) -> {
                if (key == null || key.isBlank() || value == null || value.isBlank()) {
                    throw new ConfigurationException(where + ": header names and values must not be empty");
                }
            });
        }
    }

    private void validateUrl(String where, String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException(where + ": url must use http or https");
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ConfigurationException(where + ": url must include a host");
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException(where + ": invalid url '" + url + "'", e);
        }
    }
}
