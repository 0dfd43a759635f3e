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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.GatewayConfig;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProxyConfig;
import me.golemcore.proxy.domain.model.ProxySettings;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the operator's {@link ProxyConfig} from {@code proxy.config-path}.
 *
 * <p>
 * The document is read once (lazy-loaded, cached) and validated with
 * {@link ProxyConfigValidator}. A missing file yields the default
 * configuration: no gateways and no processors, so relays forward frames
 * unchanged. An unreadable or invalid file is a {@link ConfigurationException}.
 */
@Service
@Slf4j
public class ProxyConfigService {

    private final ProxyProperties properties;
    private final ObjectMapper objectMapper;
    private final ProxyConfigValidator validator;

    private final AtomicReference<ProxyConfig> configRef = new AtomicReference<>();

    public ProxyConfigService(ProxyProperties properties, ObjectMapper objectMapper,
            ProxyConfigValidator validator) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public ProxyConfig getConfig() {
        ProxyConfig current = configRef.get();
        if (current == null) {
            synchronized (this) {
                current = configRef.get();
                if (current == null) {
                    current = load(ProxyProperties.resolvePath(properties.getConfigPath()));
                    configRef.set(current);
                }
            }
        }
        return current;
    }

    public ProxyConfig load(Path path) {
        if (!Files.exists(path)) {
            log.info("[Config] No configuration at {}, using defaults", path);
            return ProxyConfig.builder().build();
        }
        ProxyConfig config;
        try {
            config = objectMapper.readValue(path.toFile(), ProxyConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read configuration " + path + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("configuration " + path + " is empty");
        }
        normalize(config);
        validator.validate(config);
        log.info("[Config] Loaded {} gateway(s) and {} global processor(s) from {}",
                config.getGateways().size(), config.getProcessors().size(), path);
        return config;
    }

    /**
     * Processors applied to stdio relays, which are not bound to a gateway.
     */
    public List<ProcessorConfig> getGlobalProcessors() {
        return List.copyOf(getConfig().getProcessors());
    }

    /**
     * Global processors followed by the gateway's own processors.
     */
    public List<ProcessorConfig> getProcessorsForGateway(String gatewayName) {
        ProxyConfig config = getConfig();
        List<ProcessorConfig> merged = new ArrayList<>(config.getProcessors());
        GatewayConfig gateway = config.getGateways().get(gatewayName);
        if (gateway != null && gateway.getProcessors() != null) {
            merged.addAll(gateway.getProcessors());
        }
        return merged;
    }

    private void normalize(ProxyConfig config) {
        if (config.getProxy() == null) {
            config.setProxy(new ProxySettings());
        }
        if (config.getProcessors() == null) {
            config.setProcessors(new ArrayList<>());
        }
        if (config.getGateways() == null) {
            config.setGateways(new LinkedHashMap<>());
        }
        int defaultTimeout = properties.getProcessors().getDefaultTimeoutSeconds();
        config.getProcessors().forEach(processor -> applyDefaultTimeout(processor, defaultTimeout));
        config.getGateways().values().forEach(gateway -> {
            if (gateway != null && gateway.getProcessors() != null) {
                gateway.getProcessors().forEach(processor -> applyDefaultTimeout(processor, defaultTimeout));
            }
        });
    }

    private static void applyDefaultTimeout(ProcessorConfig processor, int defaultTimeout) {
        if (processor != null && processor.getTimeout() == 0) {
            processor.setTimeout(defaultTimeout);
        }
    }
}
