package me.golemcore.proxy.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ProxySettings;
import me.golemcore.proxy.domain.service.ConfigurationException;
import me.golemcore.proxy.domain.service.ProxyConfigService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.reactive.server.ConfigurableReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Binds the HTTP relay to {@code proxy.host}/{@code proxy.port} of the proxy
 * configuration document (default {@code 127.0.0.1:8080}).
 */
@Component
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@RequiredArgsConstructor
@Slf4j
public class HttpServerConfig implements WebServerFactoryCustomizer<ConfigurableReactiveWebServerFactory> {

    private final ProxyConfigService configService;

    @Override
    public void customize(ConfigurableReactiveWebServerFactory factory) {
        ProxySettings settings = configService.getConfig().getProxy();
        try {
            factory.setAddress(InetAddress.getByName(settings.getHost()));
        } catch (UnknownHostException e) {
            throw new ConfigurationException("invalid proxy.host '" + settings.getHost() + "'", e);
        }
        factory.setPort(settings.getPort());
        log.info("[HttpRelay] Listening on {}:{}", settings.getHost(), settings.getPort());
    }
}
