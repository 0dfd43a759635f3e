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
import me.golemcore.proxy.domain.service.ProxyConfigService;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} used to reach downstream MCP servers.
 *
 * <p>
 * Timeouts and pool sizing come from {@code proxy.http.*}. The client adds
 * {@code Accept-Encoding: gzip} on its own and transparently inflates gzip
 * responses, so relayed bodies always reach the processor chain decoded.
 * Redirects are not followed: a downstream redirect is relayed as-is. A
 * non-zero {@code proxy.timeout} in the proxy configuration bounds each whole
 * downstream call, in seconds.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final ProxyProperties properties;
    private final ProxyConfigService configService;

    @Bean
    public OkHttpClient okHttpClient() {
        ProxyProperties.HttpProperties http = properties.getHttp();

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .followRedirects(false)
                .retryOnConnectionFailure(true);

        int callTimeout = configService.getConfig().getProxy().getTimeout();
        if (callTimeout > 0) {
            log.info("[HttpRelay] Downstream call timeout: {}s", callTimeout);
            builder.callTimeout(callTimeout, TimeUnit.SECONDS);
        }
        return builder.build();
    }
}
