package me.golemcore.proxy.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process-level settings for the proxy, bound from application.yml.
 *
 * <p>
 * All settings live under the {@code proxy.*} prefix:
 * <ul>
 * <li>{@link ProcessorsProperties} - defaults for external processor
 * programs</li>
 * <li>{@link StdioProperties} - stdio relay shutdown timing</li>
 * <li>{@link DaemonProperties} - control port and client timeouts</li>
 * <li>{@link HttpProperties} - downstream HTTP client tuning</li>
 * </ul>
 *
 * <p>
 * The operator's gateway/server/processor document is not bound here; it is
 * loaded from {@link #configPath} by
 * {@link me.golemcore.proxy.domain.service.ProxyConfigService}. Durations are
 * in milliseconds, timeouts of processors in seconds.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "proxy")
@Data
public class ProxyProperties {

    private String configPath = "${user.home}/.golemcore-proxy/config.json";
    private String logsDir = "${user.home}/.golemcore-proxy/logs";
    private ProcessorsProperties processors = new ProcessorsProperties();
    private StdioProperties stdio = new StdioProperties();
    private DaemonProperties daemon = new DaemonProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Expands a leading {@code ${user.home}} placeholder left in a default value
     * and normalizes the result.
     */
    public static Path resolvePath(String configured) {
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
    }

    @Data
    public static class ProcessorsProperties {
        private String workingDir = "${user.home}";
        private int defaultTimeoutSeconds = 15;
    }

    @Data
    public static class StdioProperties {
        private String defaultCommand = "npx";
        private long shutdownGrace = 5000;
        private long loopJoinTimeout = 2000;
    }

    @Data
    public static class DaemonProperties {
        private String host = "127.0.0.1";
        private int port = 47821;
        private long stopDelay = 100;
        private long clientTimeout = 30000;
        private long livenessTimeout = 1000;
        private long readTimeout = 10000;
        private long attachTimeout = 60000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private int maxBodySize = 10 * 1024 * 1024;
    }
}
