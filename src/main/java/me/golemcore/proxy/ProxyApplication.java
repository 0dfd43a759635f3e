package me.golemcore.proxy;

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

import me.golemcore.proxy.adapter.inbound.command.ProxyCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for the GolemCore MCP proxy.
 *
 * <p>
 * The proxy sits between an AI client and one or more MCP tool servers and
 * routes every JSON-RPC frame through an ordered chain of external processor
 * programs that may inspect, rewrite or reject it.
 *
 * <h2>Modes</h2>
 * <ul>
 * <li><b>stdio</b> - spawns a tool server and relays its stdin/stdout, either
 * directly or through the background daemon</li>
 * <li><b>server</b> - exposes {@code /mcp/<gateway>/<server>} HTTP endpoints in
 * front of remote tool servers</li>
 * <li><b>daemon</b> - a singleton background process hosting many stdio relays
 * behind a loopback control port</li>
 * </ul>
 *
 * <p>
 * Only the {@code server} mode starts the reactive web server. Every other mode
 * runs with {@link WebApplicationType#NONE} and exits once its command has
 * finished.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProxyApplication {

    public static void main(String[] args) {
        boolean serverMode = ProxyCommandRunner.isServerMode(args);

        SpringApplication application = new SpringApplication(ProxyApplication.class);
        application.setWebApplicationType(serverMode ? WebApplicationType.REACTIVE : WebApplicationType.NONE);
        // Tool-server arguments such as --config=x must not leak into the environment
        application.setAddCommandLineProperties(false);

        ConfigurableApplicationContext context = application.run(args);
        if (!serverMode) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
