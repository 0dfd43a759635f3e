package me.golemcore.proxy.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator configuration document: gateways of MCP servers plus the global
 * processor chain applied to every relay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyConfig {

    @Builder.Default
    private String name = "golemcore-proxy";

    @Builder.Default
    private String version = "1.0";

    @Builder.Default
    private ProxySettings proxy = new ProxySettings();

    @Builder.Default
    private Map<String, GatewayConfig> gateways = new LinkedHashMap<>();

    @Builder.Default
    private List<ProcessorConfig> processors = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
