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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * The downstream MCP server of an endpoint could not be reached or returned an
 * unusable response.
 */
@Getter
public class DownstreamUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final transient JsonNode requestId;

    public DownstreamUnavailableException(String path, JsonNode requestId, Throwable cause) {
        super("downstream server for " + path + " unavailable: " + cause.getMessage(), cause);
        this.path = path;
        this.requestId = requestId;
    }
}
