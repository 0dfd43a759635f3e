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

import lombok.Builder;
import lombok.Value;
import me.golemcore.proxy.domain.processor.ProcessorChain;
import okhttp3.HttpUrl;

import java.util.Map;

/**
 * One relayed {@code /mcp/<gateway>/<server>} endpoint and its downstream
 * target. Headers are already environment-substituted.
 */
@Value
@Builder
public class HttpRelayEndpoint {

    String gateway;
    String server;
    String path;
    String sessionId;
    HttpUrl target;
    Map<String, String> headers;
    ProcessorChain chain;
}
