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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one frame through a processor chain. Callers branch on
 * {@link #isSuccess()}; a non-success result can be turned into a JSON-RPC
 * error envelope with
 * {@link me.golemcore.proxy.domain.processor.McpErrorFormatter}.
 */
@Data
@Builder
public class ChainResult {

    private int status;
    private ObjectNode payload;
    private String error;

    @Builder.Default
    private List<String> processorChain = new ArrayList<>();

    @Builder.Default
    private Map<String, JsonNode> metadata = new LinkedHashMap<>();

    public boolean isSuccess() {
        return status < 400;
    }
}
