package me.golemcore.proxy.domain.processor;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.proxy.domain.model.ChainResult;

import java.util.Map;

/**
 * Turns a rejected or failed {@link ChainResult} into a JSON-RPC 2.0 error
 * response addressed to the original request id.
 *
 * <pre>
 * {"jsonrpc":"2.0","id":1,"error":{"code":-32001,"message":"Request rejected by processor",
 *  "data":{"processor_chain":["validator"],"metadata":{},"rejection_reason":"..."}}}
 * </pre>
 */
public final class McpErrorFormatter {

    public static final int PROCESSING_FAILED_CODE = -32603;
    public static final int REJECTED_CODE = -32001;

    private McpErrorFormatter() {
    }

    public static ObjectNode format(ChainResult result, JsonNode requestId) {
        if (result.isSuccess()) {
            throw new IllegalArgumentException("successful chain results are not errors: status " + result.getStatus());
        }
        JsonNodeFactory factory = JsonNodeFactory.instance;

        ObjectNode data = factory.objectNode();
        ArrayNode chain = data.putArray("processor_chain");
        result.getProcessorChain().forEach(chain::add);
        ObjectNode metadata = data.putObject("metadata");
        for (Map.Entry<String, JsonNode> entry : result.getMetadata().entrySet()) {
            metadata.set(entry.getKey(), entry.getValue());
        }
        if (result.getError() != null) {
            data.put("rejection_reason", result.getError());
        }

        return envelope(requestId, result.getStatus() >= 500 ? PROCESSING_FAILED_CODE : REJECTED_CODE,
                result.getStatus() >= 500 ? "Request processing failed" : "Request rejected by processor", data);
    }

    /**
     * Builds a bare error response, used when no chain result exists (for
     * example when the downstream server is unreachable).
     */
    public static ObjectNode envelope(JsonNode requestId, int code, String message, JsonNode data) {
        ObjectNode envelope = JsonNodeFactory.instance.objectNode();
        envelope.put("jsonrpc", "2.0");
        envelope.set("id", requestId != null ? requestId : NullNode.getInstance());
        ObjectNode error = envelope.putObject("error");
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", data);
        }
        return envelope;
    }
}
