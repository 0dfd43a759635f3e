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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.BatchResult;
import me.golemcore.proxy.domain.model.ChainResult;
import me.golemcore.proxy.domain.model.ConnectionContext;
import me.golemcore.proxy.domain.model.MessageType;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorInput;
import me.golemcore.proxy.domain.model.ProcessorMetadata;
import me.golemcore.proxy.domain.model.ProcessorOutput;
import me.golemcore.proxy.domain.model.Transport;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of processors applied to the frames of one relay.
 *
 * <p>
 * Each enabled processor receives the working payload produced by its
 * predecessor together with the names of the processors that already ran and
 * the untouched original payload. Execution stops at the first processor that
 * rejects the frame (status 400 and above) or cannot be run at all (reported
 * as 500). The processor that stopped the chain is the last entry of the
 * returned run history, so later processors never appear in it.
 *
 * <p>
 * A chain is immutable and safe to share between the two forwarding loops of
 * a relay.
 */
@Slf4j
public class ProcessorChain {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Getter
    private final List<ProcessorConfig> processors;
    private final ProcessorExecutor executor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConnectionContext connection;

    public ProcessorChain(List<ProcessorConfig> processors, ProcessorExecutor executor, ObjectMapper objectMapper,
            Clock clock, String serverName, Transport transport, String sessionId) {
        this.processors = List.copyOf(processors);
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.connection = ConnectionContext.builder()
                .serverName(serverName)
                .transport(transport)
                .sessionId(sessionId)
                .build();
    }

    /**
     * Whether at least one processor would run. Relays forward frames verbatim
     * when this is false.
     */
    public boolean hasProcessors() {
        return processors.stream().anyMatch(ProcessorConfig::isEnabled);
    }

    public ObjectNode parse(String rawJson) throws PayloadParseException {
        JsonNode node;
        try {
            node = objectMapper.readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("failed to parse payload: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new PayloadParseException("failed to parse payload: not a JSON object", null);
        }
        return (ObjectNode) node;
    }

    /**
     * Parses a frame that is either a single JSON-RPC message (an object) or a
     * batch (an array).
     */
    public JsonNode parseFrame(String rawJson) throws PayloadParseException {
        JsonNode node;
        try {
            node = objectMapper.readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("failed to parse payload: " + e.getOriginalMessage(), e);
        }
        if (node == null || !(node.isObject() || node.isArray())) {
            throw new PayloadParseException("failed to parse payload: not a JSON object or array", null);
        }
        return node;
    }

    public ChainResult execute(String rawJson) throws PayloadParseException {
        ObjectNode payload = parse(rawJson);
        return execute(MessageType.classify(payload), payload);
    }

    /**
     * Runs each object element of a batch through the chain on its own.
     * Elements that are not objects are forwarded untouched. A rejected
     * request is answered to the sender, a rejected notification is dropped
     * and any other rejected element is replaced by its error envelope.
     */
    public BatchResult executeBatch(ArrayNode batch) {
        ArrayNode forward = objectMapper.createArrayNode();
        ArrayNode replies = objectMapper.createArrayNode();
        List<ChainResult> rejections = new ArrayList<>();
        for (JsonNode element : batch) {
            if (!(element instanceof ObjectNode payload)) {
                forward.add(element);
                continue;
            }
            JsonNode id = payload.get("id");
            MessageType type = MessageType.classify(payload);
            ChainResult result = execute(type, payload);
            if (result.isSuccess()) {
                forward.add(result.getPayload());
                continue;
            }
            rejections.add(result);
            switch (type) {
            case REQUEST -> replies.add(McpErrorFormatter.format(result, id));
            case NOTIFICATION -> log.debug("[Chain] Batched notification dropped (status {})", result.getStatus());
            default -> forward.add(McpErrorFormatter.format(result, id));
            }
        }
        return BatchResult.builder()
                .forward(forward)
                .replies(replies)
                .rejections(rejections)
                .build();
    }

    public ChainResult execute(MessageType type, ObjectNode payload) {
        ObjectNode original = payload.deepCopy();
        ObjectNode working = payload;
        List<String> history = new ArrayList<>();
        Map<String, JsonNode> metadata = new LinkedHashMap<>();

        for (ProcessorConfig processor : processors) {
            if (!processor.isEnabled()) {
                continue;
            }
            ProcessorInput input = ProcessorInput.builder()
                    .type(type)
                    .timestamp(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(TIMESTAMP_FORMAT))
                    .connection(connection)
                    .payload(working)
                    .metadata(ProcessorMetadata.builder()
                            .processorChain(List.copyOf(history))
                            .originalPayload(original)
                            .build())
                    .build();

            ProcessorOutput output;
            try {
                output = executor.execute(processor, input);
            } catch (ProcessorExecutionException e) {
                log.warn("[Chain] Processor '{}' could not run: {}", processor.getName(), e.getMessage());
                return ChainResult.builder()
                        .status(500)
                        .payload(working)
                        .error(String.format("processor '%s' execution failed: %s",
                                processor.getName(), e.getMessage()))
                        .processorChain(history)
                        .metadata(metadata)
                        .build();
            }

            history.add(processor.getName());
            if (output.getMetadata() != null) {
                metadata.put(processor.getName(), output.getMetadata());
            }

            ObjectNode next = output.getPayload() instanceof ObjectNode rewritten ? rewritten : working;
            if (output.isRejected()) {
                log.debug("[Chain] Processor '{}' stopped the chain with status {}", processor.getName(),
                        output.getStatus());
                return ChainResult.builder()
                        .status(output.getStatus())
                        .payload(next)
                        .error(output.getError())
                        .processorChain(history)
                        .metadata(metadata)
                        .build();
            }
            working = next;
        }

        return ChainResult.builder()
                .status(200)
                .payload(working)
                .processorChain(history)
                .metadata(metadata)
                .build();
    }
}
