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

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document written to a processor's stdin. Built fresh for every processor
 * invocation.
 *
 * <pre>
 * {"type":"request","timestamp":"2026-01-01T10:00:00Z",
 *  "connection":{"server_name":"...","transport":"stdio","session_id":"..."},
 *  "payload":{...},
 *  "metadata":{"processor_chain":[...],"original_payload":{...}}}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorInput {

    private MessageType type;
    private String timestamp;
    private ConnectionContext connection;
    private ObjectNode payload;
    private ProcessorMetadata metadata;
}
