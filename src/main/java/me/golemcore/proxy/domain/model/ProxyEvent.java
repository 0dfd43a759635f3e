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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Structured activity record: relay lifecycle and frames passing through.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProxyEvent {

    private Instant timestamp;
    private EventKind kind;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("server_id")
    private String serverId;

    private Transport transport;
    private MessageDirection direction;

    @JsonProperty("message_type")
    private MessageType messageType;

    private boolean success;
    private String error;
    private String message;
    private String command;
    private List<String> args;
    private String endpoint;

    public enum EventKind {
        START, STOP, REQUEST, RESPONSE, SYSTEM
    }
}
