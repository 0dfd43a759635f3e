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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One framed JSON document travelling through a relay. The raw text is kept
 * as received; processors see a parsed copy.
 */
@Data
@Builder
public class ProxyMessage {

    private MessageDirection direction;
    private MessageType type;
    private String rawJson;
    private Transport transport;
    private String sessionId;

    // stdio only
    private String command;
    private List<String> args;
}
